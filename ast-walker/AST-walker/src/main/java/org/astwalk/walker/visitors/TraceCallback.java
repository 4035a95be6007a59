package org.astwalk.walker.visitors;

import org.astwalk.ir.IASTNode;
import org.astwalk.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.List;

/** A callback which never rewrites anything; it prints every
 * node it is offered, together with its position, to the stream it is given. */
public class TraceCallback implements IWalkCallback<IIndentStream> {
    @Nullable
    @Override
    public List<IASTNode> apply(IASTNode node, IIndentStream stream,
                                int topLevelNumber, boolean isTopLevel, boolean read) {
        String text = node.toString();
        int newline = text.indexOf('\n');
        if (newline >= 0)
            text = text.substring(0, newline) + " ...";
        stream.append("[")
                .append(topLevelNumber)
                .append(isTopLevel ? " top" : "")
                .append(read ? "" : " write")
                .append("] ")
                .append(text)
                .newline();
        return null;
    }
}
