package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;

/** The unit value. */
public final class ASTNothing extends ASTLeaf {
    public static final ASTNothing INSTANCE = new ASTNothing();

    private ASTNothing() {}

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("nothing");
    }

    @Override
    public ObjectNode asJson() {
        return this.jsonObject();
    }
}
