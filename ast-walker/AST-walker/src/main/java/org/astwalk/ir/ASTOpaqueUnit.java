package org.astwalk.ir;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;

/** A function body stored in condensed form.  It has to be
 * expanded into a composite node before it can be traversed. */
public final class ASTOpaqueUnit extends ASTNode {
    /** Condensed representation of the body. */
    public final String payload;

    public ASTOpaqueUnit(String payload) {
        this.payload = payload;
    }

    @Override
    public ASTOpaqueUnit deepCopy() {
        return this;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("<condensed ")
                .append(this.payload.length())
                .append(" chars>");
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("payload", this.payload);
        return result;
    }
}
