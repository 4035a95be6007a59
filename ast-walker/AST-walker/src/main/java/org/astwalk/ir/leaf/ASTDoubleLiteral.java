package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;

public final class ASTDoubleLiteral extends ASTLiteral {
    public final double value;

    public ASTDoubleLiteral(double value) {
        this.value = value;
    }

    @Override
    public Object getValue() {
        return this.value;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(Double.toString(this.value));
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("value", this.value);
        return result;
    }
}
