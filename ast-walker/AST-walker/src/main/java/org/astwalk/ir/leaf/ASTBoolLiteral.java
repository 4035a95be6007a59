package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;

public final class ASTBoolLiteral extends ASTLiteral {
    public static final ASTBoolLiteral TRUE = new ASTBoolLiteral(true);
    public static final ASTBoolLiteral FALSE = new ASTBoolLiteral(false);

    public final boolean value;

    private ASTBoolLiteral(boolean value) {
        this.value = value;
    }

    public static ASTBoolLiteral of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public Object getValue() {
        return this.value;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(Boolean.toString(this.value));
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("value", this.value);
        return result;
    }
}
