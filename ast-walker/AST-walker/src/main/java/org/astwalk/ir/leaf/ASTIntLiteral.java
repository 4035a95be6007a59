package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;

public final class ASTIntLiteral extends ASTLiteral {
    public final long value;

    public ASTIntLiteral(long value) {
        this.value = value;
    }

    @Override
    public Object getValue() {
        return this.value;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.value);
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("value", this.value);
        return result;
    }
}
