package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;
import org.astwalk.util.Utilities;

public final class ASTStringLiteral extends ASTLiteral {
    public final String value;

    public ASTStringLiteral(String value) {
        this.value = value;
    }

    @Override
    public Object getValue() {
        return this.value;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(Utilities.doubleQuote(this.value));
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("value", this.value);
        return result;
    }
}
