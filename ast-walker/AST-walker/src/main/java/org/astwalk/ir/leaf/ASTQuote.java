package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;

import java.util.Objects;

/** A quoted constant, stored in its printed form. */
public final class ASTQuote extends ASTLeaf {
    public final String value;

    public ASTQuote(String value) {
        this.value = value;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(":(" + this.value + ")");
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("value", this.value);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ASTQuote that = (ASTQuote) o;
        return this.value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.getClass(), this.value);
    }
}
