package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;

import java.util.Objects;

/** A resolved field of a named value.  Unlike the '.' composite
 * node, the walker does not traverse the pieces of a field reference. */
public final class ASTFieldRef extends ASTLeaf {
    public final String value;
    public final String field;

    public ASTFieldRef(String value, String field) {
        this.value = value;
        this.field = field;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("getfield(")
                .append(this.value)
                .append(", :")
                .append(this.field)
                .append(")");
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("value", this.value);
        result.put("field", this.field);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ASTFieldRef that = (ASTFieldRef) o;
        return this.value.equals(that.value) && this.field.equals(that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.value, this.field);
    }
}
