package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;

import java.util.Objects;

/** A reference to a name in the top-level scope of the program. */
public final class ASTTopRef extends ASTLeaf {
    public final String name;

    public ASTTopRef(String name) {
        this.name = name;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("top(" + this.name + ")");
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("name", this.name);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ASTTopRef that = (ASTTopRef) o;
        return this.name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.getClass(), this.name);
    }
}
