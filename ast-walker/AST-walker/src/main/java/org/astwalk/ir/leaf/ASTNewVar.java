package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;

import java.util.Objects;

/** Marks the point where a fresh binding for a variable is created. */
public final class ASTNewVar extends ASTLeaf {
    public final String name;

    public ASTNewVar(String name) {
        this.name = name;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("newvar(" + this.name + ")");
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
        ASTNewVar that = (ASTNewVar) o;
        return this.name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.getClass(), this.name);
    }
}
