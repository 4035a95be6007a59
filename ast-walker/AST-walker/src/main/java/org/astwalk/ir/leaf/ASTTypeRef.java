package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.ir.ASTType;
import org.astwalk.util.IIndentStream;

/** A type used as a value, e.g., the element type of an allocation. */
public final class ASTTypeRef extends ASTLeaf {
    public final ASTType type;

    public ASTTypeRef(ASTType type) {
        this.type = type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.type);
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("type", this.type.name());
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return this.type.equals(((ASTTypeRef) o).type);
    }

    @Override
    public int hashCode() {
        return this.type.hashCode();
    }
}
