package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;

/** A compiler-generated temporary, identified by a number. */
public final class ASTTempSymbol extends ASTLeaf {
    public final int id;

    public ASTTempSymbol(int id) {
        this.id = id;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("#s").append(this.id);
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("id", this.id);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return this.id == ((ASTTempSymbol) o).id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(this.id);
    }
}
