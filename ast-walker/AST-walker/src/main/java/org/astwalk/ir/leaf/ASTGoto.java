package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;

/** Unconditional jump to a label. */
public final class ASTGoto extends ASTLeaf {
    public final int label;

    public ASTGoto(int label) {
        this.label = label;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("goto ").append(this.label);
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("label", this.label);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return this.label == ((ASTGoto) o).label;
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(this.label) + 1;
    }
}
