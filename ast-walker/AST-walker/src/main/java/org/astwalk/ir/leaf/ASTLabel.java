package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;

/** A jump target. */
public final class ASTLabel extends ASTLeaf {
    public final int label;

    public ASTLabel(int label) {
        this.label = label;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.label).append(":");
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
        return this.label == ((ASTLabel) o).label;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(this.label);
    }
}
