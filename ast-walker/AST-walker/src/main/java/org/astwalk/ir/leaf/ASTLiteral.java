package org.astwalk.ir.leaf;

/** Base class for constant values. */
public abstract class ASTLiteral extends ASTLeaf {
    /** The boxed value of the literal. */
    public abstract Object getValue();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return this.getValue().equals(((ASTLiteral) o).getValue());
    }

    @Override
    public int hashCode() {
        return this.getValue().hashCode();
    }
}
