package org.astwalk.ir.leaf;

import org.astwalk.ir.ASTNode;

/** An atomic IR value.  Leaves are immutable; the walker offers them
 * to the callback but never looks inside them. */
public abstract class ASTLeaf extends ASTNode {
    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public ASTLeaf deepCopy() {
        return this;
    }
}
