package org.astwalk.walker.errors;

import org.astwalk.ir.IASTNode;

import java.util.List;

/** A position which can hold a single node received a different number of nodes
 * from the callback or from the recursive traversal. */
public final class NonSingletonResultError extends BaseWalkerException {
    /** The nodes that were produced. */
    public final List<IASTNode> produced;

    public NonSingletonResultError(String position, IASTNode node, List<IASTNode> produced) {
        super("Expected exactly one node for " + position + ", got " + produced.size() +
                System.lineSeparator() + node, node);
        this.produced = produced;
    }

    @Override
    public String getErrorKind() {
        return "Non-singleton result";
    }
}
