package org.astwalk.walker.errors;

import org.astwalk.ir.IASTNode;

/** A node whose representation is not one of those known to the walker. */
public final class UnsupportedLeafTypeError extends BaseWalkerException {
    public UnsupportedLeafTypeError(IASTNode node) {
        super("Unknown node representation " + node.getClass().getName() + ": " + node, node);
    }

    @Override
    public String getErrorKind() {
        return "Unsupported leaf type";
    }
}
