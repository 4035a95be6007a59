package org.astwalk.walker.errors;

import org.astwalk.ir.IASTNode;

/** A mutable node is reachable along two different paths from the root.
 * The walker rewrites nodes in place, so it only accepts trees. */
public final class SharedSubtreeError extends BaseWalkerException {
    public SharedSubtreeError(IASTNode node) {
        super("Node appears multiple times in the tree: " + node, node);
    }

    @Override
    public String getErrorKind() {
        return "Shared subtree";
    }
}
