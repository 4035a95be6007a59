package org.astwalk.walker.visitors;

import org.astwalk.ir.IASTNode;

import javax.annotation.Nullable;
import java.util.List;

/** Function invoked by the {@link ASTWalker} for every node of a tree.
 *
 * @param <T> Type of the data threaded through the walk; the walker never inspects it. */
@FunctionalInterface
public interface IWalkCallback<T> {
    /** Inspect and possibly replace a node.
     *
     * @param node            Node being visited.
     * @param data            The object given to {@link ASTWalker#walk}.
     * @param topLevelNumber  1-based index of the function body statement containing the node;
     *                        0 if the node is not inside the body.
     * @param isTopLevel      True if the node is a statement of the function body.
     * @param read            True if the node is read, false if it is written.
     * @return                null to let the walker traverse the node's children.
     *                        Otherwise the nodes which replace this node; the walker does not
     *                        traverse them.  Most positions accept exactly one node; statement
     *                        lists and argument lists also accept an empty list or several nodes. */
    @Nullable
    List<IASTNode> apply(IASTNode node, T data, int topLevelNumber, boolean isTopLevel, boolean read);
}
