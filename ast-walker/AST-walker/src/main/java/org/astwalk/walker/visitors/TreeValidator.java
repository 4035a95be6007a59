package org.astwalk.walker.visitors;

import org.astwalk.ir.ASTExpr;
import org.astwalk.ir.ASTTuple;
import org.astwalk.ir.IASTNode;
import org.astwalk.util.IWritesLogs;
import org.astwalk.util.Logger;
import org.astwalk.walker.errors.SharedSubtreeError;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/** Checks that no composite node can be reached along two different paths.
 * Leaves are immutable and may be shared freely; condensed units are
 * expanded into fresh nodes, so they are not inspected. */
public class TreeValidator implements IWritesLogs {
    final Logger logger;
    final Set<ASTExpr> seen;

    public TreeValidator(Logger logger) {
        this.logger = logger;
        this.seen = Collections.newSetFromMap(new IdentityHashMap<>());
    }

    /** Validate a tree; throws {@link SharedSubtreeError} if the tree is a DAG.
     * @return The number of composite nodes in the tree. */
    public int validate(IASTNode root) {
        this.seen.clear();
        this.check(root);
        this.logger.belowLevel(this, 1)
                .append("Validated tree with ")
                .append(this.seen.size())
                .append(" composite nodes")
                .newline();
        return this.seen.size();
    }

    void check(IASTNode node) {
        if (node instanceof ASTExpr expr) {
            if (!this.seen.add(expr))
                throw new SharedSubtreeError(expr);
            for (IASTNode child: expr.getChildren())
                this.check(child);
        } else if (node instanceof ASTTuple tuple) {
            for (IASTNode element: tuple.getElements())
                this.check(element);
        }
    }
}
