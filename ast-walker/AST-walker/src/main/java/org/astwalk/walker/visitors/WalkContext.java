package org.astwalk.walker.visitors;

import org.astwalk.util.Utilities;

/** Position of a node during a walk.
 *
 * @param depth           Nesting depth; incremented at statement blocks and call arguments.
 * @param topLevelNumber  1-based index of the enclosing statement in the function body;
 *                        0 while no statement has been entered yet.
 * @param isTopLevel      True if the node is itself a statement of the function body.
 * @param read            False if the node is written (assignment target or parameter). */
public record WalkContext(int depth, int topLevelNumber, boolean isTopLevel, boolean read) {
    /** Context used for the root of a walk. */
    public static final WalkContext ROOT = new WalkContext(1, 0, false, true);

    public WalkContext {
        Utilities.enforce(depth >= 1, "Illegal depth " + depth);
        Utilities.enforce(topLevelNumber >= 0, "Illegal statement number " + topLevelNumber);
    }

    /** True if a statement list seen in this context is the body of a function. */
    public boolean isFunctionBody() {
        return this.topLevelNumber == 0;
    }

    /** Context for a child which is not a statement of the function body. */
    public WalkContext nested() {
        return new WalkContext(this.depth, this.topLevelNumber, false, this.read);
    }

    public WalkContext deeper() {
        return new WalkContext(this.depth + 1, this.topLevelNumber, false, this.read);
    }

    /** Context for a child which is written. */
    public WalkContext write() {
        return new WalkContext(this.depth, this.topLevelNumber, false, false);
    }

    /** Context for the statement with the specified number in the function body. */
    public WalkContext statement(int number) {
        Utilities.enforce(number > 0);
        return new WalkContext(this.depth, number, true, this.read);
    }

    @Override
    public String toString() {
        return "depth=" + this.depth +
                " top=" + this.topLevelNumber +
                " isTop=" + this.isTopLevel +
                " read=" + this.read;
    }
}
