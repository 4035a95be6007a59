package org.astwalk.ir;

/** Describes how the children of a composite node are traversed.
 * Positions mentioned are 0-based. */
public enum RecursionRule {
    /** Children are [parameters, metadata, body].  Parameters are written,
     * metadata is not inspected, and the body starts a fresh statement numbering. */
    FUNCTION_DEF,
    /** A statement list that opens a new nesting level. */
    BLOCK,
    /** A sequence of nodes at the same nesting level. */
    SEQUENCE,
    /** Exactly two children: the target, which is written, and the value. */
    ASSIGNMENT,
    /** Exactly two children; only the first one is traversed. */
    FIRST,
    /** Exactly two children; only the second one is traversed. */
    SECOND,
    /** A function, not traversed if it is a plain symbol, followed by arguments. */
    CALL,
    /** Every child is traversed and must produce exactly one node. */
    ALL,
    /** Exactly two children, both traversed. */
    PAIR,
    /** Exactly two children: an element type, not traversed, and
     * a list of dimensions, traversed as a sequence. */
    ALLOC,
    /** The node is turned into a call of the copy routine and traversed as a call. */
    REQUEUE_AS_CALL,
    /** The node is offered to the callback but its children are never visited. */
    SKIP,
    /** The walker does not know how to traverse the node. */
    REJECT,
}
