package org.astwalk.walker.errors;

import org.astwalk.ir.IASTNode;

import javax.annotation.Nullable;

/** Base class for exceptions which are thrown by the walker.
 * All of them are fatal: the tree being walked may have been partially
 * rewritten when the exception is thrown and must not be reused. */
public abstract class BaseWalkerException extends RuntimeException {
    /** Node that caused the error, if known. */
    @Nullable
    public final IASTNode astNode;

    protected BaseWalkerException(String message, @Nullable IASTNode astNode, @Nullable Throwable throwable) {
        super(message, throwable);
        this.astNode = astNode;
    }

    protected BaseWalkerException(String message, @Nullable IASTNode astNode) {
        this(message, astNode, null);
    }

    public abstract String getErrorKind();
}
