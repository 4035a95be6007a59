package org.astwalk.walker.errors;

import org.astwalk.ir.IASTNode;

/** The body of a function definition is not a statement block after traversal. */
public final class MalformedFunctionBodyError extends BaseWalkerException {
    public MalformedFunctionBodyError(IASTNode function, IASTNode body) {
        super("Processing the body of a function produced a node which is not a block: " + body, function);
    }

    @Override
    public String getErrorKind() {
        return "Malformed function body";
    }
}
