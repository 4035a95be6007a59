package org.astwalk.walker.errors;

/** Thrown when the input given to the walker (a serialized tree,
 * or a command-line option) cannot be understood. */
public final class InputError extends BaseWalkerException {
    public InputError(String message) {
        super(message, null);
    }

    public InputError(String message, Throwable cause) {
        super(message, null, cause);
    }

    @Override
    public String getErrorKind() {
        return "Malformed input";
    }
}
