package org.astwalk.util;

import org.astwalk.walker.errors.InternalWalkerError;

/** Checked downcasts for IR nodes. */
public interface ICastable {
    /** Cast to the specified class; an unexpected class is an internal error. */
    default <T> T to(Class<T> clazz) {
        if (!clazz.isInstance(this))
            throw new InternalWalkerError(this + " is not an instance of " + clazz.getSimpleName());
        return clazz.cast(this);
    }

    default <T> boolean is(Class<T> clazz) {
        return clazz.isInstance(this);
    }
}
