package org.astwalk.util;

import java.util.function.Supplier;

/** Drops all data written; returned by the {@link Logger} for disabled levels. */
public class NullIndentStream implements IIndentStream {
    @Override
    public IIndentStream appendChar(char c) {
        return this;
    }

    @Override
    public IIndentStream appendFast(String string) {
        return this;
    }

    @Override
    public IIndentStream append(String string) {
        return this;
    }

    @Override
    public <T extends ToIndentableString> IIndentStream append(T value) {
        return this;
    }

    /** The supplier is never invoked. */
    @Override
    public IIndentStream appendSupplier(Supplier<String> supplier) {
        return this;
    }

    @Override
    public IIndentStream increase() {
        return this;
    }

    @Override
    public IIndentStream decrease() {
        return this;
    }
}
