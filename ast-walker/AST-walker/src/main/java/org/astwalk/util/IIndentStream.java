package org.astwalk.util;

import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/** A text sink which keeps track of the current indentation. */
@SuppressWarnings("UnusedReturnValue")
public interface IIndentStream {
    IIndentStream appendChar(char c);

    /** Append a string that does not contain a newline */
    IIndentStream appendFast(String string);

    /** Increase indentation and emit a newline. */
    IIndentStream increase();
    IIndentStream decrease();

    default IIndentStream append(String string) {
        int start = 0;
        int newline;
        while ((newline = string.indexOf('\n', start)) >= 0) {
            this.appendFast(string.substring(start, newline));
            this.newline();
            start = newline + 1;
        }
        return this.appendFast(string.substring(start));
    }

    default <T extends ToIndentableString> IIndentStream append(T value) {
        value.toString(this);
        return this;
    }

    default IIndentStream append(long value) {
        return this.appendFast(Long.toString(value));
    }

    /** For lazy evaluation of the argument. */
    default IIndentStream appendSupplier(Supplier<String> supplier) {
        return this.append(supplier.get());
    }

    default <T extends ToIndentableString> IIndentStream joinI(String separator, Collection<T> data) {
        boolean first = true;
        for (T d: data) {
            if (!first)
                this.append(separator);
            first = false;
            this.append(d);
        }
        return this;
    }

    /** Append each element on a separate line. */
    default <T extends ToIndentableString> IIndentStream lines(List<T> data) {
        for (int i = 0; i < data.size(); i++) {
            if (i > 0)
                this.newline();
            this.append(data.get(i));
        }
        return this;
    }

    default IIndentStream newline()  {
        return this.appendChar('\n');
    }
}
