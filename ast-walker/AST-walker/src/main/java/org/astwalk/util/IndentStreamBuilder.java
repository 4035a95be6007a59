package org.astwalk.util;

/** An IndentStream which accumulates the output in memory. */
public class IndentStreamBuilder extends IndentStream {
    public IndentStreamBuilder() {
        super(new StringBuilder());
    }
}
