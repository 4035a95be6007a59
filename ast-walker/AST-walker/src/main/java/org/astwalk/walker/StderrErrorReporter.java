package org.astwalk.walker;

import java.io.PrintStream;

/** Simple error reporter which reports problems to stderr. */
public class StderrErrorReporter implements IErrorReporter {
    final PrintStream stream;
    int errorCount = 0;

    public StderrErrorReporter(PrintStream stream) {
        this.stream = stream;
    }

    public StderrErrorReporter() {
        this(System.err);
    }

    @Override
    public void reportProblem(boolean warning, String errorType, String message) {
        this.stream.println((warning ? "WARNING " : "ERROR ") + errorType + ": " + message);
        if (!warning)
            this.errorCount++;
    }

    @Override
    public boolean hasErrors() {
        return this.errorCount > 0;
    }
}
