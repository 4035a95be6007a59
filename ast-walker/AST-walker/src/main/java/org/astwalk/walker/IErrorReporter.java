package org.astwalk.walker;

/** Interface for reporting errors. */
public interface IErrorReporter {
    /** Report a problem (error or warning).
     *
     * @param warning   If true, this is a warning.
     * @param errorType Type of error.
     * @param message   Message to report.
     */
    void reportProblem(boolean warning, String errorType, String message);

    default void reportError(String errorType, String message) {
        this.reportProblem(false, errorType, message);
    }

    default void reportWarning(String errorType, String message) {
        this.reportProblem(true, errorType, message);
    }

    /** True if any error (but not a warning) has been reported. */
    boolean hasErrors();
}
