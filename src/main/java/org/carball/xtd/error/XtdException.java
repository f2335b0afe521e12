package org.carball.xtd.error;

/**
 * Base class for the fatal errors of a conversion run. Each subtype maps to the
 * process exit code reported by the command line tool.
 */
public abstract class XtdException extends RuntimeException {

    protected XtdException(String message) {
        super(message);
    }

    protected XtdException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract int getExitCode();
}
