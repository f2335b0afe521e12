package org.carball.xtd.error;

public class MalformedInputException extends XtdException {

    public static final int EXIT_CODE = 2;

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
