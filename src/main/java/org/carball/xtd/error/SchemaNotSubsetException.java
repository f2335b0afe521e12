package org.carball.xtd.error;

public class SchemaNotSubsetException extends XtdException {

    public static final int EXIT_CODE = 91;

    public SchemaNotSubsetException(String message) {
        super(message);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
