package org.carball.xtd.error;

/**
 * Mutually exclusive options were requested together, e.g. duplicate keys with a
 * max-columns threshold.
 */
public class ConfigurationConflictException extends XtdException {

    public static final int EXIT_CODE = 1;

    public ConfigurationConflictException(String message) {
        super(message);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
