package io.klinesync.archive;

/**
 * Raised for a symbol, type, interval or date range the archive cannot serve, before any network activity.
 */
public class InvalidConfigurationException extends RuntimeException {
    public InvalidConfigurationException(String message) {
        super(message);
    }

    public ErrorKind kind() {
        return ErrorKind.INVALID_CONFIGURATION;
    }
}
