package ch.so.agi.gretlreclass.utils;

/**
 * A remote round trip did not complete within its configured timeout.
 */
public class BackendTimeoutException extends ReclassifyException {

    public BackendTimeoutException(String message) {
        super(message);
    }

    public BackendTimeoutException(String sourceId, Stage stage, String message) {
        super(sourceId, stage, message);
    }

    public BackendTimeoutException(String sourceId, Stage stage, String message, Throwable cause) {
        super(sourceId, stage, message, cause);
    }
}
