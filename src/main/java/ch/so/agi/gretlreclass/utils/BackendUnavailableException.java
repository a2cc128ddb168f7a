package ch.so.agi.gretlreclass.utils;

/**
 * The remote backend could not be reached or answered with an error.
 */
public class BackendUnavailableException extends ReclassifyException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String sourceId, Stage stage, String message) {
        super(sourceId, stage, message);
    }

    public BackendUnavailableException(String sourceId, Stage stage, String message, Throwable cause) {
        super(sourceId, stage, message, cause);
    }
}
