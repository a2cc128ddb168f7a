package ch.so.agi.gretlreclass.utils;

/**
 * A matrix bucket references a source value that does not exist in the
 * enumerated values of the active source (stale matrix).
 */
public class UnknownSourceValueException extends ReclassifyException {

    public UnknownSourceValueException(String message) {
        super(message);
    }

    public UnknownSourceValueException(String sourceId, Stage stage, String message) {
        super(sourceId, stage, message);
    }

    public UnknownSourceValueException(String sourceId, Stage stage, String message, Throwable cause) {
        super(sourceId, stage, message, cause);
    }
}
