package ch.so.agi.gretlreclass.utils;

/**
 * A destination class code does not fit into the output pixel type.
 */
public class ClassCodeRangeException extends ReclassifyException {

    public ClassCodeRangeException(String message) {
        super(message);
    }

    public ClassCodeRangeException(String sourceId, Stage stage, String message) {
        super(sourceId, stage, message);
    }

    public ClassCodeRangeException(String sourceId, Stage stage, String message, Throwable cause) {
        super(sourceId, stage, message, cause);
    }
}
