package ch.so.agi.gretlreclass.utils;

/**
 * A source value is assigned to more than one destination bucket.
 */
public class DuplicateAssignmentException extends ReclassifyException {

    public DuplicateAssignmentException(String message) {
        super(message);
    }

    public DuplicateAssignmentException(String sourceId, Stage stage, String message) {
        super(sourceId, stage, message);
    }

    public DuplicateAssignmentException(String sourceId, Stage stage, String message, Throwable cause) {
        super(sourceId, stage, message, cause);
    }
}
