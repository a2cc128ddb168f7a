package ch.so.agi.gretlreclass.utils;

/**
 * The caller cancelled a running reclassification. Partial output has been
 * discarded.
 */
public class ReclassifyCancelledException extends ReclassifyException {

    public ReclassifyCancelledException(String message) {
        super(message);
    }

    public ReclassifyCancelledException(String sourceId, Stage stage, String message) {
        super(sourceId, stage, message);
    }

    public ReclassifyCancelledException(String sourceId, Stage stage, String message, Throwable cause) {
        super(sourceId, stage, message, cause);
    }
}
