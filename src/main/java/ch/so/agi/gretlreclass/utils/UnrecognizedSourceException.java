package ch.so.agi.gretlreclass.utils;

/**
 * The source identifier matches none of the supported raster, vector or
 * remote asset kinds.
 */
public class UnrecognizedSourceException extends ReclassifyException {

    public UnrecognizedSourceException(String message) {
        super(message);
    }

    public UnrecognizedSourceException(String sourceId, Stage stage, String message) {
        super(sourceId, stage, message);
    }

    public UnrecognizedSourceException(String sourceId, Stage stage, String message, Throwable cause) {
        super(sourceId, stage, message, cause);
    }
}
