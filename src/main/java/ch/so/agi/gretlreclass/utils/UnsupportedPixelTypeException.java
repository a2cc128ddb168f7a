package ch.so.agi.gretlreclass.utils;

/**
 * The source band has a pixel type that cannot be reclassified, e.g. floating
 * point samples.
 */
public class UnsupportedPixelTypeException extends ReclassifyException {

    public UnsupportedPixelTypeException(String message) {
        super(message);
    }

    public UnsupportedPixelTypeException(String sourceId, Stage stage, String message) {
        super(sourceId, stage, message);
    }

    public UnsupportedPixelTypeException(String sourceId, Stage stage, String message, Throwable cause) {
        super(sourceId, stage, message, cause);
    }
}
