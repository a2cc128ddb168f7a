package ch.so.agi.gretlreclass.utils;

/**
 * A class table is malformed: duplicate codes, unparsable colors or no entries.
 */
public class InvalidClassTableException extends ReclassifyException {

    public InvalidClassTableException(String message) {
        super(message);
    }

    public InvalidClassTableException(String sourceId, Stage stage, String message) {
        super(sourceId, stage, message);
    }

    public InvalidClassTableException(String sourceId, Stage stage, String message, Throwable cause) {
        super(sourceId, stage, message, cause);
    }
}
