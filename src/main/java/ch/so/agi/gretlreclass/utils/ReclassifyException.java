package ch.so.agi.gretlreclass.utils;

/**
 * Base class for all exceptions raised by the reclassification engine.
 * <p>
 * Every instance names the source that was being processed and the
 * {@link Stage} in which the failure happened, so the message is actionable
 * without looking at internals. Both may be attached after construction by the
 * executor ({@link #withContext(String, Stage)}) when a lower layer does not
 * know them.
 * </p>
 */
public class ReclassifyException extends RuntimeException {

    private String sourceId;
    private Stage stage;

    public ReclassifyException(String message) {
        super(message);
    }

    public ReclassifyException(String message, Throwable cause) {
        super(message, cause);
    }

    public ReclassifyException(String sourceId, Stage stage, String message) {
        super(message);
        this.sourceId = sourceId;
        this.stage = stage;
    }

    public ReclassifyException(String sourceId, Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
        this.stage = stage;
    }

    public String getSourceId() {
        return sourceId;
    }

    public Stage getStage() {
        return stage;
    }

    /**
     * Fills in source id and stage where they are still unknown. Values that
     * are already set win.
     *
     * @return this exception
     */
    public ReclassifyException withContext(String sourceId, Stage stage) {
        if (this.sourceId == null) {
            this.sourceId = sourceId;
        }
        if (this.stage == null) {
            this.stage = stage;
        }
        return this;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        if (sourceId == null && stage == null) {
            return message;
        }
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(stage != null ? stage.label() : "unknown").append(']');
        if (sourceId != null) {
            sb.append(' ').append(sourceId).append(':');
        }
        sb.append(' ').append(message);
        return sb.toString();
    }
}
