package ch.so.agi.gretlreclass.raster;

/**
 * The temporary output is incomplete. Never leaves this package: it is turned
 * into cleanup plus a {@link ch.so.agi.gretlreclass.utils.ReclassifyException}.
 */
class PartialWriteException extends Exception {

    private final TransformState state;

    PartialWriteException(TransformState state, Throwable cause) {
        super("Output incomplete, failed while " + state, cause);
        this.state = state;
    }

    TransformState getState() {
        return state;
    }
}
