package ch.so.agi.gretlreclass.raster;

/**
 * Progress and cooperative cancellation hook of the windowed transform.
 * {@link #isCanceled()} is checked before every block.
 */
public interface RasterProgress {

    RasterProgress NONE = new RasterProgress() {};

    default void started(int blockCount) {
    }

    default void blockDone(int done, int blockCount) {
    }

    default boolean isCanceled() {
        return false;
    }
}
