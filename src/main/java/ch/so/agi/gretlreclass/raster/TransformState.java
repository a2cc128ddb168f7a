package ch.so.agi.gretlreclass.raster;

/**
 * States of one {@link WindowedRasterTransform} run.
 */
public enum TransformState {
    /** Source opened, output not created yet. */
    OPENED,
    /** Reading the source block of the current window. */
    READING,
    /** Handing the remapped block to the writer. */
    WRITING,
    /** All blocks written, the writer finishes the directory carrying the color table. */
    COLORING,
    /** Temporary output complete, moving it into place. */
    COMMITTING,
    DONE,
    FAILED
}
