package ch.so.agi.gretlreclass.raster;

import java.nio.file.Path;

/**
 * What a finished {@link WindowedRasterTransform} run did.
 */
public final class TransformReport {

    private final Path output;
    private final BlockLayout layout;
    private final int blocksProcessed;
    private final long maxBufferPixels;
    private final ValueHistogram histogram;
    private final long outputBytes;

    TransformReport(Path output, BlockLayout layout, int blocksProcessed, long maxBufferPixels,
            ValueHistogram histogram, long outputBytes) {
        this.output = output;
        this.layout = layout;
        this.blocksProcessed = blocksProcessed;
        this.maxBufferPixels = maxBufferPixels;
        this.histogram = histogram;
        this.outputBytes = outputBytes;
    }

    public Path getOutput() {
        return output;
    }

    public BlockLayout getLayout() {
        return layout;
    }

    public int getBlocksProcessed() {
        return blocksProcessed;
    }

    /**
     * @return the largest number of pixels held in a single buffer during the run
     */
    public long getMaxBufferPixels() {
        return maxBufferPixels;
    }

    /**
     * @return source sample counts of the processed band
     */
    public ValueHistogram getHistogram() {
        return histogram;
    }

    public long getOutputBytes() {
        return outputBytes;
    }
}
