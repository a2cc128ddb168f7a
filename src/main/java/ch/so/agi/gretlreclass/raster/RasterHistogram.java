package ch.so.agi.gretlreclass.raster;

import java.awt.Rectangle;
import java.io.IOException;
import java.nio.file.Path;

import ch.so.agi.gretlreclass.ReclassifySettings;
import ch.so.agi.gretlreclass.logging.LogEnvironment;
import ch.so.agi.gretlreclass.logging.ReclassLogger;
import ch.so.agi.gretlreclass.model.AreaOfInterest;

/**
 * Accumulates the value histogram of one band block by block, with the same
 * windowing as {@link WindowedRasterTransform}.
 */
public final class RasterHistogram {

    private RasterHistogram() {}

    /**
     * @param band zero-based band index
     * @param aoi  area to count, {@code null} for the whole raster
     */
    public static ValueHistogram compute(Path file, int band, AreaOfInterest aoi, ReclassifySettings settings)
            throws IOException {
        ReclassLogger log = LogEnvironment.getLogger(RasterHistogram.class);
        try (GeoTiffSource source = GeoTiffSource.open(file)) {
            source.requireCategoricalBand(band);
            Rectangle window = source.window(aoi);
            BlockLayout layout = BlockLayout.of(source, window, settings);
            log.debug("Histogram of " + file + " band " + (band + 1) + " window " + window + " in " + layout);
            ValueHistogram histogram = ValueHistogram.forDataType(source.getDataType());
            for (Rectangle block : layout.blocks()) {
                block.translate(window.x, window.y);
                histogram.add(source.readBand(block, band));
            }
            return histogram;
        }
    }
}
