package ch.so.agi.gretlreclass.raster;

import java.awt.Image;
import java.awt.Point;
import java.awt.Rectangle;
import java.awt.image.ColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.DataBufferByte;
import java.awt.image.IndexColorModel;
import java.awt.image.PixelInterleavedSampleModel;
import java.awt.image.Raster;
import java.awt.image.RenderedImage;
import java.awt.image.SampleModel;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.Set;
import java.util.Vector;

/**
 * Single band 8-bit image whose pixels are computed on request: every region
 * asked for is read from the source band and remapped, nothing else is kept in
 * memory. The image writer pulls it block by block. The image covers a window
 * of the source; image coordinates start at the window origin.
 */
final class ReclassifiedImage implements RenderedImage {

    /**
     * Notified around every computed region.
     */
    interface BlockObserver {
        void beforeBlock(Rectangle region);

        void afterBlock(Rectangle region);
    }

    private final GeoTiffSource source;
    private final Rectangle window;
    private final int band;
    private final PixelLookup lookup;
    private final IndexColorModel colorModel;
    private final BlockLayout layout;
    private final SampleModel sampleModel;
    private final ValueHistogram histogram;
    private final BlockObserver observer;
    private final Set<Rectangle> counted = new HashSet<>();
    private long maxBufferPixels;

    ReclassifiedImage(GeoTiffSource source, Rectangle window, int band, PixelLookup lookup,
            IndexColorModel colorModel, BlockLayout layout, BlockObserver observer) {
        this.source = source;
        this.window = new Rectangle(window);
        this.band = band;
        this.lookup = lookup;
        this.colorModel = colorModel;
        this.layout = layout;
        this.observer = observer;
        this.sampleModel = new PixelInterleavedSampleModel(DataBuffer.TYPE_BYTE, layout.getBlockWidth(),
                layout.getBlockHeight(), 1, layout.getBlockWidth(), new int[] {0});
        this.histogram = ValueHistogram.forDataType(source.getDataType());
    }

    ValueHistogram getHistogram() {
        return histogram;
    }

    long getMaxBufferPixels() {
        return maxBufferPixels;
    }

    @Override
    public Raster getData(Rectangle rect) {
        Rectangle region = rect.intersection(getBounds());
        if (region.isEmpty()) {
            throw new IllegalArgumentException("Region outside of the image: " + rect);
        }
        observer.beforeBlock(region);
        Rectangle sourceRegion = new Rectangle(region);
        sourceRegion.translate(window.x, window.y);
        int[] samples;
        try {
            samples = source.readBand(sourceRegion, band);
        } catch (IOException e) {
            throw new UncheckedIOException("Reading " + sourceRegion + " of " + source.getPath() + " failed", e);
        }
        maxBufferPixels = Math.max(maxBufferPixels, samples.length);
        if (counted.add(region)) {
            histogram.add(samples);
        }
        byte[] out = new byte[samples.length];
        lookup.apply(samples, out);
        DataBufferByte buffer = new DataBufferByte(out, out.length);
        WritableRaster raster = Raster.createInterleavedRaster(buffer, region.width, region.height, region.width,
                1, new int[] {0}, new Point(region.x, region.y));
        observer.afterBlock(region);
        return raster;
    }

    private Rectangle getBounds() {
        return new Rectangle(0, 0, getWidth(), getHeight());
    }

    @Override
    public Raster getTile(int tileX, int tileY) {
        return getData(layout.block(tileX, tileY));
    }

    @Override
    public Raster getData() {
        return getData(getBounds());
    }

    @Override
    public WritableRaster copyData(WritableRaster raster) {
        Rectangle region = raster == null ? getBounds() : raster.getBounds();
        Raster data = getData(region);
        if (raster == null) {
            raster = data.createCompatibleWritableRaster(region.x, region.y, region.width, region.height);
        }
        raster.setRect(data);
        return raster;
    }

    @Override
    public Vector<RenderedImage> getSources() {
        return null;
    }

    @Override
    public Object getProperty(String name) {
        return Image.UndefinedProperty;
    }

    @Override
    public String[] getPropertyNames() {
        return null;
    }

    @Override
    public ColorModel getColorModel() {
        return colorModel;
    }

    @Override
    public SampleModel getSampleModel() {
        return sampleModel;
    }

    @Override
    public int getWidth() {
        return window.width;
    }

    @Override
    public int getHeight() {
        return window.height;
    }

    @Override
    public int getMinX() {
        return 0;
    }

    @Override
    public int getMinY() {
        return 0;
    }

    @Override
    public int getNumXTiles() {
        return layout.getNumXBlocks();
    }

    @Override
    public int getNumYTiles() {
        return layout.getNumYBlocks();
    }

    @Override
    public int getMinTileX() {
        return 0;
    }

    @Override
    public int getMinTileY() {
        return 0;
    }

    @Override
    public int getTileWidth() {
        return layout.getBlockWidth();
    }

    @Override
    public int getTileHeight() {
        return layout.getBlockHeight();
    }

    @Override
    public int getTileGridXOffset() {
        return 0;
    }

    @Override
    public int getTileGridYOffset() {
        return 0;
    }
}
