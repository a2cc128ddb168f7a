package ch.so.agi.gretlreclass.raster;

import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Path;
import java.util.function.IntBinaryOperator;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import javax.imageio.stream.ImageOutputStream;

/**
 * Writes small single band GeoTIFF fixtures.
 */
public final class TestRasters {

    public static final double[] PIXEL_SCALE = {2.0, 2.0, 0.0};
    public static final double[] TIE_POINT = {0, 0, 0, 2600000.0, 1200000.0, 0};
    /** Projected LV95 (EPSG:2056), pixel is area. */
    public static final char[] GEO_KEYS = {1, 1, 0, 3, 1024, 0, 1, 1, 1025, 0, 1, 1, 3072, 0, 1, 2056};

    private TestRasters() {}

    /**
     * @param tileSize 0 writes strips, otherwise square tiles of this size
     */
    public static Path write(Path file, int width, int height, int dataType, IntBinaryOperator pixel, int tileSize)
            throws IOException {
        BufferedImage image = image(width, height, dataType, pixel);
        ImageWriter writer = ImageIO.getImageWritersByFormatName("TIFF").next();
        try (ImageOutputStream out = ImageIO.createImageOutputStream(file.toFile())) {
            writer.setOutput(out);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (tileSize > 0) {
                param.setTilingMode(ImageWriteParam.MODE_EXPLICIT);
                param.setTiling(tileSize, tileSize, 0, 0);
            }
            IIOMetadata defaults = writer.getDefaultImageMetadata(new ImageTypeSpecifier(image), param);
            TIFFDirectory dir = TIFFDirectory.createFromMetadata(defaults);
            GeoTIFFTagSet geo = GeoTIFFTagSet.getInstance();
            dir.addTIFFField(new TIFFField(geo.getTag(GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE), TIFFTag.TIFF_DOUBLE,
                    PIXEL_SCALE.length, PIXEL_SCALE.clone()));
            dir.addTIFFField(new TIFFField(geo.getTag(GeoTIFFTagSet.TAG_MODEL_TIE_POINT), TIFFTag.TIFF_DOUBLE,
                    TIE_POINT.length, TIE_POINT.clone()));
            dir.addTIFFField(new TIFFField(geo.getTag(GeoTIFFTagSet.TAG_GEO_KEY_DIRECTORY), TIFFTag.TIFF_SHORT,
                    GEO_KEYS.length, GEO_KEYS.clone()));
            writer.write(null, new IIOImage(image, null, dir.getAsMetadata()), param);
        } finally {
            writer.dispose();
        }
        return file;
    }

    public static Path writeBytes(Path file, int[][] rows) throws IOException {
        return write(file, rows[0].length, rows.length, DataBuffer.TYPE_BYTE, (x, y) -> rows[y][x], 0);
    }

    private static BufferedImage image(int width, int height, int dataType, IntBinaryOperator pixel) {
        ColorModel cm = new ComponentColorModel(ColorSpace.getInstance(ColorSpace.CS_GRAY), false, false,
                Transparency.OPAQUE, dataType);
        WritableRaster raster = cm.createCompatibleWritableRaster(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (dataType == DataBuffer.TYPE_FLOAT) {
                    raster.setSample(x, y, 0, pixel.applyAsInt(x, y) + 0.5f);
                } else {
                    raster.setSample(x, y, 0, pixel.applyAsInt(x, y));
                }
            }
        }
        return new BufferedImage(cm, raster, false, null);
    }

    /**
     * Reads all samples of the first band, row by row.
     */
    public static int[] readSamples(Path file) throws IOException {
        BufferedImage image = ImageIO.read(file.toFile());
        return image.getRaster().getSamples(0, 0, image.getWidth(), image.getHeight(), 0, (int[]) null);
    }
}
