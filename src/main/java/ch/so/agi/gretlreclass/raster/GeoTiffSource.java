package ch.so.agi.gretlreclass.raster;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import javax.imageio.stream.ImageInputStream;

import ch.so.agi.gretlreclass.model.AreaOfInterest;
import ch.so.agi.gretlreclass.utils.ReclassifyException;
import ch.so.agi.gretlreclass.utils.Stage;
import ch.so.agi.gretlreclass.utils.UnsupportedPixelTypeException;

/**
 * Read-only access to the first image of a (Geo)TIFF file, one rectangular
 * region at a time. Only the strips or tiles that intersect a requested region
 * are decoded.
 */
public class GeoTiffSource implements Closeable {

    static final int[] GEO_TAGS = {
            GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE,
            GeoTIFFTagSet.TAG_MODEL_TIE_POINT,
            GeoTIFFTagSet.TAG_MODEL_TRANSFORMATION,
            GeoTIFFTagSet.TAG_GEO_KEY_DIRECTORY,
            GeoTIFFTagSet.TAG_GEO_DOUBLE_PARAMS,
            GeoTIFFTagSet.TAG_GEO_ASCII_PARAMS
    };

    private final Path path;
    private final ImageInputStream stream;
    private final ImageReader reader;
    private final int width;
    private final int height;
    private final int numBands;
    private final int dataType;
    private final boolean tiled;
    private final int tileWidth;
    private final int tileHeight;
    private final int rowsPerStrip;
    private final List<TIFFField> geoFields;

    private GeoTiffSource(Path path, ImageInputStream stream, ImageReader reader) throws IOException {
        this.path = path;
        this.stream = stream;
        this.reader = reader;
        this.width = reader.getWidth(0);
        this.height = reader.getHeight(0);
        ImageTypeSpecifier type = reader.getRawImageType(0);
        if (type == null) {
            Iterator<ImageTypeSpecifier> types = reader.getImageTypes(0);
            type = types.hasNext() ? types.next() : null;
        }
        if (type == null) {
            throw new IOException("Cannot determine the pixel layout of " + path);
        }
        this.numBands = type.getSampleModel().getNumBands();
        this.dataType = type.getSampleModel().getDataType();
        this.tiled = reader.isImageTiled(0);
        this.tileWidth = reader.getTileWidth(0);
        this.tileHeight = reader.getTileHeight(0);

        IIOMetadata metadata = reader.getImageMetadata(0);
        List<TIFFField> fields = new ArrayList<>();
        int strip = height;
        if (metadata != null) {
            TIFFDirectory dir;
            try {
                dir = TIFFDirectory.createFromMetadata(metadata);
            } catch (IIOInvalidTreeException e) {
                throw new IOException("Unreadable TIFF directory in " + path, e);
            }
            for (int tag : GEO_TAGS) {
                TIFFField field = dir.getTIFFField(tag);
                if (field != null) {
                    fields.add(field);
                }
            }
            TIFFField rows = dir.getTIFFField(BaselineTIFFTagSet.TAG_ROWS_PER_STRIP);
            if (rows != null) {
                long value = rows.getAsLong(0);
                strip = value > 0 && value < height ? (int) value : height;
            }
        }
        this.rowsPerStrip = strip;
        this.geoFields = List.copyOf(fields);
    }

    /**
     * @throws IOException if the file cannot be opened or no image reader understands it
     */
    public static GeoTiffSource open(Path path) throws IOException {
        ImageInputStream stream = ImageIO.createImageInputStream(path.toFile());
        if (stream == null) {
            throw new IOException("Cannot open " + path);
        }
        Iterator<ImageReader> readers = ImageIO.getImageReaders(stream);
        if (!readers.hasNext()) {
            stream.close();
            throw new IOException("No image reader available for " + path);
        }
        ImageReader reader = readers.next();
        reader.setInput(stream, false, false);
        try {
            return new GeoTiffSource(path, stream, reader);
        } catch (IOException | RuntimeException e) {
            reader.dispose();
            stream.close();
            throw e;
        }
    }

    public Path getPath() {
        return path;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public long getPixelCount() {
        return (long) width * height;
    }

    public int getNumBands() {
        return numBands;
    }

    /**
     * @return one of the {@link DataBuffer} {@code TYPE_*} constants
     */
    public int getDataType() {
        return dataType;
    }

    public boolean isTiled() {
        return tiled;
    }

    public int getTileWidth() {
        return tileWidth;
    }

    public int getTileHeight() {
        return tileHeight;
    }

    /**
     * @return rows per strip of a striped file, the image height if the whole image is one strip
     */
    public int getRowsPerStrip() {
        return rowsPerStrip;
    }

    /**
     * @return the georeferencing fields (model transformation, tie points, geo keys) of the file
     */
    public List<TIFFField> getGeoFields() {
        return geoFields;
    }

    /**
     * Georeferencing fields of an image cut out of this one at {@code window}.
     * Tie points and the model transformation are moved to the window origin,
     * all other fields are kept.
     */
    public List<TIFFField> getGeoFields(Rectangle window) {
        if (window.x == 0 && window.y == 0) {
            return geoFields;
        }
        List<TIFFField> shifted = new ArrayList<>(geoFields.size());
        for (TIFFField field : geoFields) {
            if (field.getTagNumber() == GeoTIFFTagSet.TAG_MODEL_TIE_POINT) {
                double[] t = doubles(field);
                double[] scale = scale();
                if (t.length == 6 && scale != null) {
                    // single tie point, re-anchored at the window origin
                    t[3] += (window.x - t[0]) * scale[0];
                    t[4] -= (window.y - t[1]) * scale[1];
                    t[0] = 0;
                    t[1] = 0;
                } else {
                    for (int i = 0; i + 5 < t.length; i += 6) {
                        t[i] -= window.x;
                        t[i + 1] -= window.y;
                    }
                }
                shifted.add(new TIFFField(field.getTag(), TIFFTag.TIFF_DOUBLE, t.length, t));
            } else if (field.getTagNumber() == GeoTIFFTagSet.TAG_MODEL_TRANSFORMATION && field.getCount() >= 16) {
                double[] m = doubles(field);
                m[3] += window.x * m[0] + window.y * m[1];
                m[7] += window.x * m[4] + window.y * m[5];
                shifted.add(new TIFFField(field.getTag(), TIFFTag.TIFF_DOUBLE, m.length, m));
            } else {
                shifted.add(field);
            }
        }
        return shifted;
    }

    private double[] scale() {
        for (TIFFField field : geoFields) {
            if (field.getTagNumber() == GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE && field.getCount() >= 2) {
                return doubles(field);
            }
        }
        return null;
    }

    private static double[] doubles(TIFFField field) {
        double[] values = new double[field.getCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = field.getAsDouble(i);
        }
        return values;
    }

    /**
     * @param aoi area of interest, {@code null} for the whole raster
     * @return the pixel window covering the area, clipped to the raster
     * @throws ReclassifyException if the raster has no north-up georeferencing or lies outside the area
     */
    public Rectangle window(AreaOfInterest aoi) {
        Rectangle full = new Rectangle(0, 0, width, height);
        if (aoi == null) {
            return full;
        }
        GeoReference ref = GeoReference.of(geoFields);
        if (ref == null) {
            throw new ReclassifyException(path.toString(), Stage.VALIDATE,
                    "Raster has no north-up georeferencing, the area of interest cannot be applied");
        }
        Rectangle window = ref.window(aoi.getBounds(), width, height);
        if (window.isEmpty()) {
            throw new ReclassifyException(path.toString(), Stage.VALIDATE,
                    aoi + " does not overlap the raster");
        }
        return window;
    }

    /**
     * @throws UnsupportedPixelTypeException for floating point samples
     * @throws ReclassifyException           if the zero-based band does not exist
     */
    public void requireCategoricalBand(int band) {
        if (band < 0 || band >= numBands) {
            throw new ReclassifyException(path.toString(), Stage.VALIDATE,
                    "Band " + (band + 1) + " does not exist, the raster has " + numBands + " band(s)");
        }
        if (dataType == DataBuffer.TYPE_FLOAT || dataType == DataBuffer.TYPE_DOUBLE) {
            throw new UnsupportedPixelTypeException(path.toString(), Stage.VALIDATE,
                    "Floating point band " + (band + 1) + " cannot be reclassified");
        }
        if (dataType == DataBuffer.TYPE_UNDEFINED) {
            throw new UnsupportedPixelTypeException(path.toString(), Stage.VALIDATE,
                    "Unsupported sample type of band " + (band + 1));
        }
    }

    /**
     * Reads the samples of one band inside {@code region}, row by row.
     */
    public int[] readBand(Rectangle region, int band) throws IOException {
        ImageReadParam param = reader.getDefaultReadParam();
        param.setSourceRegion(region);
        BufferedImage image = reader.read(0, param);
        return image.getRaster().getSamples(0, 0, region.width, region.height, band, (int[]) null);
    }

    @Override
    public void close() throws IOException {
        reader.dispose();
        stream.close();
    }
}
