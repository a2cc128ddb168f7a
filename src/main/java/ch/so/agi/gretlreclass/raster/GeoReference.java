package ch.so.agi.gretlreclass.raster;

import java.awt.Rectangle;
import java.util.List;

import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFField;

import org.locationtech.jts.geom.Envelope;

/**
 * North-up affine mapping between pixel corners and model coordinates, taken
 * from the GeoTIFF fields of a file.
 */
final class GeoReference {

    private static final int RASTER_TYPE_GEO_KEY = 1025;
    private static final int RASTER_PIXEL_IS_POINT = 2;

    private final double originX;
    private final double originY;
    private final double pixelWidth;
    private final double pixelHeight;

    GeoReference(double originX, double originY, double pixelWidth, double pixelHeight) {
        this.originX = originX;
        this.originY = originY;
        this.pixelWidth = pixelWidth;
        this.pixelHeight = pixelHeight;
    }

    /**
     * @return the mapping, {@code null} if the fields carry none or a rotated one
     */
    static GeoReference of(List<TIFFField> geoFields) {
        TIFFField transformation = find(geoFields, GeoTIFFTagSet.TAG_MODEL_TRANSFORMATION);
        TIFFField scale = find(geoFields, GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE);
        TIFFField tiePoint = find(geoFields, GeoTIFFTagSet.TAG_MODEL_TIE_POINT);
        GeoReference ref;
        if (transformation != null && transformation.getCount() >= 16) {
            double[] m = new double[16];
            for (int i = 0; i < m.length; i++) {
                m[i] = transformation.getAsDouble(i);
            }
            if (m[1] != 0 || m[4] != 0 || m[0] <= 0 || m[5] >= 0) {
                return null;
            }
            ref = new GeoReference(m[3], m[7], m[0], -m[5]);
        } else if (scale != null && scale.getCount() >= 2 && tiePoint != null && tiePoint.getCount() >= 6) {
            double sx = scale.getAsDouble(0);
            double sy = scale.getAsDouble(1);
            if (sx <= 0 || sy <= 0) {
                return null;
            }
            ref = new GeoReference(tiePoint.getAsDouble(3) - tiePoint.getAsDouble(0) * sx,
                    tiePoint.getAsDouble(4) + tiePoint.getAsDouble(1) * sy, sx, sy);
        } else {
            return null;
        }
        if (isPixelIsPoint(find(geoFields, GeoTIFFTagSet.TAG_GEO_KEY_DIRECTORY))) {
            ref = new GeoReference(ref.originX - ref.pixelWidth / 2, ref.originY + ref.pixelHeight / 2,
                    ref.pixelWidth, ref.pixelHeight);
        }
        return ref;
    }

    private static boolean isPixelIsPoint(TIFFField keys) {
        if (keys == null || keys.getCount() < 4) {
            return false;
        }
        int count = keys.getAsInt(3);
        for (int k = 0; k < count && 4 + k * 4 + 3 < keys.getCount(); k++) {
            int entry = 4 + k * 4;
            if (keys.getAsInt(entry) == RASTER_TYPE_GEO_KEY && keys.getAsInt(entry + 1) == 0) {
                return keys.getAsInt(entry + 3) == RASTER_PIXEL_IS_POINT;
            }
        }
        return false;
    }

    private static TIFFField find(List<TIFFField> fields, int tag) {
        for (TIFFField field : fields) {
            if (field.getTagNumber() == tag) {
                return field;
            }
        }
        return null;
    }

    /**
     * Pixel window covering {@code bounds}, clipped to a raster of the given size.
     * Partially covered pixels are included.
     *
     * @return the window, empty if the bounds do not overlap the raster
     */
    Rectangle window(Envelope bounds, int width, int height) {
        double col0 = clamp(Math.floor((bounds.getMinX() - originX) / pixelWidth), width);
        double col1 = clamp(Math.ceil((bounds.getMaxX() - originX) / pixelWidth), width);
        double row0 = clamp(Math.floor((originY - bounds.getMaxY()) / pixelHeight), height);
        double row1 = clamp(Math.ceil((originY - bounds.getMinY()) / pixelHeight), height);
        return new Rectangle((int) col0, (int) row0, (int) (col1 - col0), (int) (row1 - row0));
    }

    private static double clamp(double value, int max) {
        return Math.max(0, Math.min(max, value));
    }

    double getOriginX() {
        return originX;
    }

    double getOriginY() {
        return originY;
    }

    double getPixelWidth() {
        return pixelWidth;
    }

    double getPixelHeight() {
        return pixelHeight;
    }
}
