package ch.so.agi.gretlreclass.raster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Rectangle;
import java.util.List;

import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

class GeoReferenceTest {

    private static final GeoTIFFTagSet GEO = GeoTIFFTagSet.getInstance();

    private static TIFFField doubles(int tag, double... values) {
        return new TIFFField(GEO.getTag(tag), TIFFTag.TIFF_DOUBLE, values.length, values);
    }

    private static TIFFField keys(char... values) {
        return new TIFFField(GEO.getTag(GeoTIFFTagSet.TAG_GEO_KEY_DIRECTORY), TIFFTag.TIFF_SHORT, values.length,
                values);
    }

    @Test
    void scaleAndTiePointGiveCornerOrigin() {
        GeoReference ref = GeoReference.of(List.of(
                doubles(GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE, TestRasters.PIXEL_SCALE.clone()),
                doubles(GeoTIFFTagSet.TAG_MODEL_TIE_POINT, TestRasters.TIE_POINT.clone()),
                keys(TestRasters.GEO_KEYS.clone())));

        assertEquals(2600000.0, ref.getOriginX());
        assertEquals(1200000.0, ref.getOriginY());
        assertEquals(2.0, ref.getPixelWidth());
        assertEquals(2.0, ref.getPixelHeight());
    }

    @Test
    void pixelIsPointMovesOriginHalfAPixel() {
        char[] pointKeys = TestRasters.GEO_KEYS.clone();
        pointKeys[11] = 2;

        GeoReference ref = GeoReference.of(List.of(
                doubles(GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE, TestRasters.PIXEL_SCALE.clone()),
                doubles(GeoTIFFTagSet.TAG_MODEL_TIE_POINT, TestRasters.TIE_POINT.clone()),
                keys(pointKeys)));

        assertEquals(2599999.0, ref.getOriginX());
        assertEquals(1200001.0, ref.getOriginY());
    }

    @Test
    void rotatedTransformationIsNotSupported() {
        double[] rotated = {1, 0.5, 0, 2600000, 0.5, -1, 0, 1200000, 0, 0, 0, 0, 0, 0, 0, 1};

        assertNull(GeoReference.of(List.of(doubles(GeoTIFFTagSet.TAG_MODEL_TRANSFORMATION, rotated))));
        assertNull(GeoReference.of(List.of()), "No georeferencing at all");
    }

    @Test
    void windowIncludesPartiallyCoveredPixelsAndIsClipped() {
        GeoReference ref = new GeoReference(0, 100, 10, 10);

        assertEquals(new Rectangle(1, 2, 2, 3), ref.window(new Envelope(15, 25, 52, 78), 10, 10));
        assertEquals(new Rectangle(0, 0, 10, 10), ref.window(new Envelope(-50, 500, -50, 500), 10, 10));
        assertTrue(ref.window(new Envelope(200, 300, 0, 100), 10, 10).isEmpty(), "Disjoint bounds");
    }
}
