package ch.so.agi.gretlreclass.vector;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens the {@link AttributeTable} matching a file suffix.
 */
public final class AttributeTables {

    private AttributeTables() {}

    /**
     * @throws IOException if the file cannot be read or is not a supported vector format
     */
    public static AttributeTable open(Path file) throws IOException {
        VectorFormat format = VectorFormat.of(file);
        if (format == null) {
            throw new IOException("Not a supported vector file: " + file);
        }
        switch (format) {
        case SHAPEFILE:
            return ShapefileTable.load(file);
        case GEOJSON:
            return GeoJsonTable.load(file);
        default:
            throw new IllegalStateException("Unhandled format " + format);
        }
    }
}
