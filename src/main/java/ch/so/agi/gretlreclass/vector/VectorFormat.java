package ch.so.agi.gretlreclass.vector;

import java.nio.file.Path;

import ch.so.agi.gretlreclass.utils.DestinationNames;

/**
 * Supported local vector formats, recognised by file suffix.
 */
public enum VectorFormat {
    SHAPEFILE(".shp"),
    GEOJSON(".geojson");

    private final String extension;

    VectorFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * @return the format of the file, {@code null} if the suffix is not a vector suffix
     */
    public static VectorFormat of(Path file) {
        String ext = DestinationNames.extension(file);
        for (VectorFormat format : values()) {
            if (format.extension.equals(ext)) {
                return format;
            }
        }
        return null;
    }
}
