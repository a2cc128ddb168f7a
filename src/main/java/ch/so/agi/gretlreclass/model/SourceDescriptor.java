package ch.so.agi.gretlreclass.model;

import java.nio.file.Path;
import java.util.Objects;

import ch.so.agi.gretlreclass.utils.ReclassifyException;
import ch.so.agi.gretlreclass.utils.Stage;

/**
 * Immutable description of what gets reclassified: backend kind, location
 * (file path or remote asset id), band / column and an optional
 * {@link AreaOfInterest}.
 * <p>
 * Bands of local rasters are addressed by their 1-based band number.
 * </p>
 */
public final class SourceDescriptor {

    private final SourceKind kind;
    private final String location;
    private final String bandOrColumn;
    private final AreaOfInterest areaOfInterest;

    public SourceDescriptor(SourceKind kind, String location, String bandOrColumn) {
        this(kind, location, bandOrColumn, null);
    }

    private SourceDescriptor(SourceKind kind, String location, String bandOrColumn, AreaOfInterest areaOfInterest) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.location = Objects.requireNonNull(location, "location");
        this.bandOrColumn = Objects.requireNonNull(bandOrColumn, "bandOrColumn");
        this.areaOfInterest = areaOfInterest;
    }

    public SourceDescriptor(SourceKind kind, String location, int band) {
        this(kind, location, Integer.toString(band));
    }

    public SourceKind getKind() {
        return kind;
    }

    public String getLocation() {
        return location;
    }

    public String getBandOrColumn() {
        return bandOrColumn;
    }

    /**
     * @return the area the run is restricted to, {@code null} for the whole source
     */
    public AreaOfInterest getAreaOfInterest() {
        return areaOfInterest;
    }

    /**
     * @return the location as a local path
     * @throws IllegalStateException for remote sources
     */
    public Path localPath() {
        if (kind.isRemote()) {
            throw new IllegalStateException("Remote source has no local path: " + location);
        }
        return Path.of(location);
    }

    /**
     * @return the zero-based band index of a local raster
     * @throws ReclassifyException if the band is not a positive integer
     */
    public int bandIndex() {
        try {
            int band = Integer.parseInt(bandOrColumn.trim());
            if (band >= 1) {
                return band - 1;
            }
        } catch (NumberFormatException e) {
            throw new ReclassifyException(location, Stage.VALIDATE,
                    "Raster band must be a 1-based band number: " + bandOrColumn, e);
        }
        throw new ReclassifyException(location, Stage.VALIDATE,
                "Raster band must be a 1-based band number: " + bandOrColumn);
    }

    public SourceDescriptor withBandOrColumn(String other) {
        return new SourceDescriptor(kind, location, other, areaOfInterest);
    }

    /**
     * @param aoi area to restrict the run to, {@code null} to process the whole source
     */
    public SourceDescriptor withAreaOfInterest(AreaOfInterest aoi) {
        return new SourceDescriptor(kind, location, bandOrColumn, aoi);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceDescriptor)) return false;
        SourceDescriptor that = (SourceDescriptor) o;
        return kind == that.kind && location.equals(that.location) && bandOrColumn.equals(that.bandOrColumn)
                && Objects.equals(areaOfInterest, that.areaOfInterest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, location, bandOrColumn, areaOfInterest);
    }

    @Override
    public String toString() {
        return kind + "(" + location + ", " + bandOrColumn + (areaOfInterest != null ? ", " + areaOfInterest : "")
                + ")";
    }
}
