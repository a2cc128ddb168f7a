package ch.so.agi.gretlreclass.model;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Region a run is restricted to, in the coordinate reference system of the
 * source.
 * <p>
 * Local rasters are cut to the pixel window covering the bounds, local vector
 * datasets keep the features whose bounding box intersects the bounds. Remote
 * backends receive the geometry itself.
 * </p>
 */
public final class AreaOfInterest {

    private static final GeometryFactory FACTORY = new GeometryFactory();
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Geometry geometry;

    private AreaOfInterest(Geometry geometry) {
        this.geometry = geometry;
    }

    /**
     * @throws IllegalArgumentException for an empty geometry
     */
    public static AreaOfInterest of(Geometry geometry) {
        Objects.requireNonNull(geometry, "geometry");
        if (geometry.isEmpty()) {
            throw new IllegalArgumentException("Area of interest must not be empty");
        }
        return new AreaOfInterest(geometry);
    }

    public static AreaOfInterest ofBounds(double minX, double minY, double maxX, double maxY) {
        if (!(minX < maxX) || !(minY < maxY)) {
            throw new IllegalArgumentException("Invalid bounds " + minX + "," + minY + "," + maxX + "," + maxY);
        }
        return new AreaOfInterest(FACTORY.toGeometry(new Envelope(minX, maxX, minY, maxY)));
    }

    /**
     * Reads a GeoJSON geometry, feature or feature collection. All geometries
     * of a collection together form the area.
     */
    public static AreaOfInterest load(Path geojson) throws IOException {
        JsonNode root = MAPPER.readTree(geojson.toFile());
        List<JsonNode> nodes = new ArrayList<>();
        if (root != null) {
            String type = root.path("type").asText();
            if ("FeatureCollection".equals(type)) {
                for (JsonNode feature : root.path("features")) {
                    nodes.add(feature.get("geometry"));
                }
            } else if ("Feature".equals(type)) {
                nodes.add(root.get("geometry"));
            } else {
                nodes.add(root);
            }
        }
        GeoJsonReader reader = new GeoJsonReader(FACTORY);
        List<Geometry> geometries = new ArrayList<>();
        for (JsonNode node : nodes) {
            if (node == null || node.isNull()) {
                continue;
            }
            try {
                geometries.add(reader.read(node.toString()));
            } catch (ParseException e) {
                throw new IOException("Invalid GeoJSON geometry in " + geojson + ": " + e.getMessage(), e);
            }
        }
        Geometry geometry = FACTORY.buildGeometry(geometries);
        if (geometry.isEmpty()) {
            throw new IOException("No geometry in " + geojson);
        }
        return new AreaOfInterest(geometry);
    }

    public Geometry getGeometry() {
        return geometry;
    }

    public Envelope getBounds() {
        return geometry.getEnvelopeInternal();
    }

    /**
     * @param bounds bounding box of a feature, {@code null} for features without geometry
     */
    public boolean intersects(Envelope bounds) {
        return bounds != null && !bounds.isNull() && getBounds().intersects(bounds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AreaOfInterest)) return false;
        return geometry.equalsExact(((AreaOfInterest) o).geometry);
    }

    @Override
    public int hashCode() {
        return getBounds().hashCode();
    }

    @Override
    public String toString() {
        Envelope b = getBounds();
        return "AreaOfInterest(" + b.getMinX() + "," + b.getMinY() + "," + b.getMaxX() + "," + b.getMaxY() + ")";
    }
}
