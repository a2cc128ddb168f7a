package ch.so.agi.gretlreclass.vector;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.locationtech.jts.geom.Envelope;

import ch.so.agi.gretlreclass.model.AreaOfInterest;

import ch.so.agi.gretlreclass.utils.AtomicFiles;
import ch.so.agi.gretlreclass.utils.SourceValues;

/**
 * GeoJSON {@code FeatureCollection} held as a Jackson tree. Everything except
 * the added property is written back as read; decimals are kept exact.
 */
public class GeoJsonTable implements AttributeTable {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));

    private final Path path;
    private final ObjectNode root;
    private final ArrayNode features;
    private final List<String> columnNames;

    private GeoJsonTable(Path path, ObjectNode root, ArrayNode features, List<String> columnNames) {
        this.path = path;
        this.root = root;
        this.features = features;
        this.columnNames = columnNames;
    }

    public static GeoJsonTable load(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        if (root == null || !root.isObject() || !"FeatureCollection".equals(root.path("type").asText())) {
            throw new IOException("Not a GeoJSON FeatureCollection: " + path);
        }
        JsonNode features = root.get("features");
        if (features == null || !features.isArray()) {
            throw new IOException("FeatureCollection without features array: " + path);
        }
        Set<String> names = new LinkedHashSet<>();
        for (JsonNode feature : features) {
            JsonNode properties = feature.get("properties");
            if (properties != null && properties.isObject()) {
                properties.fieldNames().forEachRemaining(names::add);
            }
        }
        return new GeoJsonTable(path, (ObjectNode) root, (ArrayNode) features, List.copyOf(names));
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public VectorFormat getFormat() {
        return VectorFormat.GEOJSON;
    }

    @Override
    public List<String> getColumnNames() {
        return columnNames;
    }

    @Override
    public boolean hasColumn(String name) {
        return columnNames.contains(name);
    }

    @Override
    public int size() {
        return features.size();
    }

    @Override
    public List<Object> column(String name) {
        List<Object> values = new ArrayList<>(features.size());
        for (JsonNode feature : features) {
            values.add(SourceValues.normalize(toJava(feature.path("properties").get(name))));
        }
        return values;
    }

    /**
     * Features without geometry are never selected. The selection keeps the
     * columns of the whole collection and drops its {@code bbox} member.
     */
    @Override
    public GeoJsonTable within(AreaOfInterest aoi) {
        ArrayNode kept = MAPPER.createArrayNode();
        for (JsonNode feature : features) {
            Envelope bounds = new Envelope();
            expand(bounds, feature.get("geometry"));
            if (aoi.intersects(bounds)) {
                kept.add(feature);
            }
        }
        ObjectNode selection = root.deepCopy();
        selection.remove("bbox");
        selection.set("features", kept);
        return new GeoJsonTable(path, selection, kept, columnNames);
    }

    private static void expand(Envelope bounds, JsonNode node) {
        if (node == null) {
            return;
        }
        if (node.isObject()) {
            expand(bounds, node.get("coordinates"));
            expand(bounds, node.get("geometries"));
        } else if (node.isArray()) {
            if (node.size() >= 2 && node.get(0).isNumber() && node.get(1).isNumber()) {
                bounds.expandToInclude(node.get(0).asDouble(), node.get(1).asDouble());
                return;
            }
            for (JsonNode child : node) {
                expand(bounds, child);
            }
        }
    }

    private static Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        return node.toString();
    }

    @Override
    public void writeWithColumn(Path destination, String column, int[] codes) throws IOException {
        if (codes.length != features.size()) {
            throw new IllegalArgumentException(codes.length + " codes for " + features.size() + " features");
        }
        ObjectNode copy = root.deepCopy();
        Iterator<JsonNode> it = copy.get("features").elements();
        int i = 0;
        while (it.hasNext()) {
            ObjectNode feature = (ObjectNode) it.next();
            JsonNode properties = feature.get("properties");
            ObjectNode target = properties != null && properties.isObject()
                    ? (ObjectNode) properties
                    : feature.putObject("properties");
            target.put(column, codes[i++]);
        }
        Path temporary = AtomicFiles.temporarySibling(destination);
        try {
            MAPPER.writeValue(temporary.toFile(), copy);
            AtomicFiles.commit(temporary, destination);
        } catch (IOException | RuntimeException e) {
            AtomicFiles.discard(temporary, e);
            throw e;
        }
    }
}
