package ch.so.agi.gretlreclass.remote;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.agi.gretlreclass.model.ClassEntry;
import ch.so.agi.gretlreclass.model.ClassTable;

/**
 * Builds the request payloads sent to the remote backend.
 */
public final class RemotePayloads {

    static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String VIS_PREFIX = "visualization_0_";
    public static final double MAX_PIXELS = 1e13;

    private RemotePayloads() {}

    /**
     * Per feature expression: look the value of {@code column} up in
     * {@code from}, write the matching {@code to} entry (or the default) into
     * {@code output}.
     */
    public static ObjectNode featureMapExpression(String column, String outputColumn, RemapRequest remap) {
        ObjectNode expression = MAPPER.createObjectNode();
        expression.put("operation", "remap");
        expression.put("input", column);
        expression.put("output", outputColumn);
        ArrayNode from = expression.putArray("from");
        for (Object value : remap.getFrom()) {
            if (value instanceof Long) {
                from.add((Long) value);
            } else if (value instanceof Double) {
                from.add((Double) value);
            } else {
                from.add(value.toString());
            }
        }
        ArrayNode to = expression.putArray("to");
        remap.getTo().forEach(to::add);
        expression.put("default", remap.getDefaultValue());
        return expression;
    }

    /**
     * Categorical display hints for a reclassified image. The first entry is
     * always {@code 0 / no_data / #000000}; a class table entry with code 0
     * does not repeat it.
     */
    public static Map<String, String> visualizationProperties(String band, ClassTable classTable) {
        StringBuilder values = new StringBuilder("0");
        StringBuilder labels = new StringBuilder("no_data");
        StringBuilder palette = new StringBuilder(ClassEntry.DEFAULT_COLOR);
        for (ClassEntry entry : classTable.getEntries()) {
            if (entry.getCode() == 0) {
                continue;
            }
            values.append(',').append(entry.getCode());
            labels.append(',').append(entry.getName());
            palette.append(',').append(entry.getColor());
        }
        Map<String, String> properties = new LinkedHashMap<>();
        properties.put(VIS_PREFIX + "name", "Classification");
        properties.put(VIS_PREFIX + "bands", band);
        properties.put(VIS_PREFIX + "type", "categorical");
        properties.put(VIS_PREFIX + "labels", labels.toString());
        properties.put(VIS_PREFIX + "palette", palette.toString());
        properties.put(VIS_PREFIX + "values", values.toString());
        return properties;
    }

    public static ObjectNode imageExportOptions(String destination) {
        ObjectNode options = MAPPER.createObjectNode();
        options.put("assetId", destination);
        options.put("description", description(destination));
        options.put("maxPixels", MAX_PIXELS);
        options.putObject("pyramidingPolicy").put(".default", "mode");
        return options;
    }

    public static ObjectNode tableExportOptions(String destination) {
        ObjectNode options = MAPPER.createObjectNode();
        options.put("assetId", destination);
        options.put("description", description(destination));
        return options;
    }

    static String description(String destination) {
        String name = destination;
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        return name;
    }
}
