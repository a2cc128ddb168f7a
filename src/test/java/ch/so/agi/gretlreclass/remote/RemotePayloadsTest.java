package ch.so.agi.gretlreclass.remote;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.agi.gretlreclass.model.ClassEntry;
import ch.so.agi.gretlreclass.model.ClassTable;
import ch.so.agi.gretlreclass.model.ReclassMatrix;

class RemotePayloadsTest {

    @Test
    void remapRequestIsSortedBySourceValue() {
        ReclassMatrix matrix = ReclassMatrix.builder().addAll(2, "B", "C").add(1, "A").add(3, 7).defaultValue(9).build();

        RemapRequest request = RemapRequest.of(matrix);

        assertEquals(List.of(7L, "A", "B", "C"), request.getFrom());
        assertEquals(List.of(3, 1, 2, 2), request.getTo());
        assertEquals(9, request.getDefaultValue());
    }

    @Test
    void featureExpressionCarriesLookupLists() {
        ReclassMatrix matrix = ReclassMatrix.builder().add(1, "A").addAll(2, 5, 2.5).build();

        ObjectNode expression = RemotePayloads.featureMapExpression("landuse", "reclass", RemapRequest.of(matrix));

        assertEquals("remap", expression.get("operation").asText());
        assertEquals("landuse", expression.get("input").asText());
        assertEquals("reclass", expression.get("output").asText());
        assertEquals("[2.5,5,\"A\"]", expression.get("from").toString());
        assertEquals("[2,2,1]", expression.get("to").toString());
        assertEquals(0, expression.get("default").asInt());
    }

    @Test
    void visualizationStartsWithNoData() {
        ClassTable table = ClassTable.of(new ClassEntry(0, "nothing", "#ffffff"), new ClassEntry(1, "forest", "#00ff00"),
                new ClassEntry(2, "water", "#0000ff"));

        Map<String, String> properties = RemotePayloads.visualizationProperties("remapped", table);

        assertEquals("Classification", properties.get("visualization_0_name"));
        assertEquals("remapped", properties.get("visualization_0_bands"));
        assertEquals("categorical", properties.get("visualization_0_type"));
        assertEquals("0,1,2", properties.get("visualization_0_values"));
        assertEquals("no_data,forest,water", properties.get("visualization_0_labels"));
        assertEquals("#000000,#00FF00,#0000FF", properties.get("visualization_0_palette"));
    }

    @Test
    void imageExportUsesModePyramiding() {
        ObjectNode options = RemotePayloads.imageExportOptions("users/me/landcover_reclass");

        assertEquals("users/me/landcover_reclass", options.get("assetId").asText());
        assertEquals("landcover_reclass", options.get("description").asText());
        assertEquals(1e13, options.get("maxPixels").asDouble());
        assertEquals("mode", options.get("pyramidingPolicy").get(".default").asText());
        assertEquals("landcover_reclass", RemotePayloads.tableExportOptions("a/landcover_reclass").get("description").asText());
    }
}
