package ch.so.agi.gretlreclass.vector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ch.so.agi.gretlreclass.model.AreaOfInterest;

class GeoJsonTableTest {

    @TempDir
    Path tempDir;

    @Test
    void columnsAndValuesAreRead() throws IOException {
        Path file = TestVectors.writeGeoJson(tempDir.resolve("parcels.geojson"), "A", null, "B");

        AttributeTable table = AttributeTables.open(file);

        assertEquals(VectorFormat.GEOJSON, table.getFormat());
        assertEquals(List.of("id", "landuse", "area"), table.getColumnNames());
        assertEquals(3, table.size());
        assertEquals(Arrays.asList("A", null, "B"), table.column("landuse"));
        assertEquals(List.of(1L, 2L, 3L), table.column("id"));
        assertEquals(12.5d, table.column("area").get(0));
    }

    @Test
    void writtenCopyKeepsDecimalsVerbatim() throws IOException {
        Path file = TestVectors.writeGeoJson(tempDir.resolve("parcels.geojson"), "A");
        Path out = tempDir.resolve("out.geojson");

        AttributeTables.open(file).writeWithColumn(out, "reclass", new int[] {4});

        String json = Files.readString(out);
        assertTrue(json.contains("12.50"), json);
        assertTrue(json.contains("2600000.125"), json);
        assertTrue(json.contains("\"reclass\":4"), json);
        assertFalse(Files.exists(tempDir.resolve("out.geojson.tmp")));
    }

    @Test
    void nonCollectionIsRejected() throws IOException {
        Path file = Files.writeString(tempDir.resolve("point.geojson"), "{\"type\":\"Point\",\"coordinates\":[1,2]}");

        assertThrows(IOException.class, () -> AttributeTables.open(file));
    }

    @Test
    void areaOfInterestSelectsIntersectingFeatures() throws IOException {
        Path file = TestVectors.writeGeoJsonPoints(tempDir.resolve("points.geojson"), "A", "B", "C", "D");
        Path out = tempDir.resolve("out.geojson");

        AttributeTable table = AttributeTables.open(file)
                .within(AreaOfInterest.ofBounds(2600005, 1200000, 2600025, 1200020));
        table.writeWithColumn(out, "reclass", new int[] {1, 2});

        assertEquals(2, table.size());
        assertEquals(List.of("B", "C"), table.column("landuse"));
        String json = Files.readString(out);
        assertFalse(json.contains("\"bbox\""), json);
        assertFalse(json.contains("\"A\""), json);
        assertTrue(json.contains("\"reclass\":2"), json);
        assertEquals(4, AttributeTables.open(file).size(), "Source stays untouched");
    }

    @Test
    void emptySelectionKeepsColumns() throws IOException {
        Path file = TestVectors.writeGeoJsonPoints(tempDir.resolve("points.geojson"), "A");

        AttributeTable table = AttributeTables.open(file).within(AreaOfInterest.ofBounds(0, 0, 1, 1));

        assertEquals(0, table.size());
        assertTrue(table.hasColumn("landuse"));
    }
}
