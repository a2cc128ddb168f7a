package ch.so.agi.gretlreclass.vector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ch.so.agi.gretlreclass.model.AreaOfInterest;

class ShapefileTableTest {

    @TempDir
    Path tempDir;

    @Test
    void dbfColumnsAreRead() throws IOException {
        Path shp = TestVectors.writeShapefile(tempDir.resolve("parcels.shp"), "A", "B", "C");

        AttributeTable table = AttributeTables.open(shp);

        assertEquals(VectorFormat.SHAPEFILE, table.getFormat());
        assertEquals(List.of("ID", "LANDUSE"), table.getColumnNames());
        assertTrue(table.hasColumn("landuse"), "dbf column names are case-insensitive");
        assertEquals(List.of("A", "B", "C"), table.column("LANDUSE"));
        assertEquals(List.of(1L, 2L, 3L), table.column("ID"));
    }

    @Test
    void writeCopiesGeometryAndAppendsColumn() throws IOException {
        Path shp = TestVectors.writeShapefile(tempDir.resolve("parcels.shp"), "A", "B", "C");
        Path out = Files.createDirectories(tempDir.resolve("out")).resolve("result.shp");

        AttributeTables.open(shp).writeWithColumn(out, "reclass", new int[] {1, 2, 2});

        assertEquals(-1L, Files.mismatch(shp, out), ".shp must be copied unchanged");
        assertEquals(-1L, Files.mismatch(tempDir.resolve("parcels.shx"), out.resolveSibling("result.shx")));
        assertTrue(Files.exists(out.resolveSibling("result.prj")));
        assertFalse(Files.exists(out.resolveSibling("result.shp.tmp")));
        List<Object> codes = TestVectors.readDbfColumn(out.resolveSibling("result.dbf"), "reclass");
        assertEquals(3, codes.size());
        assertEquals(0, new BigDecimal(2).compareTo((BigDecimal) codes.get(2)));
        assertEquals(List.of("A", "B", "C"), TestVectors.readDbfColumn(out.resolveSibling("result.dbf"), "LANDUSE"));
    }

    @Test
    void longColumnNamesAreRejected() throws IOException {
        Path shp = TestVectors.writeShapefile(tempDir.resolve("parcels.shp"), "A");
        AttributeTable table = AttributeTables.open(shp);

        assertThrows(IllegalArgumentException.class,
                () -> table.writeWithColumn(tempDir.resolve("o.shp"), "classification", new int[] {1}));
    }

    @Test
    void missingDbfIsReported() throws IOException {
        Path shp = Files.write(tempDir.resolve("lonely.shp"), new byte[100]);

        assertThrows(IOException.class, () -> AttributeTables.open(shp));
    }

    @Test
    void deletedRecordsKeepTheirPlace() throws IOException {
        Path shp = TestVectors.writeShapefile(tempDir.resolve("parcels.shp"), "A", "B", "C");
        TestVectors.markDeleted(tempDir.resolve("parcels.dbf"), 1);
        Path out = tempDir.resolve("result.shp");

        AttributeTable table = AttributeTables.open(shp);
        table.writeWithColumn(out, "reclass", new int[] {1, 0, 2});

        assertEquals(3, table.size(), "Deleted record must not shift the following ones");
        assertEquals(Arrays.asList("A", null, "C"), table.column("LANDUSE"));
        assertTrue(table.isDeleted(1));
        assertFalse(table.isDeleted(2));
        Path dbf = out.resolveSibling("result.dbf");
        assertEquals(3, TestVectors.dbfRecordCount(dbf));
        assertTrue(TestVectors.isDeleted(dbf, 1), "Deletion flag must be carried over");
        assertFalse(TestVectors.isDeleted(dbf, 2));
        assertEquals(List.of("A", "C"), TestVectors.readDbfColumn(dbf, "LANDUSE"));
    }

    @Test
    void shapefileMetadataIsCopied() throws IOException {
        Path shp = TestVectors.writeShapefile(tempDir.resolve("parcels.shp"), "A");
        Files.writeString(tempDir.resolve("parcels.shp.xml"), "<metadata/>");
        Files.writeString(tempDir.resolve("parcels_old.dbf"), "unrelated");
        Path out = Files.createDirectories(tempDir.resolve("out")).resolve("result.shp");

        AttributeTables.open(shp).writeWithColumn(out, "reclass", new int[] {1});

        assertEquals("<metadata/>", Files.readString(out.resolveSibling("result.shp.xml")));
        assertFalse(Files.exists(out.resolveSibling("result_old.dbf")));
    }

    @Test
    void areaOfInterestRewritesGeometryWithSelectedRecords() throws IOException {
        Path shp = TestVectors.writeShapefile(tempDir.resolve("parcels.shp"), "A", "B", "C", "D");
        Path out = tempDir.resolve("result.shp");

        AttributeTable table = AttributeTables.open(shp)
                .within(AreaOfInterest.ofBounds(2600005, 1200000, 2600025, 1200020));
        table.writeWithColumn(out, "reclass", new int[] {7, 8});

        assertEquals(2, table.size());
        assertEquals(List.of("B", "C"), table.column("LANDUSE"));
        byte[] main = Files.readAllBytes(out);
        assertEquals(100 + 2 * 28, main.length);
        ByteBuffer big = ByteBuffer.wrap(main);
        assertEquals(main.length / 2, big.getInt(24), "File length in 16 bit words");
        assertEquals(1, big.getInt(100), "Records are renumbered");
        assertEquals(2, big.getInt(128));
        ByteBuffer little = ByteBuffer.wrap(main).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(2600010.0, little.getDouble(36));
        assertEquals(1200005.0, little.getDouble(44));
        assertEquals(2600020.0, little.getDouble(52));
        assertEquals(1200010.0, little.getDouble(60));
        assertEquals(2600010.0, little.getDouble(112), "First kept point is B");
        byte[] index = Files.readAllBytes(out.resolveSibling("result.shx"));
        assertEquals(116, index.length);
        assertEquals(50, ByteBuffer.wrap(index).getInt(100));
        assertEquals(64, ByteBuffer.wrap(index).getInt(108));
        assertEquals(List.of("B", "C"), TestVectors.readDbfColumn(out.resolveSibling("result.dbf"), "LANDUSE"));
    }

    @Test
    void shapeCountMustMatchRecordCount() throws IOException {
        Path shp = TestVectors.writeShapefile(tempDir.resolve("parcels.shp"), "A", "B");
        Path other = TestVectors.writeShapefile(tempDir.resolve("other.shp"), "A");
        Files.copy(other, shp, StandardCopyOption.REPLACE_EXISTING);
        AttributeTable table = AttributeTables.open(shp);

        assertThrows(IOException.class, () -> table.within(AreaOfInterest.ofBounds(0, 0, 1, 1)));
    }
}
