package ch.so.agi.gretlreclass.steps;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.agi.gretlreclass.ReclassifySettings;
import ch.so.agi.gretlreclass.logging.LogEnvironment;
import ch.so.agi.gretlreclass.logging.RecordingLogFactory;
import ch.so.agi.gretlreclass.model.AreaOfInterest;
import ch.so.agi.gretlreclass.model.ClassEntry;
import ch.so.agi.gretlreclass.model.ClassTable;
import ch.so.agi.gretlreclass.model.ExecResult;
import ch.so.agi.gretlreclass.model.ReclassMatrix;
import ch.so.agi.gretlreclass.model.SourceDescriptor;
import ch.so.agi.gretlreclass.model.SourceKind;
import ch.so.agi.gretlreclass.raster.TestRasters;
import ch.so.agi.gretlreclass.utils.ReclassifyException;
import ch.so.agi.gretlreclass.utils.Stage;
import ch.so.agi.gretlreclass.vector.TestVectors;

class LocalReclassifyStepTest {

    @TempDir
    Path tempDir;

    private final ReclassifySettings settings = ReclassifySettings.defaults();
    private final ReclassMatrix scenarioB = ReclassMatrix.builder().add(1, "A").addAll(2, "B", "C").build();
    private RecordingLogFactory logs;

    @BeforeEach
    void captureLogs() {
        logs = new RecordingLogFactory();
        LogEnvironment.setLogFactory(logs);
    }

    @AfterEach
    void resetLogs() {
        LogEnvironment.setLogFactory(null);
    }

    @Test
    void geoJsonGetsTwoClassesAndKeepsGeometry() throws IOException, ParseException {
        Path source = TestVectors.writeGeoJson(tempDir.resolve("parcels.geojson"), "A", "B", "C", null, "D");
        Path dest = tempDir.resolve("parcels_reclass.geojson");

        ExecResult result = new VectorReclassifyStep("parcels", settings).execute(
                new SourceDescriptor(SourceKind.LOCAL_VECTOR, source.toString(), "landuse"), scenarioB, dest);

        ObjectMapper mapper = new ObjectMapper();
        JsonNode in = mapper.readTree(source.toFile()).get("features");
        JsonNode out = mapper.readTree(dest.toFile()).get("features");
        GeoJsonReader reader = new GeoJsonReader();
        Set<Integer> codes = new HashSet<>();
        for (int i = 0; i < in.size(); i++) {
            Geometry before = reader.read(in.get(i).get("geometry").toString());
            Geometry after = reader.read(out.get(i).get("geometry").toString());
            assertTrue(before.equalsExact(after), "geometry of feature " + i + " changed");
            assertEquals(in.get(i).get("properties").get("landuse"), out.get(i).get("properties").get("landuse"));
            codes.add(out.get(i).get("properties").get("reclass").asInt());
        }
        assertEquals(Set.of(0, 1, 2), codes, "missing and unmapped values get the default");
        assertEquals(3, result.getSummary().getMappedValueCount());
        assertEquals(1, result.getSummary().getDefaultedValueCount());
        assertEquals(2, result.getSummary().getDefaultedElementCount());
        assertEquals(Files.size(dest), result.getOutputBytes());
        assertEquals(1, logs.withPrefix("LIFECYCLE Finished VectorReclassifyStep(Name: parcels").size());
    }

    @Test
    void shapefileGetsTwoDistinctCodes() throws IOException {
        Path source = TestVectors.writeShapefile(tempDir.resolve("parcels.shp"), "A", "B", "C", "B");
        Path dest = tempDir.resolve("parcels_reclass.shp");

        new VectorReclassifyStep(settings).execute(
                new SourceDescriptor(SourceKind.LOCAL_VECTOR, source.toString(), "LANDUSE"), scenarioB, dest);

        List<Object> codes = TestVectors.readDbfColumn(tempDir.resolve("parcels_reclass.dbf"), "reclass");
        Set<Integer> distinct = codes.stream().map(c -> ((BigDecimal) c).intValue()).collect(Collectors.toSet());
        assertEquals(Set.of(1, 2), distinct);
        assertEquals(-1L, Files.mismatch(source, dest), "geometry must be copied unchanged");
        assertEquals(List.of("A", "B", "C", "B"), TestVectors.readDbfColumn(tempDir.resolve("parcels_reclass.dbf"), "LANDUSE"));
    }

    @Test
    void existingOutputColumnIsRejected() throws IOException {
        Path source = TestVectors.writeGeoJson(tempDir.resolve("parcels.geojson"), "A");
        ReclassifySettings idColumn = settings.toBuilder().outputColumn("id").build();
        Path dest = tempDir.resolve("out.geojson");

        ReclassifyException e = assertThrows(ReclassifyException.class, () -> new VectorReclassifyStep(idColumn)
                .execute(new SourceDescriptor(SourceKind.LOCAL_VECTOR, source.toString(), "landuse"), scenarioB, dest));
        assertEquals(Stage.VALIDATE, e.getStage());
        assertFalse(Files.exists(dest));
    }

    @Test
    void formatChangeIsRejected() throws IOException {
        Path source = TestVectors.writeGeoJson(tempDir.resolve("parcels.geojson"), "A");

        ReclassifyException e = assertThrows(ReclassifyException.class, () -> new VectorReclassifyStep(settings)
                .execute(new SourceDescriptor(SourceKind.LOCAL_VECTOR, source.toString(), "landuse"), scenarioB,
                        tempDir.resolve("out.shp")));
        assertEquals(Stage.VALIDATE, e.getStage());
    }

    @Test
    void rasterStepAnnouncesStartAndFinish() throws IOException {
        Path source = TestRasters.writeBytes(tempDir.resolve("in.tif"), new int[][] {{1, 2}, {3, 4}});
        ReclassMatrix matrix = ReclassMatrix.builder().addAll(1, 1, 2).addAll(2, 3, 4).build();
        ClassTable classes = ClassTable.of(new ClassEntry(1, "low", "#ffff00"), new ClassEntry(2, "high", "#ff0000"));

        ExecResult result = new RasterReclassifyStep("dem", settings).execute(
                new SourceDescriptor(SourceKind.LOCAL_RASTER, source.toString(), 1), matrix, classes,
                tempDir.resolve("out.tif"));

        assertEquals(4, result.getSummary().getElementCount());
        assertEquals(0, result.getSummary().getDefaultedElementCount());
        assertEquals(1, logs.withPrefix("LIFECYCLE Start RasterReclassifyStep(Name: dem").size());
        assertEquals(1, logs.withPrefix("LIFECYCLE Finished RasterReclassifyStep(Name: dem").size());
    }

    @Test
    void rasterStepRequiresGeoTiffDestination() throws IOException {
        Path source = TestRasters.writeBytes(tempDir.resolve("in.tif"), new int[][] {{1}});
        ClassTable classes = ClassTable.of(new ClassEntry(1, "one", null));

        ReclassifyException e = assertThrows(ReclassifyException.class, () -> new RasterReclassifyStep(settings)
                .execute(new SourceDescriptor(SourceKind.LOCAL_RASTER, source.toString(), 1),
                        ReclassMatrix.identity(List.of(1L)), classes, tempDir.resolve("out.png")));
        assertEquals(Stage.VALIDATE, e.getStage());
        assertFalse(Files.exists(tempDir.resolve("out.png")));
    }

    @Test
    void deletedShapefileRecordsStayAlignedWithTheirShapes() throws IOException {
        Path source = TestVectors.writeShapefile(tempDir.resolve("parcels.shp"), "A", "B", "C");
        TestVectors.markDeleted(tempDir.resolve("parcels.dbf"), 1);
        Path dest = tempDir.resolve("parcels_reclass.shp");

        ExecResult result = new VectorReclassifyStep(settings).execute(
                new SourceDescriptor(SourceKind.LOCAL_VECTOR, source.toString(), "LANDUSE"), scenarioB, dest);

        Path dbf = tempDir.resolve("parcels_reclass.dbf");
        assertEquals(3, TestVectors.dbfRecordCount(dbf), "one attribute record per shape");
        assertTrue(TestVectors.isDeleted(dbf, 1));
        assertEquals(List.of("A", "C"), TestVectors.readDbfColumn(dbf, "LANDUSE"));
        List<Integer> codes = TestVectors.readDbfColumn(dbf, "reclass").stream()
                .map(c -> ((BigDecimal) c).intValue()).collect(Collectors.toList());
        assertEquals(List.of(1, 2), codes, "C keeps its own code");
        assertEquals(2, result.getSummary().getElementCount(), "deleted records are not counted");
        assertEquals(0, result.getSummary().getDefaultedElementCount());
    }

    @Test
    void areaOfInterestLimitsVectorOutput() throws IOException {
        Path source = TestVectors.writeShapefile(tempDir.resolve("parcels.shp"), "A", "B", "C", "B");
        Path dest = tempDir.resolve("parcels_reclass.shp");
        SourceDescriptor descriptor = new SourceDescriptor(SourceKind.LOCAL_VECTOR, source.toString(), "LANDUSE")
                .withAreaOfInterest(AreaOfInterest.ofBounds(2600005, 1200000, 2600025, 1200020));

        ExecResult result = new VectorReclassifyStep(settings).execute(descriptor, scenarioB, dest);

        assertEquals(List.of("B", "C"), TestVectors.readDbfColumn(tempDir.resolve("parcels_reclass.dbf"), "LANDUSE"));
        assertEquals(2, result.getSummary().getElementCount());
        assertEquals(1, logs.withPrefix("INFO 2 of 4 records intersect").size());
    }

    @Test
    void areaWithoutRecordsWarns() throws IOException {
        Path source = TestVectors.writeGeoJsonPoints(tempDir.resolve("points.geojson"), "A", "B");
        SourceDescriptor descriptor = new SourceDescriptor(SourceKind.LOCAL_VECTOR, source.toString(), "landuse")
                .withAreaOfInterest(AreaOfInterest.ofBounds(0, 0, 1, 1));

        ExecResult result = new VectorReclassifyStep(settings).execute(descriptor, scenarioB,
                tempDir.resolve("out.geojson"));

        assertEquals(0, result.getSummary().getElementCount());
        assertEquals(1, logs.withPrefix("WARN No record of " + source).size());
    }

    @Test
    void codesWithoutClassEntryAreReported() throws IOException {
        Path source = TestRasters.writeBytes(tempDir.resolve("in.tif"), new int[][] {{1, 2}, {3, 4}});
        ReclassMatrix matrix = ReclassMatrix.builder().addAll(1, 1, 2).addAll(3, 3, 4).build();
        ClassTable classes = ClassTable.of(new ClassEntry(1, "low", "#ffff00"));

        new RasterReclassifyStep(settings).execute(new SourceDescriptor(SourceKind.LOCAL_RASTER, source.toString(), 1),
                matrix, classes, tempDir.resolve("out.tif"));

        assertEquals(1, logs.withPrefix("WARN Class codes [3] ").size(), logs.getMessages().toString());
    }
}
