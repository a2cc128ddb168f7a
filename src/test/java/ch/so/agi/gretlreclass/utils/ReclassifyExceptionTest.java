package ch.so.agi.gretlreclass.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReclassifyExceptionTest {

    @TempDir
    Path tempDir;

    @Test
    void messageNamesStageAndSource() {
        ReclassifyException e = new ReclassifyException("a.tif", Stage.TRANSFORM, "disk full");

        assertEquals("[transform] a.tif: disk full", e.getMessage());
    }

    @Test
    void contextFillsOnlyMissingValues() {
        ReclassifyException e = new DuplicateAssignmentException(null, Stage.VALIDATE, "dup");

        e.withContext("b.shp", Stage.TRANSFORM);

        assertEquals("b.shp", e.getSourceId());
        assertEquals(Stage.VALIDATE, e.getStage());
        assertEquals("[validate] b.shp: dup", e.getMessage());
    }

    @Test
    void plainMessageWithoutContext() {
        assertEquals("plain", new ReclassifyException("plain").getMessage());
    }

    @Test
    void discardRemovesDirectoryTrees() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("staging/nested"));
        Files.writeString(dir.resolve("f.txt"), "x");
        IOException primary = new IOException("primary");

        AtomicFiles.discard(tempDir.resolve("staging"), primary);

        assertFalse(Files.exists(tempDir.resolve("staging")));
        assertEquals(0, primary.getSuppressed().length);
    }

    @Test
    void commitReplacesDestination() throws IOException {
        Path dest = Files.writeString(tempDir.resolve("out.txt"), "old");
        Path tmp = Files.writeString(AtomicFiles.temporarySibling(dest), "new");

        AtomicFiles.commit(tmp, dest);

        assertEquals("new", Files.readString(dest));
        assertTrue(Files.notExists(tmp));
    }
}
