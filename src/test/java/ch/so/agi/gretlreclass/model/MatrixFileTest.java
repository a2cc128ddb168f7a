package ch.so.agi.gretlreclass.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ch.so.agi.gretlreclass.utils.DuplicateAssignmentException;
import ch.so.agi.gretlreclass.utils.ReclassifyException;
import ch.so.agi.gretlreclass.utils.Stage;

class MatrixFileTest {

    @TempDir
    Path tempDir;

    @Test
    void savedMatrixLoadsEqual() throws IOException {
        ReclassMatrix matrix = ReclassMatrix.builder().addAll(1, "forest, mixed", "forest").bucket(2).add(3, 12).build();
        Path file = tempDir.resolve("matrix.csv");

        MatrixFile.save(matrix, file);
        ReclassMatrix loaded = MatrixFile.load(file);

        assertEquals(matrix, loaded);
        assertEquals(Set.of(), loaded.getBuckets().get(2));
    }

    @Test
    void duplicatesSurviveLoading() throws IOException {
        Path file = Files.writeString(tempDir.resolve("dup.csv"), "1,A\n2,A,B\n");

        ReclassMatrix matrix = MatrixFile.load(file);

        assertEquals(Set.of("A"), matrix.getBuckets().get(1));
        assertEquals(Set.of("A", "B"), matrix.getBuckets().get(2));
        assertThrows(DuplicateAssignmentException.class, matrix::validateAssignments);
    }

    @Test
    void defaultValueIsApplied() throws IOException {
        Path file = Files.writeString(tempDir.resolve("m.csv"), "5,1,2\n");

        assertEquals(99, MatrixFile.load(file, 99).lookup(3));
    }

    @Test
    void nonIntegerCodeIsRejected() throws IOException {
        Path file = Files.writeString(tempDir.resolve("bad.csv"), "five,1\n");

        ReclassifyException e = assertThrows(ReclassifyException.class, () -> MatrixFile.load(file));
        assertEquals(Stage.VALIDATE, e.getStage());
    }
}
