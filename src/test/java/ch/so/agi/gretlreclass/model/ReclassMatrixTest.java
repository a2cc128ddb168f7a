package ch.so.agi.gretlreclass.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import ch.so.agi.gretlreclass.utils.DuplicateAssignmentException;
import ch.so.agi.gretlreclass.utils.Stage;
import ch.so.agi.gretlreclass.utils.UnknownSourceValueException;

class ReclassMatrixTest {

    @Test
    void inverseMapsEveryMember() {
        ReclassMatrix matrix = ReclassMatrix.builder().addAll(10, 1, 2).add(20, 3).addAll(30, 4, 5).build();

        Map<Object, Integer> inverse = matrix.invert();

        assertEquals(Map.of(1L, 10, 2L, 10, 3L, 20, 4L, 30, 5L, 30), inverse);
        assertSame(inverse, matrix.invert(), "inverse must be cached");
    }

    @Test
    void lookupFallsBackToDefault() {
        ReclassMatrix matrix = ReclassMatrix.builder().add(1, "A").defaultValue(9).build();

        assertEquals(1, matrix.lookup("A"));
        assertEquals(9, matrix.lookup("Z"));
        assertEquals(9, matrix.lookup(null));
        assertEquals(ReclassMatrix.DEFAULT_VALUE, ReclassMatrix.builder().build().getDefaultValue());
    }

    @Test
    void builderAddIsLastWriteWins() {
        ReclassMatrix matrix = ReclassMatrix.builder().add(1, "A").add(2, "A").build();

        assertEquals(Set.of(), matrix.getBuckets().get(1));
        assertEquals(Set.of("A"), matrix.getBuckets().get(2));
    }

    @Test
    void duplicateAssignmentFailsValidation() {
        ReclassMatrix matrix = ReclassMatrix.builder().put(1, List.of("A")).put(2, List.of("A", "B")).build();

        DuplicateAssignmentException e = assertThrows(DuplicateAssignmentException.class,
                () -> matrix.validate(List.of("A", "B")));
        assertEquals(Stage.VALIDATE, e.getStage());
        assertThrows(DuplicateAssignmentException.class, matrix::invert);
    }

    @Test
    void memberMissingFromSourceFailsValidation() {
        ReclassMatrix matrix = ReclassMatrix.builder().add(1, "A").add(2, "X").build();

        UnknownSourceValueException e = assertThrows(UnknownSourceValueException.class,
                () -> matrix.validate(List.of("A", "B")));
        assertTrue(e.getMessage().contains("X"), "message must name the value");
    }

    @Test
    void numericRepresentationsAreEquivalent() {
        ReclassMatrix matrix = ReclassMatrix.builder().add(1, "7").build();

        matrix.validate(List.of(7, 8.0d));
        assertEquals(1, matrix.lookup(7.0f));
    }

    @Test
    void removeDropsValueFromItsBucket() {
        ReclassMatrix matrix = ReclassMatrix.builder().addAll(1, "A", "B").remove("A").build();

        assertEquals(Set.of("B"), matrix.getBuckets().get(1));
    }

    @Test
    void identityKeepsValues() {
        ReclassMatrix matrix = ReclassMatrix.identity(List.of(3L, 4L));

        assertEquals(3, matrix.lookup(3));
        assertEquals(4, matrix.lookup("4"));
        assertThrows(IllegalArgumentException.class, () -> ReclassMatrix.identity(List.of("a")));
    }
}
