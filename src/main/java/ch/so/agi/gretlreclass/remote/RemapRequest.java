package ch.so.agi.gretlreclass.remote;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import ch.so.agi.gretlreclass.model.ReclassMatrix;
import ch.so.agi.gretlreclass.utils.SourceValues;

/**
 * Parallel {@code from} / {@code to} lists plus default, the shape in which the
 * remote backend expects a remap. Built from the inverted matrix, ordered by
 * source value so requests are reproducible.
 */
public final class RemapRequest {

    private final List<Object> from;
    private final List<Integer> to;
    private final int defaultValue;

    private RemapRequest(List<Object> from, List<Integer> to, int defaultValue) {
        this.from = Collections.unmodifiableList(from);
        this.to = Collections.unmodifiableList(to);
        this.defaultValue = defaultValue;
    }

    public static RemapRequest of(ReclassMatrix matrix) {
        Map<Object, Integer> inverse = matrix.invert();
        List<Object> from = SourceValues.sorted(inverse.keySet());
        List<Integer> to = new ArrayList<>(from.size());
        for (Object value : from) {
            to.add(inverse.get(value));
        }
        return new RemapRequest(from, to, matrix.getDefaultValue());
    }

    public List<Object> getFrom() {
        return from;
    }

    public List<Integer> getTo() {
        return to;
    }

    public int getDefaultValue() {
        return defaultValue;
    }

    public int size() {
        return from.size();
    }
}
