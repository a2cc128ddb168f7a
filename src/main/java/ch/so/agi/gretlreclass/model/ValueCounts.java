package ch.so.agi.gretlreclass.model;

import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link MatrixSummary} from per value element counts reported by a
 * local strategy.
 */
public final class ValueCounts {

    private ValueCounts() {}

    /**
     * @param counts normalised source value to number of pixels / features holding it
     * @param nullCount elements without a value, they always receive the default
     */
    public static MatrixSummary summarize(ReclassMatrix matrix, Map<Object, Long> counts, long nullCount) {
        Map<Object, Integer> inverse = matrix.invert();
        int mapped = 0;
        int defaulted = 0;
        long defaultedElements = nullCount;
        long elements = nullCount;
        for (Map.Entry<Object, Long> entry : counts.entrySet()) {
            elements += entry.getValue();
            if (inverse.containsKey(entry.getKey())) {
                mapped++;
            } else {
                defaulted++;
                defaultedElements += entry.getValue();
            }
        }
        return new MatrixSummary(mapped, matrix.destinationCodes().size(), defaulted, defaultedElements, elements);
    }

    /**
     * Summary for remote sources where no per element counts are available.
     *
     * @param enumerated the enumerated source values, or {@code null} if the run did not enumerate
     */
    public static MatrixSummary summarizeRemote(ReclassMatrix matrix, Set<Object> enumerated) {
        Map<Object, Integer> inverse = matrix.invert();
        if (enumerated == null) {
            return new MatrixSummary(inverse.size(), matrix.destinationCodes().size(), 0, 0, -1);
        }
        int mapped = 0;
        int defaulted = 0;
        for (Object value : enumerated) {
            if (inverse.containsKey(value)) {
                mapped++;
            } else {
                defaulted++;
            }
        }
        return new MatrixSummary(mapped, matrix.destinationCodes().size(), defaulted, 0, -1);
    }
}
