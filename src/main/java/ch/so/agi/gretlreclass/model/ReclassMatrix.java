package ch.so.agi.gretlreclass.model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ch.so.agi.gretlreclass.utils.DuplicateAssignmentException;
import ch.so.agi.gretlreclass.utils.SourceValues;
import ch.so.agi.gretlreclass.utils.Stage;
import ch.so.agi.gretlreclass.utils.UnknownSourceValueException;

/**
 * Frozen many-to-one reclassification matrix: destination class code to the
 * set of source values folded into it, plus the value assigned to everything
 * that is not mapped.
 * <p>
 * Instances are produced by {@link Builder}. Source values are stored in their
 * normalised form (see {@link SourceValues}). A frozen matrix may still contain
 * a source value in more than one bucket (e.g. when loaded from a hand edited
 * file); {@link #validate(Collection)} and {@link #invert()} reject that.
 * </p>
 */
public final class ReclassMatrix {

    public static final int DEFAULT_VALUE = 0;

    private final Map<Integer, Set<Object>> buckets;
    private final int defaultValue;
    private Map<Object, Integer> inverse;

    private ReclassMatrix(Map<Integer, Set<Object>> buckets, int defaultValue) {
        this.buckets = buckets;
        this.defaultValue = defaultValue;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Matrix that maps every integral value onto itself.
     */
    public static ReclassMatrix identity(Collection<?> values) {
        Builder builder = builder();
        for (Object value : values) {
            Integer code = SourceValues.asInt(value);
            if (code == null) {
                throw new IllegalArgumentException("Identity matrix needs integral values, got " + value);
            }
            builder.add(code, value);
        }
        return builder.build();
    }

    public Map<Integer, Set<Object>> getBuckets() {
        return buckets;
    }

    public int getDefaultValue() {
        return defaultValue;
    }

    public Set<Integer> destinationCodes() {
        return buckets.keySet();
    }

    /**
     * @return the union of all bucket members
     */
    public Set<Object> sourceValues() {
        Set<Object> all = new LinkedHashSet<>();
        for (Set<Object> members : buckets.values()) {
            all.addAll(members);
        }
        return all;
    }

    public boolean isEmpty() {
        return buckets.values().stream().allMatch(Set::isEmpty);
    }

    /**
     * Checks that no source value is assigned to two buckets.
     *
     * @throws DuplicateAssignmentException naming the first offending value
     */
    public void validateAssignments() {
        Map<Object, Integer> seen = new HashMap<>();
        for (Map.Entry<Integer, Set<Object>> bucket : buckets.entrySet()) {
            for (Object value : bucket.getValue()) {
                Integer previous = seen.putIfAbsent(value, bucket.getKey());
                if (previous != null) {
                    throw new DuplicateAssignmentException(null, Stage.VALIDATE, "Source value " + value
                            + " is assigned to both class " + previous + " and class " + bucket.getKey());
                }
            }
        }
    }

    /**
     * Checks the matrix against the values that exist in the active source.
     *
     * @param enumerated the values reported for the source
     * @throws UnknownSourceValueException  if a bucket member does not exist in the source
     * @throws DuplicateAssignmentException if a value is assigned twice
     */
    public void validate(Collection<?> enumerated) {
        Set<Object> known = new HashSet<>(SourceValues.normalizeAll(enumerated));
        for (Map.Entry<Integer, Set<Object>> bucket : buckets.entrySet()) {
            for (Object value : bucket.getValue()) {
                if (!known.contains(value)) {
                    throw new UnknownSourceValueException(null, Stage.VALIDATE, "Source value " + value
                            + " of class " + bucket.getKey() + " does not exist in the source");
                }
            }
        }
        validateAssignments();
    }

    /**
     * Source value to destination code. Pure and idempotent; computed once and cached.
     *
     * @throws DuplicateAssignmentException if a value is assigned twice
     */
    public synchronized Map<Object, Integer> invert() {
        if (inverse == null) {
            validateAssignments();
            Map<Object, Integer> map = new HashMap<>();
            for (Map.Entry<Integer, Set<Object>> bucket : buckets.entrySet()) {
                for (Object value : bucket.getValue()) {
                    map.put(value, bucket.getKey());
                }
            }
            inverse = Collections.unmodifiableMap(map);
        }
        return inverse;
    }

    /**
     * @param rawValue a source value in any representation
     * @return the destination code or the default value
     */
    public int lookup(Object rawValue) {
        Object key = SourceValues.normalize(rawValue);
        if (key == null) {
            return defaultValue;
        }
        return invert().getOrDefault(key, defaultValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReclassMatrix)) return false;
        ReclassMatrix that = (ReclassMatrix) o;
        return defaultValue == that.defaultValue && buckets.equals(that.buckets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(buckets, defaultValue);
    }

    @Override
    public String toString() {
        return "ReclassMatrix" + buckets + " default=" + defaultValue;
    }

    /**
     * Accumulates {@code (destination, source value)} assignments while a
     * matrix is being authored.
     * <p>
     * {@link #add(int, Object)} has last-write-wins semantics: re-adding a value
     * moves it to the new bucket. {@link #put(int, Collection)} appends raw
     * members without touching other buckets and is used when reading persisted
     * matrices, so duplicates survive until validation.
     * </p>
     */
    public static final class Builder {

        private final Map<Integer, Set<Object>> buckets = new LinkedHashMap<>();
        private int defaultValue = DEFAULT_VALUE;

        private Builder() {}

        /**
         * Ensures an (initially empty) bucket exists for the code.
         */
        public Builder bucket(int destinationCode) {
            buckets.computeIfAbsent(destinationCode, k -> new LinkedHashSet<>());
            return this;
        }

        public Builder add(int destinationCode, Object sourceValue) {
            Object value = requireValue(sourceValue);
            for (Map.Entry<Integer, Set<Object>> bucket : buckets.entrySet()) {
                if (bucket.getKey() != destinationCode) {
                    bucket.getValue().remove(value);
                }
            }
            bucket(destinationCode);
            buckets.get(destinationCode).add(value);
            return this;
        }

        public Builder addAll(int destinationCode, Object... sourceValues) {
            for (Object value : sourceValues) {
                add(destinationCode, value);
            }
            return this;
        }

        public Builder put(int destinationCode, Collection<?> sourceValues) {
            bucket(destinationCode);
            Set<Object> members = buckets.get(destinationCode);
            for (Object value : sourceValues) {
                members.add(requireValue(value));
            }
            return this;
        }

        /**
         * Removes the value from whichever bucket holds it.
         */
        public Builder remove(Object sourceValue) {
            Object value = SourceValues.normalize(sourceValue);
            for (Set<Object> members : buckets.values()) {
                members.remove(value);
            }
            return this;
        }

        public Builder defaultValue(int value) {
            this.defaultValue = value;
            return this;
        }

        public ReclassMatrix build() {
            Map<Integer, Set<Object>> frozen = new LinkedHashMap<>();
            for (Map.Entry<Integer, Set<Object>> bucket : buckets.entrySet()) {
                frozen.put(bucket.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(bucket.getValue())));
            }
            return new ReclassMatrix(Collections.unmodifiableMap(frozen), defaultValue);
        }

        private static Object requireValue(Object sourceValue) {
            Object value = SourceValues.normalize(sourceValue);
            if (value == null) {
                throw new IllegalArgumentException("Source value must not be null or blank");
            }
            return value;
        }
    }
}
