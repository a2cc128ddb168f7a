package ch.so.agi.gretlreclass.model;

/**
 * Diagnostic counts describing how a matrix was applied to a source.
 * <p>
 * {@code mappedValueCount} counts distinct source values found and mapped,
 * {@code defaultedValueCount} counts distinct source values that fell to the
 * default value and {@code defaultedElementCount} the pixels or features that
 * received it.
 * </p>
 */
public final class MatrixSummary {

    private final int mappedValueCount;
    private final int destinationCodeCount;
    private final int defaultedValueCount;
    private final long defaultedElementCount;
    private final long elementCount;

    public MatrixSummary(int mappedValueCount, int destinationCodeCount, int defaultedValueCount,
            long defaultedElementCount, long elementCount) {
        this.mappedValueCount = mappedValueCount;
        this.destinationCodeCount = destinationCodeCount;
        this.defaultedValueCount = defaultedValueCount;
        this.defaultedElementCount = defaultedElementCount;
        this.elementCount = elementCount;
    }

    public int getMappedValueCount() {
        return mappedValueCount;
    }

    public int getDestinationCodeCount() {
        return destinationCodeCount;
    }

    public int getDefaultedValueCount() {
        return defaultedValueCount;
    }

    public long getDefaultedElementCount() {
        return defaultedElementCount;
    }

    /**
     * @return pixels or features processed, {@code -1} for remote sources
     */
    public long getElementCount() {
        return elementCount;
    }

    @Override
    public String toString() {
        return "mapped=" + mappedValueCount + ", classes=" + destinationCodeCount + ", defaulted="
                + defaultedValueCount + " (" + defaultedElementCount + " of " + elementCount + " elements)";
    }
}
