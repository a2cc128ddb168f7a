package ch.so.agi.gretlreclass.raster;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

import ch.so.agi.gretlreclass.model.ReclassMatrix;
import ch.so.agi.gretlreclass.utils.ClassCodeRangeException;
import ch.so.agi.gretlreclass.utils.Stage;

/**
 * Elementwise sample to class code lookup for 8-bit output.
 * <p>
 * Small key ranges use a direct table, wide ranges a sorted key array with
 * binary search. Only integral source values can match raster samples; other
 * matrix members are ignored.
 * </p>
 */
public final class PixelLookup {

    public static final int MAX_CODE = 255;
    private static final long MAX_DENSE_SPAN = 1 << 20;

    private final int defaultCode;
    private final byte[] table;
    private final int min;
    private final int[] keys;
    private final byte[] codes;

    private PixelLookup(int defaultCode, byte[] table, int min, int[] keys, byte[] codes) {
        this.defaultCode = defaultCode;
        this.table = table;
        this.min = min;
        this.keys = keys;
        this.codes = codes;
    }

    /**
     * @throws ClassCodeRangeException if the default value or a destination code does not fit into a byte
     */
    public static PixelLookup of(ReclassMatrix matrix, String sourceId) {
        requireByte(matrix.getDefaultValue(), "Default value", sourceId);
        for (Integer code : matrix.destinationCodes()) {
            requireByte(code, "Destination code", sourceId);
        }
        TreeMap<Integer, Integer> entries = new TreeMap<>();
        for (Map.Entry<Object, Integer> e : matrix.invert().entrySet()) {
            if (e.getKey() instanceof Long) {
                long key = (Long) e.getKey();
                if (key >= Integer.MIN_VALUE && key <= Integer.MAX_VALUE) {
                    entries.put((int) key, e.getValue());
                }
            }
        }
        int defaultCode = matrix.getDefaultValue();
        if (entries.isEmpty()) {
            return new PixelLookup(defaultCode, new byte[0], 0, null, null);
        }
        int min = entries.firstKey();
        long span = (long) entries.lastKey() - min + 1;
        if (span <= MAX_DENSE_SPAN) {
            byte[] table = new byte[(int) span];
            Arrays.fill(table, (byte) defaultCode);
            entries.forEach((k, v) -> table[k - min] = (byte) v.intValue());
            return new PixelLookup(defaultCode, table, min, null, null);
        }
        int[] keys = new int[entries.size()];
        byte[] codes = new byte[entries.size()];
        int i = 0;
        for (Map.Entry<Integer, Integer> e : entries.entrySet()) {
            keys[i] = e.getKey();
            codes[i] = (byte) e.getValue().intValue();
            i++;
        }
        return new PixelLookup(defaultCode, null, 0, keys, codes);
    }

    static void requireByte(int code, String what, String sourceId) {
        if (code < 0 || code > MAX_CODE) {
            throw new ClassCodeRangeException(sourceId, Stage.VALIDATE,
                    what + " " + code + " does not fit into an unsigned 8-bit raster (0.." + MAX_CODE + ")");
        }
    }

    public int lookup(int sample) {
        if (table != null) {
            long index = (long) sample - min;
            return index >= 0 && index < table.length ? table[(int) index] & 0xff : defaultCode;
        }
        int i = Arrays.binarySearch(keys, sample);
        return i >= 0 ? codes[i] & 0xff : defaultCode;
    }

    /**
     * Remaps {@code samples} into {@code out}.
     */
    public void apply(int[] samples, byte[] out) {
        for (int i = 0; i < samples.length; i++) {
            out[i] = (byte) lookup(samples[i]);
        }
    }
}
