package ch.so.agi.gretlreclass.raster;

import java.awt.image.DataBuffer;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per value pixel counts of an integral raster band. Byte and short bands use
 * a dense array, wider types a hash map.
 */
public final class ValueHistogram {

    private final long[] dense;
    private final int offset;
    private final Map<Integer, long[]> sparse;
    private long total;

    private ValueHistogram(long[] dense, int offset) {
        this.dense = dense;
        this.offset = offset;
        this.sparse = dense == null ? new HashMap<>() : null;
    }

    public static ValueHistogram forDataType(int dataType) {
        switch (dataType) {
        case DataBuffer.TYPE_BYTE:
            return new ValueHistogram(new long[256], 0);
        case DataBuffer.TYPE_USHORT:
            return new ValueHistogram(new long[65536], 0);
        case DataBuffer.TYPE_SHORT:
            return new ValueHistogram(new long[65536], -Short.MIN_VALUE);
        default:
            return new ValueHistogram(null, 0);
        }
    }

    public void add(int[] samples) {
        if (dense != null) {
            for (int sample : samples) {
                dense[sample + offset]++;
            }
        } else {
            for (int sample : samples) {
                sparse.computeIfAbsent(sample, k -> new long[1])[0]++;
            }
        }
        total += samples.length;
    }

    public long count(int value) {
        if (dense != null) {
            int index = value + offset;
            return index >= 0 && index < dense.length ? dense[index] : 0;
        }
        long[] c = sparse.get(value);
        return c == null ? 0 : c[0];
    }

    public long getTotal() {
        return total;
    }

    /**
     * @return values with a non-zero count, ascending, mapped to their count
     */
    public Map<Long, Long> counts() {
        Map<Long, Long> out = new TreeMap<>();
        if (dense != null) {
            for (int i = 0; i < dense.length; i++) {
                if (dense[i] > 0) {
                    out.put((long) (i - offset), dense[i]);
                }
            }
        } else {
            sparse.forEach((value, c) -> out.put((long) value, c[0]));
        }
        return out;
    }
}
