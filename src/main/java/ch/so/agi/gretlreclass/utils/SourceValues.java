package ch.so.agi.gretlreclass.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Normalisation and ordering of source values.
 * <p>
 * Values reach the engine from very different places: raster samples, DBF
 * fields ({@link BigDecimal}), GeoJSON numbers, matrix files (plain text) and
 * remote backends. To compare them reliably every value is normalised first:
 * integral numbers and canonical integer strings become {@link Long}, other
 * numbers and canonical decimal strings become {@link Double}, everything else
 * becomes a trimmed {@link String}.
 * </p>
 */
public final class SourceValues {

    private static final double MAX_EXACT_DOUBLE = 9007199254740992d; // 2^53
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+(E-?\\d+)?");

    /**
     * Numbers first (ascending), then strings in natural order.
     */
    public static final Comparator<Object> ORDER = SourceValues::compare;

    private SourceValues() {}

    /**
     * @param raw value as delivered by a reader, may be {@code null}
     * @return the normalised value or {@code null} for {@code null} / blank input
     */
    public static Object normalize(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Long) {
            return raw;
        }
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger) {
            BigInteger bi = (BigInteger) raw;
            return bi.bitLength() < 64 ? (Object) bi.longValue() : bi.toString();
        }
        if (raw instanceof BigDecimal) {
            return normalizeDecimal((BigDecimal) raw);
        }
        if (raw instanceof Number) {
            double d = ((Number) raw).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) <= MAX_EXACT_DOUBLE) {
                return (long) d;
            }
            return d;
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        return parseText(text);
    }

    /**
     * Normalises every element of the collection, dropping {@code null}s.
     */
    public static List<Object> normalizeAll(Collection<?> raw) {
        List<Object> out = new ArrayList<>(raw.size());
        for (Object value : raw) {
            Object normalized = normalize(value);
            if (normalized != null) {
                out.add(normalized);
            }
        }
        return out;
    }

    /**
     * @return a new list holding the values in {@link #ORDER}
     */
    public static List<Object> sorted(Collection<?> values) {
        List<Object> out = new ArrayList<>(values);
        out.sort(ORDER);
        return out;
    }

    /**
     * @return the value as an {@code int} if it is an integral number in int range, otherwise {@code null}
     */
    public static Integer asInt(Object value) {
        Object normalized = normalize(value);
        if (normalized instanceof Long) {
            long l = (Long) normalized;
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                return (int) l;
            }
        }
        return null;
    }

    private static Object normalizeDecimal(BigDecimal bd) {
        BigDecimal stripped = bd.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            try {
                return stripped.longValueExact();
            } catch (ArithmeticException e) {
                return stripped.toPlainString();
            }
        }
        return stripped.doubleValue();
    }

    private static Object parseText(String text) {
        if (INTEGER.matcher(text).matches()) {
            BigInteger bi = new BigInteger(text);
            if (bi.bitLength() < 64 && bi.toString().equals(text)) {
                return bi.longValue();
            }
            return text;
        }
        if (DECIMAL.matcher(text).matches()) {
            double d = Double.parseDouble(text);
            if (Double.toString(d).equals(text)) {
                return d;
            }
        }
        return text;
    }

    private static int compare(Object a, Object b) {
        boolean aNumber = a instanceof Number;
        boolean bNumber = b instanceof Number;
        if (aNumber && bNumber) {
            int cmp = Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
            if (cmp != 0) {
                return cmp;
            }
            if (a instanceof Long && b instanceof Long) {
                return Long.compare((Long) a, (Long) b);
            }
            return Boolean.compare(a instanceof Double, b instanceof Double);
        }
        if (aNumber) {
            return -1;
        }
        if (bNumber) {
            return 1;
        }
        return NaturalOrderComparator.INSTANCE.compare(a.toString(), b.toString());
    }
}
