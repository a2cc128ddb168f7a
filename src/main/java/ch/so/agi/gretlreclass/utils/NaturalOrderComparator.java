package ch.so.agi.gretlreclass.utils;

import java.util.Comparator;

/**
 * Compares strings so that embedded digit runs are ordered numerically
 * ({@code band2} before {@code band10}).
 */
public final class NaturalOrderComparator implements Comparator<String> {

    public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

    private NaturalOrderComparator() {}

    @Override
    public int compare(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (Character.isDigit(ca) && Character.isDigit(cb)) {
                int startA = i;
                int startB = j;
                while (i < a.length() && Character.isDigit(a.charAt(i))) i++;
                while (j < b.length() && Character.isDigit(b.charAt(j))) j++;
                String runA = stripLeadingZeros(a.substring(startA, i));
                String runB = stripLeadingZeros(b.substring(startB, j));
                if (runA.length() != runB.length()) {
                    return runA.length() - runB.length();
                }
                int cmp = runA.compareTo(runB);
                if (cmp != 0) {
                    return cmp;
                }
            } else {
                if (ca != cb) {
                    return ca - cb;
                }
                i++;
                j++;
            }
        }
        return (a.length() - i) - (b.length() - j);
    }

    private static String stripLeadingZeros(String digits) {
        int k = 0;
        while (k < digits.length() - 1 && digits.charAt(k) == '0') k++;
        return digits.substring(k);
    }
}
