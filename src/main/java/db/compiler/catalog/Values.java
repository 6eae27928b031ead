package db.compiler.catalog;

import java.util.regex.Pattern;

/**
 * Helpers for cell values: Double for NUMBER, String for STRING, null when missing.
 */
public final class Values {
    // Plain decimal: optional sign, digits with optional fraction, optional exponent
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private Values() {}

    /** Canonical text of a cell. Whole numbers print without a fraction (22, not 22.0). */
    public static String text(Object value) {
        if (value == null) return "";
        if (value instanceof Double d) return numberText(d);
        if (value instanceof Number n) return numberText(n.doubleValue());
        return value.toString();
    }

    public static String numberText(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    /**
     * True when the text is a plain decimal number with a finite value. Rejects the words and
     * forms Double.parseDouble also takes ("NaN", "Infinity", hex, "12f", "5d").
     */
    public static boolean isNumeric(String s) {
        if (s == null || !DECIMAL.matcher(s).matches()) return false;
        return !Double.isInfinite(Double.parseDouble(s));
    }

    /** Numeric view of a cell, or null when it has none. Negative zero reads as zero. */
    public static Double toNumber(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            return d == 0.0 ? 0.0 : d;
        }
        if (value instanceof String s) {
            String t = s.trim();
            if (!isNumeric(t)) return null;
            double d = Double.parseDouble(t);
            return d == 0.0 ? 0.0 : d;
        }
        return null;
    }

    /** Lexical comparison by Unicode code point (String.compareTo compares UTF-16 units). */
    public static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) return Integer.compare(ca, cb);
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}
