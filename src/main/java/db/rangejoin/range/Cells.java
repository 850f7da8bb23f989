package db.rangejoin.range;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Cell value helpers shared by trimming and key building.
 */
public final class Cells {
    private Cells() {}

    // Blank cells arrive as "" from a grid; null is treated the same way
    public static boolean isBlank(Object value) {
        return value == null || "".equals(value);
    }

    /**
     * Canonical text form of a cell, the one a generic script stringification produces:
     * integral numbers without a fraction, other numbers in plain decimal, booleans as true/false.
     * Blank and null cells become "".
     */
    public static String canonical(Object value) {
        if (value == null) return "";
        if (value instanceof String) return (String) value;
        if (value instanceof Boolean) return value.toString();
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) return "NaN";
            if (Double.isInfinite(d)) return d > 0 ? "Infinity" : "-Infinity";
            return plain(BigDecimal.valueOf(d));
        }
        if (value instanceof BigDecimal) return plain((BigDecimal) value);
        if (value instanceof Number) return plain(new BigDecimal(value.toString()));
        return String.valueOf(value);
    }

    private static String plain(BigDecimal d) {
        if (d.signum() == 0) return "0";
        return d.stripTrailingZeros().toPlainString();
    }
}
