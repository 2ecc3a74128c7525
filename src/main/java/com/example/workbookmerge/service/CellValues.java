package com.example.workbookmerge.service;

import java.math.BigDecimal;

/**
 * Canonical text form of cell values, used for row comparison.
 * Cells whose source representation coerces to the same text compare equal, so
 * {@code 5.0} (numeric) and {@code "5"} (text) match.
 * <p>
 * Text made only of whitespace counts as an empty cell. Any other text is kept verbatim,
 * surrounding whitespace included, so {@code " a"} and {@code "a"} differ.
 */
public final class CellValues {

    private CellValues() {
    }

    public static String canonical(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String) {
            String s = (String) value;
            return s.isBlank() ? "" : s;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                return "";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "Infinity" : "-Infinity";
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "true" : "false";
        }
        return value.toString();
    }

    public static boolean isBlank(Object value) {
        return canonical(value).isEmpty();
    }
}
