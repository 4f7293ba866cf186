package com.gbskill.engine.runtime;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Helpers for the loosely typed scalars found in DSL tables, extracted
 * attributes and benchmark expectations.
 */
public final class Scalars {

    private static final Pattern PLAIN_NUMBER = Pattern.compile("^\\d+(\\.\\d+)?$");

    private Scalars() {}

    /** True for numbers and for strings that parse as a decimal number. */
    public static boolean isNumeric(Object value) {
        return toDouble(value) != null;
    }

    /** Numeric value of a number or numeric string; null otherwise. */
    public static Double toDouble(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        if (value instanceof String s) {
            String t = s.trim();
            if (t.isEmpty()) return null;
            try {
                double d = Double.parseDouble(t);
                return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Equality that treats numbers by value, so 100 equals 100.0. Numbers never
     * equal strings.
     */
    public static boolean sameValue(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return x.doubleValue() == y.doubleValue();
        }
        return Objects.equals(a, b);
    }

    /**
     * Key comparison for table lookups: a numeric cell matches a number or a
     * numeric string of the same value, anything else compares as text.
     */
    public static boolean keyMatches(Object cell, Object key) {
        if (cell == null || key == null) return false;
        if (cell instanceof Number || key instanceof Number) {
            Double c = toDouble(cell);
            Double k = toDouble(key);
            return c != null && k != null && c.doubleValue() == k.doubleValue();
        }
        return cell.toString().equals(key.toString());
    }

    /**
     * Converts an all-digit string (one optional decimal part) to Integer,
     * Long or Double; any other value is returned unchanged.
     */
    public static Object coerceNumber(Object value) {
        if (!(value instanceof String s) || !PLAIN_NUMBER.matcher(s).matches()) {
            return value;
        }
        if (s.indexOf('.') >= 0) {
            return Double.valueOf(s);
        }
        try {
            long l = Long.parseLong(s);
            return (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) ? (Object) (int) l : (Object) l;
        } catch (NumberFormatException e) {
            return Double.valueOf(s);
        }
    }

    /** Text form used in names and descriptions; null renders as empty. */
    public static String text(Object value) {
        return value == null ? "" : value.toString();
    }
}
