package com.architecture.patchgraph.service.parser;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Lenient numeric field handling: unparseable values fall back to a caller-supplied default
 * instead of failing the statement.
 */
public final class NumericFields {

    private static final double PLAIN_INTEGRAL_LIMIT = 1e15;

    private NumericFields() {
    }

    public static int parseInt(String value, int defaultValue) {
        Integer parsed = tryParseInt(value);
        return parsed != null ? parsed : defaultValue;
    }

    public static double parseDouble(String value, double defaultValue) {
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        char last = Character.toLowerCase(value.charAt(value.length() - 1));
        if (last == 'd' || last == 'f') {
            // Java accepts "1d" and "1f" but the patch format does not
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Returns the integer value of {@code value}, or {@code null} when it is not an integer.
     */
    public static Integer tryParseInt(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static int intAt(List<String> tokens, int index, int defaultValue) {
        return index < tokens.size() ? parseInt(tokens.get(index), defaultValue) : defaultValue;
    }

    public static double doubleAt(List<String> tokens, int index, double defaultValue) {
        return index < tokens.size() ? parseDouble(tokens.get(index), defaultValue) : defaultValue;
    }

    public static String stringAt(List<String> tokens, int index, String defaultValue) {
        return index < tokens.size() ? tokens.get(index) : defaultValue;
    }

    /**
     * Renders a float field: integral values print without a fraction ({@code 127}),
     * others in shortest decimal form with a lowercase exponent ({@code 0.5}, {@code 1e+37}).
     */
    public static String formatFloat(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value).toLowerCase(Locale.ROOT);
        }
        if (value == Math.rint(value) && Math.abs(value) < PLAIN_INTEGRAL_LIMIT) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toString().toLowerCase(Locale.ROOT);
    }
}
