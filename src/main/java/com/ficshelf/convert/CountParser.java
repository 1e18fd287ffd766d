package com.ficshelf.convert;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Parses the count strings story sites print: {@code "1,234"}, {@code "2.5k"},
 * {@code "(12)"}, {@code "1.234.567"}. Never throws; anything unusable is 0.
 */
public final class CountParser {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000L);
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000L);
    private static final BigDecimal MAX_INT = BigDecimal.valueOf(Integer.MAX_VALUE);

    private CountParser() {
    }

    public static int parse(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                return 0;
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? Integer.MAX_VALUE : 0;
            }
        }
        if (value instanceof Number) {
            try {
                return clamp(new BigDecimal(value.toString()));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return parse(value.toString());
    }

    public static int parse(String text) {
        if (text == null) {
            return 0;
        }
        String s = text.strip().toLowerCase(Locale.ROOT);
        s = s.replace("(", "").replace(")", "");
        // with more than one period none of them can be the decimal point
        if (s.indexOf('.') != s.lastIndexOf('.')) {
            s = s.replace(".", "");
        }
        s = s.replace(",", "");

        BigDecimal multiplier = BigDecimal.ONE;
        if (s.endsWith("k")) {
            multiplier = THOUSAND;
            s = s.substring(0, s.length() - 1);
        } else if (s.endsWith("m")) {
            multiplier = MILLION;
            s = s.substring(0, s.length() - 1);
        }
        s = s.strip();
        if (s.isEmpty()) {
            return 0;
        }

        try {
            return clamp(new BigDecimal(s).multiply(multiplier));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static int clamp(BigDecimal value) {
        if (value.signum() <= 0) {
            return 0;
        }
        if (value.compareTo(MAX_INT) > 0) {
            return Integer.MAX_VALUE;
        }
        return value.intValue();
    }
}
