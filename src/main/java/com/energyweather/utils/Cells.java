package com.energyweather.utils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Conversions between table cells and their text form.
 */
public final class Cells {

    private Cells() {
    }

    /**
     * Parses a numeric cell. Returns null for empty or null-like input.
     *
     * @throws NumberFormatException when the text is present but not a number
     */
    public static Double parseNumber(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        if (raw instanceof Boolean) {
            throw new NumberFormatException("boolean is not numeric: " + raw);
        }
        String text = String.valueOf(raw).trim();
        if (DateParsing.isNullToken(text)) {
            return null;
        }
        double value = Double.parseDouble(text.replace(",", ""));
        if (Double.isNaN(value)) {
            return null;
        }
        return value;
    }

    public static boolean isNumberText(String raw) {
        if (raw == null) {
            return false;
        }
        String text = raw.trim();
        if (text.isEmpty()) {
            return false;
        }
        try {
            Double.parseDouble(text);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        return false;
    }

    /** Stable text form: plain decimals without trailing zeros, ISO dates, empty string for missing. */
    public static String format(Object value) {
        if (isMissing(value)) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isInfinite(d)) {
                return String.valueOf(d);
            }
            BigDecimal decimal = BigDecimal.valueOf(d).stripTrailingZeros();
            return decimal.scale() < 0 ? decimal.setScale(0).toPlainString() : decimal.toPlainString();
        }
        if (value instanceof LocalDate date) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
        }
        return String.valueOf(value);
    }
}
