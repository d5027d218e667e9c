package com.factryl.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Lenient readers for loosely typed metadata values and score rounding.
 */
public final class MetadataValues {

    private MetadataValues() {
    }

    /**
     * Numeric value of {@code key}: numbers as-is, numeric strings with optional thousands
     * separators, anything else {@code defaultValue}.
     */
    public static double number(Map<String, Object> metadata, String key, double defaultValue) {
        if (metadata == null) {
            return defaultValue;
        }
        Object value = metadata.get(key);
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? d : defaultValue;
        }
        if (value instanceof String) {
            String text = ((String) value).replace(",", "").trim();
            try {
                double d = Double.parseDouble(text);
                return Double.isFinite(d) ? d : defaultValue;
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static boolean flag(Map<String, Object> metadata, String key) {
        if (metadata == null) {
            return false;
        }
        Object value = metadata.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value instanceof String && Boolean.parseBoolean(((String) value).trim());
    }

    public static String text(Map<String, Object> metadata, String key) {
        if (metadata == null) {
            return "";
        }
        Object value = metadata.get(key);
        return value != null ? value.toString() : "";
    }

    /**
     * Rounds half-even on the exact binary value.
     */
    public static double round(double value, int places) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }
}
