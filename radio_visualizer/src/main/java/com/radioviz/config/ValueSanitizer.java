package com.radioviz.config;

/**
 * Shared clamping helpers for numeric values read from settings or produced by animators.
 *
 * NaN and Infinity are replaced with the supplied default, everything else is clamped
 * to the requested range.
 */
public final class ValueSanitizer {

    private ValueSanitizer() {
        // Utility class
    }

    /**
     * Sanitize a double value: reject NaN/Infinity, clamp to [min, max].
     */
    public static double sanitizeDouble(double value, double min, double max, double defaultVal) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return defaultVal;
        }
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Sanitize a long value: clamp to [min, max].
     */
    public static long sanitizeLong(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }

    /** Bar height ratio, falling back to the lower bound when the value is not finite. */
    public static double sanitizeHeight(double value, double minHeight, double maxHeight) {
        return sanitizeDouble(value, minHeight, maxHeight, minHeight);
    }

    /** Progress fraction (0-1). */
    public static double sanitizeProgress(double value) {
        return sanitizeDouble(value, 0.0, 1.0, 0.0);
    }
}
