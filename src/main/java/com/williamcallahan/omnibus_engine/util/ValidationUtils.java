package com.williamcallahan.omnibus_engine.util;

/**
 * Utility helpers for common null/blank/empty validation checks.
 */
public final class ValidationUtils {
    private ValidationUtils() {
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Returns the first argument with text, or null when none has any.
     */
    public static String firstNonBlank(String... values) {
        if (values == null) return null;
        for (String v : values) {
            if (hasText(v)) return v;
        }
        return null;
    }
}
