package com.callqueue.dispatch.common.config;

import java.util.Locale;

/**
 * Lenient conversions for directory-supplied parameter values.
 */
public final class ConfigValues {

    private ConfigValues() {
    }

    public static Boolean parseBoolean(String raw, Boolean fallback) {
        if (raw == null) return fallback;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "yes", "true", "y", "t", "1", "on" -> Boolean.TRUE;
            case "no", "false", "n", "f", "0", "off" -> Boolean.FALSE;
            default -> fallback;
        };
    }

    public static boolean isTrue(String raw) {
        return Boolean.TRUE.equals(parseBoolean(raw, Boolean.FALSE));
    }

    public static boolean isFalse(String raw) {
        return Boolean.FALSE.equals(parseBoolean(raw, null));
    }

    /**
     * @throws NumberFormatException when the value is not an integer
     */
    public static int parseInt(String raw) {
        return Integer.parseInt(raw == null ? "" : raw.trim());
    }
}
