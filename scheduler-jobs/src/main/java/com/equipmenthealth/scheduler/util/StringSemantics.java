package com.equipmenthealth.scheduler.util;

/**
 * Shared string semantics for blank handling and deterministic fallbacks.
 */
public final class StringSemantics {
    private StringSemantics() {}

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return "";
    }

    /**
     * Joins a storage prefix and a relative key with exactly one '/' between them.
     */
    public static String joinKey(String prefix, String key) {
        if (isBlank(prefix)) {
            return key;
        }
        String trimmed = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
        String tail = key.startsWith("/") ? key.substring(1) : key;
        return trimmed + "/" + tail;
    }

    /**
     * Returns the last path segment of an object key.
     */
    public static String baseName(String key) {
        if (key == null) {
            return "";
        }
        int slash = key.lastIndexOf('/');
        return slash < 0 ? key : key.substring(slash + 1);
    }
}
