package com.acme.spsc.util;

import java.util.Locale;
import java.util.Map;

/**
 * Environment parsing helpers with consistent defaulting and clamping.
 *
 * <p>Malformed values fall back to the default instead of failing startup.</p>
 */
public final class EnvVars {
    private EnvVars() {
    }

    public static String getOrDefault(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    public static long getLongClamped(Map<String, String> env, String name, long defaultValue, long min, long max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    /**
     * Parses an enum constant by name, case-insensitively; dashes are read as underscores
     * so {@code spin-lock} selects {@code SPIN_LOCK}.
     */
    public static <E extends Enum<E>> E getEnum(Map<String, String> env, String name, Class<E> type, E defaultValue) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException ignored) {
            return defaultValue;
        }
    }
}
