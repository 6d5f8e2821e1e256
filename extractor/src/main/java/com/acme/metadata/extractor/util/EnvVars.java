package com.acme.metadata.extractor.util;

import java.util.Map;

/**
 * Environment lookups with defaulting and clamping, used to resolve tuning options at startup.
 *
 * <p>An explicit value always wins over the environment; a blank or malformed environment value
 * falls back to the default.</p>
 */
public final class EnvVars {
    private EnvVars() {
    }

    public static int resolveInt(Map<String, String> env,
                                 Integer explicit,
                                 String name,
                                 int defaultValue,
                                 int min,
                                 int max) {
        if (explicit != null) {
            return clamp(explicit, min, max);
        }
        return getIntClamped(env, name, defaultValue, min, max);
    }

    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return clamp(Integer.parseInt(raw.trim()), min, max);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static int clamp(int value, int min, int max) {
        if (value < min) return min;
        return Math.min(value, max);
    }
}
