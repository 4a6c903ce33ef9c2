package com.gomflow.collab.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Reads collaboration service settings.
 *
 * A setting is taken from the process environment, then from a JVM system
 * property of the same name (handy for tests and local runs), then from the
 * caller's default. A value that does not parse is logged and replaced by
 * the default.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String raw = lookup(key);
        return raw != null ? raw : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String raw = lookup(key);
        if (raw == null) return defaultValue;
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            return rejected(key, raw, defaultValue);
        }
    }

    public static long getLong(String key, long defaultValue) {
        String raw = lookup(key);
        if (raw == null) return defaultValue;
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            return rejected(key, raw, defaultValue);
        }
    }

    /**
     * Whole seconds, e.g. HEARTBEAT_INTERVAL_SECONDS=30.
     */
    public static Duration getSeconds(String key, long defaultSeconds) {
        return Duration.ofSeconds(getLong(key, defaultSeconds));
    }

    /**
     * Accepts true/false, 1/0, yes/no and on/off in any case.
     */
    public static boolean getBool(String key, boolean defaultValue) {
        String raw = lookup(key);
        if (raw == null) return defaultValue;
        switch (raw.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on":
                return true;
            case "false", "0", "no", "off":
                return false;
            default:
                return rejected(key, raw, defaultValue);
        }
    }

    private static String lookup(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static <T> T rejected(String key, String raw, T defaultValue) {
        log.warn("Ignoring setting {}='{}': not a valid value, using default {}", key, raw, defaultValue);
        return defaultValue;
    }

    private Env() {}
}
