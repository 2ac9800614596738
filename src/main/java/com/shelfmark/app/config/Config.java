package com.shelfmark.app.config;

import java.util.Locale;
import java.util.OptionalLong;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Central Shelfmark configuration.
 * Values resolve from system properties first, then the process environment,
 * then a local .env file, and finally the built-in defaults.
 */
public final class Config {

    private static final int DEFAULT_HASH_BUFFER_SIZE = 64 * 1024;
    private static final int MIN_HASH_BUFFER_SIZE = 512;
    private static final int DEFAULT_BUSY_TIMEOUT_MS = 10_000;

    // Environment variables (and .env keys)
    private static final String ENV_HASH_BUFFER_SIZE = "SHELFMARK_HASH_BUFFER_SIZE";
    private static final String ENV_BUSY_TIMEOUT_MS = "SHELFMARK_BUSY_TIMEOUT_MS";
    private static final String ENV_DISABLE_SYNC = "SHELFMARK_DISABLE_SYNC";
    private static final String ENV_SKIP_DELETE_CHECK = "SHELFMARK_SKIP_DELETE_CHECK";
    private static final String ENV_INDEX_DURATION = "SHELFMARK_INDEX_DURATION";

    // System property overrides (useful for tests/CI)
    private static final String PROP_HASH_BUFFER_SIZE = "shelfmark.hashBufferSize";
    private static final String PROP_BUSY_TIMEOUT_MS = "shelfmark.busyTimeoutMs";
    private static final String PROP_DISABLE_SYNC = "shelfmark.disableSync";
    private static final String PROP_SKIP_DELETE_CHECK = "shelfmark.skipDeleteCheck";
    private static final String PROP_INDEX_DURATION = "shelfmark.indexDuration";

    // Logger must be initialized before any static initializer that may use it
    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Config.class);
    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    private Config() {}

    /**
     * Chunk size used when streaming file content through the digest.
     */
    public static int getHashBufferSize() {
        int size = parseInt(ENV_HASH_BUFFER_SIZE, DEFAULT_HASH_BUFFER_SIZE);
        return Math.max(MIN_HASH_BUFFER_SIZE, size);
    }

    public static int getBusyTimeoutMillis() {
        return Math.max(0, parseInt(ENV_BUSY_TIMEOUT_MS, DEFAULT_BUSY_TIMEOUT_MS));
    }

    public static boolean isDisableSyncDefault() {
        return parseFlag(ENV_DISABLE_SYNC);
    }

    public static boolean isSkipDeleteCheckDefault() {
        return parseFlag(ENV_SKIP_DELETE_CHECK);
    }

    /**
     * Default indexing time budget in seconds, empty when runs are unbounded.
     */
    public static OptionalLong getIndexDurationSeconds() {
        String v = getEnvOrDotenv(ENV_INDEX_DURATION);
        if (v == null) return OptionalLong.empty();
        try {
            long seconds = Long.parseLong(v);
            if (seconds < 0) {
                logger.warn("Ignoring negative {}: {}", ENV_INDEX_DURATION, v);
                return OptionalLong.empty();
            }
            return OptionalLong.of(seconds);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid {}: {}", ENV_INDEX_DURATION, v);
            return OptionalLong.empty();
        }
    }

    // --- Resolution ---

    private static int parseInt(String envKey, int fallback) {
        String v = getEnvOrDotenv(envKey);
        if (v == null) return fallback;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid {}: {}", envKey, v);
            return fallback;
        }
    }

    private static boolean parseFlag(String envKey) {
        String v = getEnvOrDotenv(envKey);
        if (v == null) return false;
        String norm = v.toLowerCase(Locale.ROOT);
        return norm.equals("1") || norm.equals("true") || norm.equals("yes") || norm.equals("on");
    }

    /**
     * Looks a key up as a system property, then as an OS environment variable,
     * then in the local .env file via dotenv-java.
     */
    private static String getEnvOrDotenv(String key) {
        // 0. System properties override (tests/CI)
        String propKey = mapToSystemPropertyKey(key);
        if (propKey != null) {
            String propVal = System.getProperty(propKey);
            if (propVal != null && !propVal.isBlank()) {
                return propVal.trim();
            }
        }

        // 1. OS environment
        String envVal = System.getenv(key);
        if (envVal != null && !envVal.isBlank()) {
            return envVal.trim();
        }

        // 2. .env file
        String fileVal = dotenv.get(key);
        if (fileVal == null || fileVal.isBlank()) {
            return null;
        }
        return fileVal.trim();
    }

    private static String mapToSystemPropertyKey(String envKey) {
        if (envKey == null) return null;
        return switch (envKey) {
            case ENV_HASH_BUFFER_SIZE -> PROP_HASH_BUFFER_SIZE;
            case ENV_BUSY_TIMEOUT_MS -> PROP_BUSY_TIMEOUT_MS;
            case ENV_DISABLE_SYNC -> PROP_DISABLE_SYNC;
            case ENV_SKIP_DELETE_CHECK -> PROP_SKIP_DELETE_CHECK;
            case ENV_INDEX_DURATION -> PROP_INDEX_DURATION;
            default -> null;
        };
    }
}
