package com.gomflow.collab.config;

import com.gomflow.collab.util.Env;

import java.time.Duration;

/**
 * Immutable runtime configuration for the collaboration coordinator.
 *
 * Values come from environment variables (or system properties) via {@link Env}.
 */
public record CollabConfig(
    String bindHost,
    int port,
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize,
    String jwtSecret,
    int lockDefaultMinutes,
    int lockMaxMinutes,
    Duration heartbeatInterval,
    boolean editRequiresLock,
    int recentActivityLimit,
    int partitions,
    boolean productionMode
) {
    public static final String DEV_JWT_SECRET = "gomflow-collab-dev-secret-change-me";

    public static final int MIN_PARTITIONS = 8;
    public static final int MAX_PARTITIONS = 32;

    public static CollabConfig fromEnv() {
        return new CollabConfig(
            Env.get("BIND_HOST", "0.0.0.0"),
            Env.getInt("PORT", 9091),
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/gomflow"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 10),
            Env.get("JWT_SECRET", DEV_JWT_SECRET),
            Env.getInt("LOCK_DEFAULT_MINUTES", 5),
            Env.getInt("LOCK_MAX_MINUTES", 60),
            Env.getSeconds("HEARTBEAT_INTERVAL_SECONDS", 30),
            Env.getBool("EDIT_REQUIRES_LOCK", true),
            Env.getInt("RECENT_ACTIVITY_LIMIT", 50),
            Env.getInt("PARTITIONS", defaultPartitions()),
            Env.getBool("PRODUCTION_MODE", false)
        );
    }

    /**
     * Defaults used by tests and embedded setups.
     */
    public static CollabConfig defaults() {
        return new CollabConfig("127.0.0.1", 0, null, null, null, 1, DEV_JWT_SECRET,
            5, 60, Duration.ofSeconds(30), true, 50, MIN_PARTITIONS, false);
    }

    public CollabConfig withEditRequiresLock(boolean value) {
        return new CollabConfig(bindHost, port, dbUrl, dbUser, dbPass, dbPoolSize, jwtSecret,
            lockDefaultMinutes, lockMaxMinutes, heartbeatInterval, value, recentActivityLimit,
            partitions, productionMode);
    }

    /**
     * clamp(availableProcessors(), 8, 32)
     */
    public static int defaultPartitions() {
        int processors = Runtime.getRuntime().availableProcessors();
        return Math.max(MIN_PARTITIONS, Math.min(MAX_PARTITIONS, processors));
    }
}
