package com.gomflow.collab.bootstrap;

import com.gomflow.collab.config.CollabConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Startup configuration validator.
 *
 * Runs from App.main() before anything is wired. Lock bounds are always
 * checked; production mode additionally refuses weak JWT secrets.
 *
 * @throws IllegalStateException from {@link #validate} if configuration is invalid
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    static final int MIN_SECRET_BYTES = 32;

    public static void validate(CollabConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("Production mode: {}", config.productionMode());

        validateLockBounds(config);

        if (config.heartbeatInterval().isZero() || config.heartbeatInterval().isNegative()) {
            throw new IllegalStateException(
                "INVALID CONFIG: HEARTBEAT_INTERVAL_SECONDS must be positive, got " + config.heartbeatInterval().getSeconds());
        }
        if (config.recentActivityLimit() < 0) {
            throw new IllegalStateException(
                "INVALID CONFIG: RECENT_ACTIVITY_LIMIT must not be negative, got " + config.recentActivityLimit());
        }

        if (config.productionMode()) {
            validateProductionMode(config);
        } else {
            warnNonProductionMode(config);
        }

        log.info("Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateLockBounds(CollabConfig config) {
        if (config.lockDefaultMinutes() < 1 || config.lockMaxMinutes() < 1) {
            throw new IllegalStateException(
                "INVALID CONFIG: LOCK_DEFAULT_MINUTES and LOCK_MAX_MINUTES must be positive\n" +
                "Got default=" + config.lockDefaultMinutes() + ", max=" + config.lockMaxMinutes());
        }
        if (config.lockDefaultMinutes() > config.lockMaxMinutes()) {
            throw new IllegalStateException(
                "INVALID CONFIG: LOCK_DEFAULT_MINUTES (" + config.lockDefaultMinutes() +
                ") exceeds LOCK_MAX_MINUTES (" + config.lockMaxMinutes() + ")");
        }
        log.info("✓ Lock duration default={}m max={}m", config.lockDefaultMinutes(), config.lockMaxMinutes());
    }

    private static void validateProductionMode(CollabConfig config) {
        log.info("PRODUCTION MODE detected - enforcing strict validation");

        String secret = config.jwtSecret();
        if (secret == null || CollabConfig.DEV_JWT_SECRET.equals(secret)) {
            throw new IllegalStateException(
                "INVALID CONFIG: PRODUCTION MODE requires JWT_SECRET to be set\n" +
                "System refuses to start with the development secret.");
        }
        if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                "INVALID CONFIG: JWT_SECRET must be at least " + MIN_SECRET_BYTES + " bytes in PRODUCTION MODE");
        }
        log.info("✓ JWT secret configured");

        if (!config.editRequiresLock()) {
            log.warn("EDIT_REQUIRES_LOCK=false: order edits are advisory and not gated on lock ownership");
        }
    }

    private static void warnNonProductionMode(CollabConfig config) {
        log.warn("NON-PRODUCTION MODE detected");
        if (CollabConfig.DEV_JWT_SECRET.equals(config.jwtSecret())) {
            log.warn("Using the development JWT secret");
        }
    }

    private StartupConfigValidator() {}
}
