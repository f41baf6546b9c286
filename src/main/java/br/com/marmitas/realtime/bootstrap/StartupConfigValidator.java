package br.com.marmitas.realtime.bootstrap;

import br.com.marmitas.realtime.config.RealtimeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Throws IllegalStateException if the
 * configuration is invalid; in production that means the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {}

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(RealtimeConfig config) {
        log.info("Running startup config validation (env={})", config.appEnv());

        requirePositive("WS_HEARTBEAT_INTERVAL", config.heartbeatInterval());
        requirePositive("WS_STALE_TIMEOUT", config.staleConnectionTimeout());
        requirePositive("WS_MONITORING_INTERVAL", config.monitoringInterval());
        requirePositive("CHANGE_FEED_POLL_MS", config.changeFeedPollInterval());

        if (config.maxConnections() < 0) {
            throw new IllegalStateException(
                "INVALID CONFIG: WS_MAX_CONNECTIONS must be >= 0 (0 disables the ceiling), got "
                    + config.maxConnections());
        }
        if (config.entityTypes().isEmpty()) {
            throw new IllegalStateException("INVALID CONFIG: WS_ENTITY_TYPES must name at least one entity type");
        }

        if (config.isProduction()) {
            if (RealtimeConfig.DEFAULT_JWT_SECRET.equals(config.jwtSecret())) {
                throw new IllegalStateException(
                    "INVALID CONFIG: production requires JWT_SECRET to be set.\n" +
                    "System refuses to start with the development secret.");
            }
            if (!config.requireAuthentication()) {
                log.warn("WS_REQUIRE_AUTH=false in production: anonymous connections may subscribe");
            }
        } else {
            if (RealtimeConfig.DEFAULT_JWT_SECRET.equals(config.jwtSecret())) {
                log.warn("Using the development JWT secret (APP_ENV={})", config.appEnv());
            }
        }

        log.info("Startup config validation passed");
    }

    private static void requirePositive(String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalStateException("INVALID CONFIG: " + key + " must be positive, got " + value);
        }
    }
}
