package br.com.marmitas.realtime.config;

import br.com.marmitas.realtime.util.Env;

import java.time.Duration;
import java.util.List;

/**
 * Runtime configuration for the realtime fan-out service.
 *
 * Built once at startup from environment variables (or system properties),
 * then passed by reference to every component that needs it.
 */
public record RealtimeConfig(
    int port,
    String appEnv,

    // WebSocket
    String wsPath,
    int maxConnections,
    Duration heartbeatInterval,
    Duration staleConnectionTimeout,
    Duration monitoringInterval,
    boolean requireAuthentication,
    List<String> entityTypes,

    // Auth
    String jwtSecret,
    long jwtExpirationMs,

    // Change feed
    boolean changeFeedEnabled,
    String changeFeedChannel,
    Duration changeFeedPollInterval,
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize
) {
    public static final String DEFAULT_JWT_SECRET = "marmitas-realtime-secret-change-in-production";

    public static final List<String> DEFAULT_ENTITY_TYPES = List.of(
        "products", "orders", "customers", "deliveries", "kitchens",
        "menus", "categories", "promotions", "reviews"
    );

    public RealtimeConfig {
        entityTypes = List.copyOf(entityTypes);
    }

    public static RealtimeConfig fromEnv() {
        return new RealtimeConfig(
            Env.getInt("PORT", 9090),
            Env.get("APP_ENV", "development"),
            Env.get("WS_PATH", "/ws"),
            Env.getInt("WS_MAX_CONNECTIONS", 1000),
            Duration.ofMillis(Env.getLong("WS_HEARTBEAT_INTERVAL", 30_000)),
            Duration.ofMillis(Env.getLong("WS_STALE_TIMEOUT", 120_000)),
            Duration.ofMillis(Env.getLong("WS_MONITORING_INTERVAL", 60_000)),
            Env.getBool("WS_REQUIRE_AUTH", false),
            Env.getList("WS_ENTITY_TYPES", DEFAULT_ENTITY_TYPES),
            Env.get("JWT_SECRET", DEFAULT_JWT_SECRET),
            Env.getInt("JWT_EXPIRATION_MINUTES", 15) * 60_000L,
            Env.getBool("CHANGE_FEED_ENABLED", false),
            Env.get("CHANGE_FEED_CHANNEL", "table_changes"),
            Duration.ofMillis(Env.getLong("CHANGE_FEED_POLL_MS", 500)),
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/marmitas"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 2)
        );
    }

    /**
     * Defaults suitable for tests and local runs, independent of the environment.
     */
    public static RealtimeConfig defaults() {
        return new RealtimeConfig(
            9090, "development", "/ws", 1000,
            Duration.ofSeconds(30), Duration.ofMinutes(2), Duration.ofMinutes(1),
            false, DEFAULT_ENTITY_TYPES,
            DEFAULT_JWT_SECRET, 15 * 60_000L,
            false, "table_changes", Duration.ofMillis(500),
            "jdbc:postgresql://localhost:5432/marmitas", "postgres", "postgres", 2
        );
    }

    public boolean isProduction() {
        return "production".equalsIgnoreCase(appEnv);
    }

    public RealtimeConfig withAppEnv(String env) {
        return new RealtimeConfig(port, env, wsPath, maxConnections, heartbeatInterval,
            staleConnectionTimeout, monitoringInterval, requireAuthentication, entityTypes,
            jwtSecret, jwtExpirationMs, changeFeedEnabled, changeFeedChannel,
            changeFeedPollInterval, dbUrl, dbUser, dbPass, dbPoolSize);
    }

    public RealtimeConfig withMaxConnections(int max) {
        return new RealtimeConfig(port, appEnv, wsPath, max, heartbeatInterval,
            staleConnectionTimeout, monitoringInterval, requireAuthentication, entityTypes,
            jwtSecret, jwtExpirationMs, changeFeedEnabled, changeFeedChannel,
            changeFeedPollInterval, dbUrl, dbUser, dbPass, dbPoolSize);
    }

    public RealtimeConfig withMonitoringInterval(Duration interval) {
        return new RealtimeConfig(port, appEnv, wsPath, maxConnections, heartbeatInterval,
            staleConnectionTimeout, interval, requireAuthentication, entityTypes,
            jwtSecret, jwtExpirationMs, changeFeedEnabled, changeFeedChannel,
            changeFeedPollInterval, dbUrl, dbUser, dbPass, dbPoolSize);
    }
}
