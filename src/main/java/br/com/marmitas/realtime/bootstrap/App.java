package br.com.marmitas.realtime.bootstrap;

import br.com.marmitas.realtime.application.auth.ConnectionAuthGate;
import br.com.marmitas.realtime.application.fanout.FanOutCoordinator;
import br.com.marmitas.realtime.application.monitoring.AlertService;
import br.com.marmitas.realtime.application.monitoring.ConnectionMonitor;
import br.com.marmitas.realtime.application.port.output.ChangeFeedSource;
import br.com.marmitas.realtime.application.subscription.SubscriptionCommandHandler;
import br.com.marmitas.realtime.application.subscription.SubscriptionRegistry;
import br.com.marmitas.realtime.application.transform.EventTransformer;
import br.com.marmitas.realtime.auth.JwtService;
import br.com.marmitas.realtime.config.RealtimeConfig;
import br.com.marmitas.realtime.infrastructure.changefeed.PostgresChangeFeedSource;
import br.com.marmitas.realtime.infrastructure.metrics.PrometheusRealtimeMetrics;
import br.com.marmitas.realtime.transport.http.MonitoringHandler;
import br.com.marmitas.realtime.transport.http.PrometheusMetricsHandler;
import br.com.marmitas.realtime.transport.ws.WsHub;
import br.com.marmitas.realtime.transport.ws.WsMessageRouter;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Marmitas realtime service.
 *
 * Wires:
 * - WebSocket hub (Undertow) with in-band JWT authentication
 * - Subscription registry and command handling
 * - PostgreSQL change feed -> event transformer -> fan-out
 * - Connection monitor with capacity alerts
 * - Prometheus /metrics, /api/realtime/stats, /health
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("=== Marmitas Realtime Starting ===");

        RealtimeConfig config = RealtimeConfig.fromEnv();
        StartupConfigValidator.validate(config);

        // ═══════════════════════════════════════════════════════════════
        // Core services
        // ═══════════════════════════════════════════════════════════════
        PrometheusRealtimeMetrics metrics = new PrometheusRealtimeMetrics();
        SubscriptionRegistry registry = new SubscriptionRegistry();
        EventTransformer transformer = EventTransformer.withDefaults(config.entityTypes(), metrics);
        JwtService jwtService = new JwtService(config.jwtSecret(), config.jwtExpirationMs());

        WsHub wsHub = new WsHub(config.heartbeatInterval(), config.staleConnectionTimeout());

        ConnectionAuthGate authGate = new ConnectionAuthGate(wsHub, jwtService, metrics, !config.isProduction());
        ConnectionMonitor monitor = new ConnectionMonitor(wsHub, registry, metrics, new AlertService(),
            config.monitoringInterval(), config.maxConnections());
        SubscriptionCommandHandler commands = new SubscriptionCommandHandler(registry, wsHub, authGate,
            config.requireAuthentication(), config.entityTypes());
        WsMessageRouter router = new WsMessageRouter(wsHub, authGate, commands, registry, monitor, metrics);
        FanOutCoordinator fanOut = new FanOutCoordinator(registry, transformer, wsHub, metrics, monitor);
        log.info("✓ Realtime services initialized");

        // ═══════════════════════════════════════════════════════════════
        // Change feed (optional)
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = null;
        ChangeFeedSource changeFeed = null;
        if (config.changeFeedEnabled()) {
            dataSource = createDataSource(config);
            changeFeed = new PostgresChangeFeedSource(dataSource, config.changeFeedChannel(),
                config.changeFeedPollInterval());
            changeFeed.start(fanOut::onChange);
            log.info("✓ Change feed listening on {}", config.changeFeedChannel());
        } else {
            log.info("Change feed disabled (CHANGE_FEED_ENABLED=false)");
        }

        // ═══════════════════════════════════════════════════════════════
        // HTTP + WebSocket server
        // ═══════════════════════════════════════════════════════════════
        MonitoringHandler monitoringHandler = new MonitoringHandler(monitor, registry, changeFeed);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/health", monitoringHandler::getHealth)
            .get("/api/realtime/stats", monitoringHandler::getStats)
            .get(config.wsPath(), wsHub.websocketHandler(router));

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(routes)
            .build();

        wsHub.start();
        monitor.initialize();
        server.start();
        log.info("Marmitas Realtime started on ws://localhost:{}{}", config.port(), config.wsPath());

        ChangeFeedSource feed = changeFeed;
        HikariDataSource ds = dataSource;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down Marmitas Realtime...");
            if (feed != null) {
                feed.stop();
            }
            monitor.shutdown();
            wsHub.stop();
            server.stop();
            if (ds != null) {
                ds.close();
            }
            log.info("Shutdown complete");
        }, "shutdown"));
    }

    private static HikariDataSource createDataSource(RealtimeConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("marmitas-realtime-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }
}
