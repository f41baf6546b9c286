package br.com.marmitas.realtime.transport.http;

import br.com.marmitas.realtime.application.monitoring.ConnectionMonitor;
import br.com.marmitas.realtime.application.port.output.ChangeFeedSource;
import br.com.marmitas.realtime.application.subscription.SubscriptionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP handler for operational endpoints:
 * - GET /api/realtime/stats - Connection counters and registry size
 * - GET /health - Liveness plus change-feed state
 */
public final class MonitoringHandler {
    private static final Logger log = LoggerFactory.getLogger(MonitoringHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ConnectionMonitor monitor;
    private final SubscriptionRegistry registry;
    private final ChangeFeedSource changeFeed;

    /**
     * @param changeFeed null when the change feed is disabled
     */
    public MonitoringHandler(ConnectionMonitor monitor, SubscriptionRegistry registry, ChangeFeedSource changeFeed) {
        this.monitor = monitor;
        this.registry = registry;
        this.changeFeed = changeFeed;
    }

    public void getStats(HttpServerExchange exchange) {
        try {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("connections", monitor.getMetrics());
            stats.put("subscriptions", registry.stats());
            sendJson(exchange, stats);
        } catch (Exception e) {
            log.error("Failed to get realtime stats: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get stats: " + e.getMessage());
        }
    }

    public void getHealth(HttpServerExchange exchange) {
        try {
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "UP");
            health.put("monitor", monitor.isRunning() ? "RUNNING" : "STOPPED");
            health.put("changeFeed", changeFeed == null ? "DISABLED"
                : changeFeed.isRunning() ? "RUNNING" : "STOPPED");
            sendJson(exchange, health);
        } catch (Exception e) {
            log.error("Failed to get health: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get health: " + e.getMessage());
        }
    }

    private void sendJson(HttpServerExchange exchange, Object data) throws Exception {
        String json = MAPPER.writeValueAsString(data);
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
