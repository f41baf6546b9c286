package br.com.marmitas.realtime.infrastructure.metrics;

import br.com.marmitas.realtime.application.port.output.RealtimeMetrics;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Prometheus implementation of the RealtimeMetrics port.
 *
 * Key Metrics:
 * - realtime_connections{state} - Current connections (total, authenticated, peak)
 * - realtime_subscriptions / realtime_subscribed_clients - Registry size
 * - realtime_messages_total{message_type} - Inbound client messages
 * - realtime_connection_errors_total - Socket errors
 * - realtime_reconnects_total - Clients resuming a previous connection
 * - realtime_authentications_total{status} - Authentication attempts
 * - realtime_transform_rejections_total{reason} - Change records dropped by the transformer
 * - realtime_events_total{entity_type} - Events fanned out
 * - realtime_deliveries_total{entity_type, status} - Per-subscription pushes
 *
 * Usage:
 * <pre>
 * PrometheusRealtimeMetrics metrics = new PrometheusRealtimeMetrics();
 * handler.addExactPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusRealtimeMetrics implements RealtimeMetrics {

    private final CollectorRegistry registry;

    // Connection metrics
    private final Gauge connections;
    private final Counter connectionErrors;
    private final Counter reconnects;

    // Registry metrics
    private final Gauge subscriptions;
    private final Gauge subscribedClients;

    // Message metrics
    private final Counter messageCounter;
    private final Counter authCounter;

    // Pipeline metrics
    private final Counter transformRejections;
    private final Counter eventCounter;
    private final Counter deliveryCounter;

    public PrometheusRealtimeMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusRealtimeMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.connections = Gauge.build()
            .name("realtime_connections")
            .help("WebSocket connections by state (total, authenticated, peak)")
            .labelNames("state")
            .register(registry);

        this.connectionErrors = Counter.build()
            .name("realtime_connection_errors_total")
            .help("Total number of WebSocket connection errors")
            .register(registry);

        this.reconnects = Counter.build()
            .name("realtime_reconnects_total")
            .help("Total number of clients resuming a previous connection")
            .register(registry);

        this.subscriptions = Gauge.build()
            .name("realtime_subscriptions")
            .help("Active subscriptions")
            .register(registry);

        this.subscribedClients = Gauge.build()
            .name("realtime_subscribed_clients")
            .help("Clients holding at least one subscription")
            .register(registry);

        this.messageCounter = Counter.build()
            .name("realtime_messages_total")
            .help("Total number of inbound client messages")
            .labelNames("message_type")
            .register(registry);

        this.authCounter = Counter.build()
            .name("realtime_authentications_total")
            .help("Total number of authentication attempts")
            .labelNames("status")
            .register(registry);

        this.transformRejections = Counter.build()
            .name("realtime_transform_rejections_total")
            .help("Change records dropped by the event transformer")
            .labelNames("reason")
            .register(registry);

        this.eventCounter = Counter.build()
            .name("realtime_events_total")
            .help("Total number of events fanned out")
            .labelNames("entity_type")
            .register(registry);

        this.deliveryCounter = Counter.build()
            .name("realtime_deliveries_total")
            .help("Per-subscription push attempts")
            .labelNames("entity_type", "status")
            .register(registry);
    }

    @Override
    public void updateConnectionGauges(int total, int authenticated, int peak) {
        connections.labels("total").set(total);
        connections.labels("authenticated").set(authenticated);
        connections.labels("peak").set(peak);
    }

    @Override
    public void updateSubscriptionGauges(int clients, int subscriptions) {
        this.subscribedClients.set(clients);
        this.subscriptions.set(subscriptions);
    }

    @Override
    public void recordMessageProcessed(String messageType) {
        messageCounter.labels(messageType).inc();
    }

    @Override
    public void recordConnectionError() {
        connectionErrors.inc();
    }

    @Override
    public void recordReconnect() {
        reconnects.inc();
    }

    @Override
    public void recordAuthentication(boolean success) {
        authCounter.labels(success ? "success" : "failure").inc();
    }

    @Override
    public void recordTransformRejected(String reason) {
        transformRejections.labels(reason).inc();
    }

    @Override
    public void recordFanOut(String entityType, int delivered, int failed) {
        eventCounter.labels(entityType).inc();
        if (delivered > 0) {
            deliveryCounter.labels(entityType, "success").inc(delivered);
        }
        if (failed > 0) {
            deliveryCounter.labels(entityType, "failure").inc(failed);
        }
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
