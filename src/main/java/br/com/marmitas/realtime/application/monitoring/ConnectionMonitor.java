package br.com.marmitas.realtime.application.monitoring;

import br.com.marmitas.realtime.application.port.output.ConnectionTransport;
import br.com.marmitas.realtime.application.port.output.RealtimeMetrics;
import br.com.marmitas.realtime.application.subscription.SubscriptionRegistry;
import br.com.marmitas.realtime.domain.monitoring.Alert;
import br.com.marmitas.realtime.domain.monitoring.AlertLevel;
import br.com.marmitas.realtime.domain.monitoring.ConnectionMetrics;
import br.com.marmitas.realtime.domain.subscription.SubscriptionStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Connection health and capacity monitor.
 *
 * Features:
 * - Periodic sample of open and authenticated connections
 * - Peak watermark (never decreases)
 * - Counters for processed messages, connection errors and reconnects
 * - HIGH alert when the connection count exceeds the configured ceiling
 *
 * The ceiling is observe-only: nothing is rejected or closed here.
 *
 * Usage:
 * <pre>
 * ConnectionMonitor monitor = new ConnectionMonitor(hub, registry, metrics, alerts,
 *     Duration.ofMinutes(1), 1000);
 * monitor.initialize();
 * ...
 * monitor.shutdown();
 * </pre>
 */
public final class ConnectionMonitor {
    private static final Logger log = LoggerFactory.getLogger(ConnectionMonitor.class);

    static final String CONNECTION_LIMIT_EXCEEDED = "CONNECTION_LIMIT_EXCEEDED";

    private final ConnectionTransport transport;
    private final SubscriptionRegistry registry;
    private final RealtimeMetrics metrics;
    private final AlertService alertService;
    private final Duration interval;
    private final int maxConnections;

    private final AtomicInteger totalConnections = new AtomicInteger();
    private final AtomicInteger authenticatedConnections = new AtomicInteger();
    private final AtomicInteger peakConnections = new AtomicInteger();
    private final AtomicLong messagesProcessed = new AtomicLong();
    private final AtomicLong connectionErrors = new AtomicLong();
    private final AtomicLong reconnects = new AtomicLong();

    private ScheduledExecutorService scheduler;
    private boolean shutdown = false;

    public ConnectionMonitor(ConnectionTransport transport, SubscriptionRegistry registry,
                             RealtimeMetrics metrics, AlertService alertService,
                             Duration interval, int maxConnections) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.alertService = Objects.requireNonNull(alertService, "alertService");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.maxConnections = maxConnections;
    }

    /**
     * Start the periodic tick. Repeated calls, and calls after {@link #shutdown()}, do nothing.
     */
    public synchronized void initialize() {
        if (shutdown) {
            log.warn("[MONITOR] Ignoring initialize() after shutdown");
            return;
        }
        if (scheduler != null) {
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "connection-monitor");
            t.setDaemon(true);
            return t;
        });
        long periodMs = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::safeTick, periodMs, periodMs, TimeUnit.MILLISECONDS);

        log.info("[MONITOR] Started: interval={}ms, maxConnections={}", periodMs, maxConnections);
    }

    /**
     * Stop the tick. Safe before {@link #initialize()} and safe to call twice.
     */
    public synchronized void shutdown() {
        shutdown = true;
        if (scheduler == null) {
            return;
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("[MONITOR] Stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            // Keep the schedule alive
            log.error("[MONITOR] Error during monitoring tick", e);
        }
    }

    /**
     * Take one sample. Runs on the scheduler; also callable directly.
     */
    public void tick() {
        int total = transport.getConnectionCount();
        int authenticated = transport.getAuthenticatedConnectionCount();

        totalConnections.set(total);
        authenticatedConnections.set(authenticated);
        int peak = peakConnections.accumulateAndGet(total, Math::max);

        SubscriptionStats stats = registry.stats();

        log.info("[MONITOR] connections={} authenticated={} peak={} subscriptions={} messages={} errors={} reconnects={}",
            total, authenticated, peak, stats.totalSubscriptions(),
            messagesProcessed.get(), connectionErrors.get(), reconnects.get());

        metrics.updateConnectionGauges(total, authenticated, peak);
        metrics.updateSubscriptionGauges(stats.totalClients(), stats.totalSubscriptions());

        if (maxConnections > 0 && total > maxConnections) {
            log.warn("[MONITOR] Connection limit exceeded: {}/{}", total, maxConnections);
            alertService.sendAlert(Alert.of(CONNECTION_LIMIT_EXCEEDED, AlertLevel.HIGH,
                "Connection count " + total + " exceeds limit " + maxConnections,
                Map.of("connections", total, "maxConnections", maxConnections)));
        }
    }

    public void incrementMessagesProcessed() {
        messagesProcessed.incrementAndGet();
    }

    public void incrementConnectionErrors() {
        connectionErrors.incrementAndGet();
        metrics.recordConnectionError();
    }

    public void incrementReconnects() {
        reconnects.incrementAndGet();
        metrics.recordReconnect();
    }

    public ConnectionMetrics getMetrics() {
        return new ConnectionMetrics(
            totalConnections.get(),
            authenticatedConnections.get(),
            peakConnections.get(),
            messagesProcessed.get(),
            connectionErrors.get(),
            reconnects.get()
        );
    }
}
