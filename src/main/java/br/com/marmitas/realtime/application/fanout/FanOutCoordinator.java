package br.com.marmitas.realtime.application.fanout;

import br.com.marmitas.realtime.application.monitoring.ConnectionMonitor;
import br.com.marmitas.realtime.application.port.output.ConnectionTransport;
import br.com.marmitas.realtime.application.port.output.RealtimeMetrics;
import br.com.marmitas.realtime.application.subscription.SubscriptionRegistry;
import br.com.marmitas.realtime.application.transform.EventTransformer;
import br.com.marmitas.realtime.domain.change.ChangeRecord;
import br.com.marmitas.realtime.domain.change.TransformedEvent;
import br.com.marmitas.realtime.domain.message.PushMessage;
import br.com.marmitas.realtime.domain.subscription.Subscription;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Glue between the change feed and the sockets: transform, look up, push.
 *
 * One push per matching subscription, so a client holding both an instance and a
 * wildcard subscription on the same entity receives the event twice, each tagged
 * with its own subscription id. A failed send affects only its recipient.
 */
public final class FanOutCoordinator {
    private static final Logger log = LoggerFactory.getLogger(FanOutCoordinator.class);

    private final SubscriptionRegistry registry;
    private final EventTransformer transformer;
    private final ConnectionTransport transport;
    private final RealtimeMetrics metrics;
    private final ConnectionMonitor monitor;

    public FanOutCoordinator(SubscriptionRegistry registry, EventTransformer transformer,
                             ConnectionTransport transport, RealtimeMetrics metrics,
                             ConnectionMonitor monitor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.monitor = monitor;
    }

    /**
     * Change-feed entry point. Records the transformer rejects are dropped.
     */
    public FanOutResult onChange(ChangeRecord change) {
        TransformedEvent event = transformer.transform(change);
        if (event == null) {
            return FanOutResult.NONE;
        }
        return publish(event);
    }

    public FanOutResult publish(TransformedEvent event) {
        if (event == null) {
            return FanOutResult.NONE;
        }

        Map<String, List<String>> recipients =
            registry.findSubscribedClients(event.entityType(), event.entityId());

        int matched = 0;
        int delivered = 0;
        int failed = 0;

        for (Map.Entry<String, List<String>> entry : recipients.entrySet()) {
            String clientId = entry.getKey();
            for (String subscriptionId : entry.getValue()) {
                Optional<Subscription> subscription = registry.get(clientId, subscriptionId);
                // Removed between lookup and delivery
                if (subscription.isEmpty() || !matches(subscription.get(), event)) {
                    continue;
                }
                matched++;

                if (send(clientId, subscriptionId, event)) {
                    delivered++;
                    if (monitor != null) {
                        monitor.incrementMessagesProcessed();
                    }
                } else {
                    failed++;
                }
            }
        }

        metrics.recordFanOut(event.entityType(), delivered, failed);
        if (matched > 0) {
            log.debug("Fanned out {}/{} {}: matched={}, delivered={}, failed={}",
                event.entityType(), event.entityId(), event.eventKind(), matched, delivered, failed);
        }
        return new FanOutResult(matched, delivered, failed);
    }

    private boolean send(String clientId, String subscriptionId, TransformedEvent event) {
        try {
            boolean sent = transport.sendToConnection(clientId, PushMessage.of(subscriptionId, event));
            if (!sent) {
                log.debug("Push to {} for subscription {} not accepted", clientId, subscriptionId);
            }
            return sent;
        } catch (Exception e) {
            log.error("Error pushing {} event to client {}", event.entityType(), clientId, e);
            return false;
        }
    }

    static boolean matches(Subscription subscription, TransformedEvent event) {
        if (!subscription.accepts(event.eventKind())) {
            return false;
        }
        for (Map.Entry<String, Object> filter : subscription.filters().entrySet()) {
            if (!fieldEquals(event.data(), filter.getKey(), filter.getValue())) {
                return false;
            }
        }
        return true;
    }

    // Scalars compare by text so 5, 5L and "5" are the same filter value
    private static boolean fieldEquals(JsonNode data, String field, Object expected) {
        JsonNode actual = data == null ? null : data.get(field);
        if (actual == null || actual.isNull()) {
            return expected == null;
        }
        if (expected == null || !actual.isValueNode()) {
            return false;
        }
        return actual.asText().equals(String.valueOf(expected));
    }
}
