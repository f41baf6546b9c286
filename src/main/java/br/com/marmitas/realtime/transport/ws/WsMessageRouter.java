package br.com.marmitas.realtime.transport.ws;

import br.com.marmitas.realtime.application.auth.ConnectionAuthGate;
import br.com.marmitas.realtime.application.monitoring.ConnectionMonitor;
import br.com.marmitas.realtime.application.port.output.ConnectionTransport;
import br.com.marmitas.realtime.application.port.output.RealtimeMetrics;
import br.com.marmitas.realtime.application.subscription.SubscribeRequest;
import br.com.marmitas.realtime.application.subscription.SubscriptionCommandHandler;
import br.com.marmitas.realtime.application.subscription.SubscriptionRegistry;
import br.com.marmitas.realtime.domain.message.ServerNotice;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Connection lifecycle and inbound message dispatch, independent of the socket library.
 *
 * Inbound types: ping, authenticate, subscribe, unsubscribe.
 */
public final class WsMessageRouter {
    private static final Logger log = LoggerFactory.getLogger(WsMessageRouter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String INVALID_JSON = "Invalid JSON message";
    static final String UNKNOWN_TYPE = "Unknown message type";
    static final String SERVER_ERROR = "Server error processing message";

    private final ConnectionTransport transport;
    private final ConnectionAuthGate authGate;
    private final SubscriptionCommandHandler commands;
    private final SubscriptionRegistry registry;
    private final ConnectionMonitor monitor;
    private final RealtimeMetrics metrics;

    public WsMessageRouter(ConnectionTransport transport, ConnectionAuthGate authGate,
                           SubscriptionCommandHandler commands, SubscriptionRegistry registry,
                           ConnectionMonitor monitor, RealtimeMetrics metrics) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.authGate = Objects.requireNonNull(authGate, "authGate");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public void onOpen(String connectionId) {
        transport.sendToConnection(connectionId, ServerNotice.connected(connectionId));
    }

    public void onMessage(String connectionId, String raw) {
        ClientMessage msg;
        try {
            msg = MAPPER.readValue(raw, ClientMessage.class);
        } catch (JsonProcessingException e) {
            log.debug("Invalid JSON from connection {}: {}", connectionId, e.getOriginalMessage());
            transport.sendToConnection(connectionId, ServerNotice.error(INVALID_JSON));
            return;
        }
        if (msg == null) {
            transport.sendToConnection(connectionId, ServerNotice.error(INVALID_JSON));
            return;
        }

        try {
            route(connectionId, msg);
        } catch (Exception e) {
            log.error("Error handling {} message from connection {}", msg.type, connectionId, e);
            transport.sendToConnection(connectionId, ServerNotice.error(SERVER_ERROR));
        }
    }

    private void route(String connectionId, ClientMessage msg) {
        String type = msg.type == null ? "" : msg.type;
        switch (type) {
            case "ping" -> transport.sendToConnection(connectionId, ServerNotice.pong());
            case "authenticate" -> {
                if (msg.previousConnectionId != null && !msg.previousConnectionId.isBlank()) {
                    log.debug("Connection {} resumes {}", connectionId, msg.previousConnectionId);
                    monitor.incrementReconnects();
                }
                authGate.handleAuthMessage(connectionId, msg.token);
            }
            case "subscribe" -> commands.subscribe(connectionId, new SubscribeRequest(
                msg.subscriptionId, msg.entityType, msg.entityId, msg.eventKinds, msg.filters, msg.metadata));
            case "unsubscribe" -> commands.unsubscribe(connectionId, msg.subscriptionId, Boolean.TRUE.equals(msg.all));
            default -> {
                log.debug("Unknown message type '{}' from connection {}", msg.type, connectionId);
                transport.sendToConnection(connectionId, ServerNotice.error(UNKNOWN_TYPE));
                return;
            }
        }
        monitor.incrementMessagesProcessed();
        metrics.recordMessageProcessed(type);
    }

    /**
     * Drop everything the connection owned. Called once per closed socket.
     */
    public void onClose(String connectionId) {
        int removed = registry.removeAllForClient(connectionId);
        if (removed > 0) {
            log.debug("Connection {} closed, removed {} subscriptions", connectionId, removed);
        }
    }

    public void onError(String connectionId, Throwable error) {
        log.warn("WebSocket error on connection {}: {}", connectionId, error.toString());
        monitor.incrementConnectionErrors();
    }

    // Inbound wire model
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ClientMessage {
        public String type;
        public String token;
        public String previousConnectionId;
        public String subscriptionId;
        public String entityType;
        public String entityId;
        public List<String> eventKinds;
        public Map<String, Object> filters;
        public Map<String, Object> metadata;
        public Boolean all;
    }
}
