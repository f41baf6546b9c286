package br.com.marmitas.realtime.transport.ws;

import br.com.marmitas.realtime.application.port.output.ConnectionTransport;
import br.com.marmitas.realtime.domain.connection.ClientConnection;
import br.com.marmitas.realtime.domain.message.ServerNotice;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xnio.IoUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Undertow-native WebSocket hub with:
 * - Anonymous connect, in-band authentication (see {@link WsMessageRouter})
 * - Per-connection asynchronous sends
 * - Heartbeat with stale connection sweep
 *
 * Implements the transport port used by the auth gate, monitor and fan-out.
 */
public final class WsHub implements ConnectionTransport {
    private static final Logger log = LoggerFactory.getLogger(WsHub.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    // ConnectionId -> Peer
    private final ConcurrentMap<String, Peer> connections = new ConcurrentHashMap<>();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ws-heartbeat");
        t.setDaemon(true);
        return t;
    });

    private final Duration heartbeatInterval;
    private final Duration staleTimeout;

    private record Peer(WebSocketChannel channel, ClientConnection connection) {}

    public WsHub(Duration heartbeatInterval, Duration staleTimeout) {
        this.heartbeatInterval = heartbeatInterval;
        this.staleTimeout = staleTimeout;
    }

    public void start() {
        long periodMs = heartbeatInterval.toMillis();
        scheduler.scheduleAtFixedRate(this::heartbeat, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("WsHub started with {}ms heartbeat, {}ms stale timeout", periodMs, staleTimeout.toMillis());
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (Peer peer : new ArrayList<>(connections.values())) {
            IoUtils.safeClose(peer.channel());
        }
        log.info("WsHub stopped");
    }

    public WebSocketProtocolHandshakeHandler websocketHandler(WsMessageRouter router) {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                String connectionId = UUID.randomUUID().toString();
                connections.put(connectionId, new Peer(channel, new ClientConnection(connectionId)));

                log.info("WS connected: {} (connection={})", channel.getSourceAddress(), connectionId);

                channel.addCloseTask(ch -> {
                    if (connections.remove(connectionId) != null) {
                        router.onClose(connectionId);
                        log.info("WS disconnected: {} (connection={})", ch.getSourceAddress(), connectionId);
                    }
                });

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        Peer peer = connections.get(connectionId);
                        if (peer != null) {
                            peer.connection().touch();
                        }
                        router.onMessage(connectionId, message.getData());
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        router.onError(connectionId, error);
                        super.onError(ch, error);
                    }
                });

                channel.resumeReceives();
                router.onOpen(connectionId);
            }
        });
    }

    private void heartbeat() {
        try {
            Instant cutoff = Instant.now().minus(staleTimeout);
            int closed = 0;
            for (Peer peer : connections.values()) {
                if (peer.connection().getLastActivity().isBefore(cutoff)) {
                    log.info("Closing stale connection {}", peer.connection().getConnectionId());
                    IoUtils.safeClose(peer.channel());
                    closed++;
                } else {
                    send(peer, ServerNotice.heartbeat());
                }
            }
            if (closed > 0) {
                log.info("Heartbeat closed {} stale connections, {} remain", closed, connections.size());
            }
        } catch (Exception e) {
            log.warn("WS heartbeat error: {}", e.toString());
        }
    }

    // ========================================================================
    // ConnectionTransport
    // ========================================================================

    @Override
    public Optional<ClientConnection> getConnection(String connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        Peer peer = connections.get(connectionId);
        return peer == null ? Optional.empty() : Optional.of(peer.connection());
    }

    @Override
    public boolean sendToConnection(String connectionId, Object message) {
        Peer peer = connectionId == null ? null : connections.get(connectionId);
        if (peer == null) {
            return false;
        }
        return send(peer, message);
    }

    @Override
    public int getConnectionCount() {
        return connections.size();
    }

    @Override
    public int getAuthenticatedConnectionCount() {
        int count = 0;
        for (Peer peer : connections.values()) {
            if (peer.connection().isAuthenticated()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Send the same message to several connections.
     *
     * @return number of sends queued
     */
    public int broadcastToConnections(Collection<String> connectionIds, Object message) {
        int sent = 0;
        for (String connectionId : connectionIds) {
            if (sendToConnection(connectionId, message)) {
                sent++;
            }
        }
        return sent;
    }

    private boolean send(Peer peer, Object message) {
        if (!peer.channel().isOpen()) {
            return false;
        }
        String json;
        try {
            json = MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize WS message: {}", e.toString());
            return false;
        }
        WebSockets.sendText(json, peer.channel(), new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel channel, Void context) {
            }

            @Override
            public void onError(WebSocketChannel channel, Void context, Throwable throwable) {
                log.warn("WS send to {} failed: {}", peer.connection().getConnectionId(), throwable.toString());
            }
        });
        return true;
    }
}
