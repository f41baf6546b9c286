package br.com.marmitas.realtime.support;

import br.com.marmitas.realtime.application.port.output.ConnectionTransport;
import br.com.marmitas.realtime.domain.connection.ClientConnection;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory transport that records every message sent to each connection.
 */
public class RecordingTransport implements ConnectionTransport {

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, List<Object>> sent = new LinkedHashMap<>();
    private final Set<String> rejecting = new HashSet<>();
    private final Set<String> throwing = new HashSet<>();

    public ClientConnection connect(String connectionId) {
        ClientConnection connection = new ClientConnection(connectionId);
        connections.put(connectionId, connection);
        return connection;
    }

    public void disconnect(String connectionId) {
        connections.remove(connectionId);
    }

    /** Sends to this connection return false. */
    public void rejectSendsTo(String connectionId) {
        rejecting.add(connectionId);
    }

    /** Sends to this connection throw. */
    public void failSendsTo(String connectionId) {
        throwing.add(connectionId);
    }

    @Override
    public Optional<ClientConnection> getConnection(String connectionId) {
        return connectionId == null ? Optional.empty() : Optional.ofNullable(connections.get(connectionId));
    }

    @Override
    public synchronized boolean sendToConnection(String connectionId, Object message) {
        if (throwing.contains(connectionId)) {
            throw new IllegalStateException("socket closed: " + connectionId);
        }
        if (rejecting.contains(connectionId) || !connections.containsKey(connectionId)) {
            return false;
        }
        sent.computeIfAbsent(connectionId, k -> new ArrayList<>()).add(message);
        return true;
    }

    @Override
    public int getConnectionCount() {
        return connections.size();
    }

    @Override
    public int getAuthenticatedConnectionCount() {
        return (int) connections.values().stream().filter(ClientConnection::isAuthenticated).count();
    }

    public synchronized List<Object> sentTo(String connectionId) {
        return new ArrayList<>(sent.getOrDefault(connectionId, List.of()));
    }

    public synchronized <T> List<T> sentTo(String connectionId, Class<T> type) {
        return sent.getOrDefault(connectionId, List.of()).stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> T lastSentTo(String connectionId, Class<T> type) {
        List<T> messages = sentTo(connectionId, type);
        if (messages.isEmpty()) {
            throw new AssertionError("No " + type.getSimpleName() + " sent to " + connectionId);
        }
        return messages.get(messages.size() - 1);
    }
}
