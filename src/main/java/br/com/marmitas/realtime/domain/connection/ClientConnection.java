package br.com.marmitas.realtime.domain.connection;

import java.time.Instant;
import java.util.Objects;

/**
 * Identity and activity state of one persistent client connection.
 *
 * The connection id doubles as the subscription registry's client id.
 * Authentication is one-way: once authenticated, the identity is only
 * dropped together with the connection.
 */
public final class ClientConnection {
    private final String connectionId;
    private final Instant connectedAt;
    private volatile String userId;
    private volatile AuthState authState = AuthState.ANONYMOUS;
    private volatile Instant lastActivity;  // volatile: written by I/O threads, read by the heartbeat sweeper

    public ClientConnection(String connectionId) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.connectedAt = Instant.now();
        this.lastActivity = connectedAt;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public String getUserId() {
        return userId;
    }

    public AuthState getAuthState() {
        return authState;
    }

    public boolean isAuthenticated() {
        return authState == AuthState.AUTHENTICATED;
    }

    public void touch() {
        this.lastActivity = Instant.now();
    }

    /**
     * Enter the verifying state. An already authenticated connection keeps its identity
     * while a new token is checked.
     */
    public synchronized void beginAuthentication() {
        if (authState != AuthState.AUTHENTICATED) {
            authState = AuthState.AUTHENTICATING;
        }
    }

    public synchronized void authenticate(String userId) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.authState = AuthState.AUTHENTICATED;
    }

    /**
     * Back to anonymous after a failed attempt; an authenticated identity is kept.
     */
    public synchronized void rejectAuthentication() {
        if (authState == AuthState.AUTHENTICATING) {
            authState = AuthState.ANONYMOUS;
        }
    }

    @Override
    public String toString() {
        return "ClientConnection{" + connectionId + ", user=" + userId + ", state=" + authState + "}";
    }
}
