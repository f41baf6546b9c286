package br.com.marmitas.realtime.application.auth;

import br.com.marmitas.realtime.application.port.output.ConnectionTransport;
import br.com.marmitas.realtime.application.port.output.RealtimeMetrics;
import br.com.marmitas.realtime.application.port.output.TokenVerifier;
import br.com.marmitas.realtime.application.port.output.TokenVerifier.VerifiedToken;
import br.com.marmitas.realtime.domain.connection.ClientConnection;
import br.com.marmitas.realtime.domain.message.AuthResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Promotes an anonymous connection to an identified principal.
 *
 * Per connection: ANONYMOUS -> AUTHENTICATING -> AUTHENTICATED, or back to
 * ANONYMOUS on failure. Failed attempts do not lock the connection out; rate
 * limiting belongs to the transport.
 *
 * Replies go out through the transport as {@code auth_response} messages.
 */
public final class ConnectionAuthGate {
    private static final Logger log = LoggerFactory.getLogger(ConnectionAuthGate.class);

    static final String MISSING_TOKEN = "No authentication token provided";
    static final String INVALID_TOKEN = "Invalid authentication token";
    static final String FAILED = "Authentication failed";
    static final String GENERIC_ERROR = "Internal server error";

    private final ConnectionTransport transport;
    private final TokenVerifier tokenVerifier;
    private final RealtimeMetrics metrics;
    private final boolean verboseErrors;

    /**
     * @param verboseErrors include the underlying error text in failure replies (non-production only)
     */
    public ConnectionAuthGate(ConnectionTransport transport, TokenVerifier tokenVerifier,
                              RealtimeMetrics metrics, boolean verboseErrors) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.tokenVerifier = Objects.requireNonNull(tokenVerifier, "tokenVerifier");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.verboseErrors = verboseErrors;
    }

    /**
     * Handle an {@code authenticate} message. Side effects only.
     */
    public void handleAuthMessage(String connectionId, String token) {
        if (token == null || token.isBlank()) {
            metrics.recordAuthentication(false);
            transport.sendToConnection(connectionId, AuthResponse.failure(MISSING_TOKEN));
            return;
        }

        Optional<ClientConnection> connection = transport.getConnection(connectionId);
        connection.ifPresent(ClientConnection::beginAuthentication);

        try {
            Optional<VerifiedToken> verified = tokenVerifier.verify(token);

            if (verified.isEmpty() || !verified.get().hasPrincipal()) {
                connection.ifPresent(ClientConnection::rejectAuthentication);
                metrics.recordAuthentication(false);
                log.debug("Rejected token for connection {}", connectionId);
                transport.sendToConnection(connectionId, AuthResponse.failure(INVALID_TOKEN));
                return;
            }

            if (connection.isEmpty()) {
                log.error("Connection {} not found during authentication", connectionId);
                return;
            }

            String userId = verified.get().userId();
            connection.get().authenticate(userId);
            metrics.recordAuthentication(true);

            log.debug("Connection {} authenticated as {}", connectionId, userId);
            transport.sendToConnection(connectionId, AuthResponse.success(userId));

        } catch (Exception e) {
            connection.ifPresent(ClientConnection::rejectAuthentication);
            metrics.recordAuthentication(false);
            log.error("WebSocket authentication error for connection {}", connectionId, e);
            String detail = verboseErrors ? String.valueOf(e.getMessage()) : GENERIC_ERROR;
            transport.sendToConnection(connectionId, AuthResponse.failure(FAILED, detail));
        }
    }

    /**
     * @return false for unknown (already disconnected) connections
     */
    public boolean isAuthenticated(String connectionId) {
        return transport.getConnection(connectionId)
            .map(ClientConnection::isAuthenticated)
            .orElse(false);
    }

    /**
     * @return empty for anonymous or unknown connections
     */
    public Optional<String> getUserId(String connectionId) {
        return transport.getConnection(connectionId)
            .map(ClientConnection::getUserId);
    }
}
