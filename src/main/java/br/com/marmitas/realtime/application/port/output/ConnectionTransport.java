package br.com.marmitas.realtime.application.port.output;

import br.com.marmitas.realtime.domain.connection.ClientConnection;

import java.util.Optional;

/**
 * Port for the duplex transport that owns the client sockets.
 * The registry, gate and monitor never touch sockets directly.
 */
public interface ConnectionTransport {

    /**
     * @return the live connection, or empty if it has already disconnected
     */
    Optional<ClientConnection> getConnection(String connectionId);

    /**
     * Serialize and send a message to one connection without waiting for the write.
     *
     * @return false if the connection is unknown or the send could not be queued
     */
    boolean sendToConnection(String connectionId, Object message);

    int getConnectionCount();

    int getAuthenticatedConnectionCount();
}
