package br.com.marmitas.realtime.domain.connection;

/**
 * Identity state of a live connection.
 * A rejected attempt returns the connection to {@link #ANONYMOUS}.
 */
public enum AuthState {
    ANONYMOUS,
    AUTHENTICATING,
    AUTHENTICATED
}
