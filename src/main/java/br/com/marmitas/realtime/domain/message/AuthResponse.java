package br.com.marmitas.realtime.domain.message;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Reply to an {@code authenticate} message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthResponse(
    String type,
    boolean success,
    String message,
    String userId,
    String error
) {
    public static final String TYPE = "auth_response";

    public static AuthResponse success(String userId) {
        return new AuthResponse(TYPE, true, "Authentication successful", userId, null);
    }

    public static AuthResponse failure(String message) {
        return new AuthResponse(TYPE, false, message, null, null);
    }

    public static AuthResponse failure(String message, String error) {
        return new AuthResponse(TYPE, false, message, null, error);
    }
}
