package br.com.marmitas.realtime.domain.message;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Transport-level notices: welcome, pong, heartbeat and errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerNotice(
    String type,
    String message,
    String connectionId,
    Long timestamp
) {
    public static ServerNotice connected(String connectionId) {
        return new ServerNotice("connection", "Connection established", connectionId, null);
    }

    public static ServerNotice pong() {
        return new ServerNotice("pong", null, null, System.currentTimeMillis());
    }

    public static ServerNotice heartbeat() {
        return new ServerNotice("heartbeat", null, null, System.currentTimeMillis());
    }

    public static ServerNotice error(String message) {
        return new ServerNotice("error", message, null, null);
    }
}
