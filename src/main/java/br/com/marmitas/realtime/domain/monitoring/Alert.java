package br.com.marmitas.realtime.domain.monitoring;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Alert raised by the connection monitor.
 *
 * @param type    stable identifier, e.g. {@code CONNECTION_LIMIT_EXCEEDED}
 * @param details numeric context for the alert; copied on construction
 */
public record Alert(String type, AlertLevel level, String message, Instant raisedAt, Map<String, Object> details) {

    public Alert {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(message, "message");
        raisedAt = raisedAt != null ? raisedAt : Instant.now();
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static Alert of(String type, AlertLevel level, String message, Map<String, Object> details) {
        return new Alert(type, level, message, Instant.now(), details);
    }

    @Override
    public String toString() {
        return "[" + level + "] " + type + ": " + message + " (" + raisedAt + ")";
    }
}
