package br.com.marmitas.realtime.domain.change;

import br.com.marmitas.realtime.domain.subscription.EventKind;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Normalized change, ready to be pushed to subscribers.
 * Created once per raw notification and never mutated.
 */
public record TransformedEvent(
    String entityType,
    String entityId,
    EventKind eventKind,
    JsonNode data,
    Instant timestamp,
    ChangeRecord originalPayload
) {
    public TransformedEvent(String entityType, String entityId, EventKind eventKind, JsonNode data) {
        this(entityType, entityId, eventKind, data, Instant.now(), null);
    }
}
