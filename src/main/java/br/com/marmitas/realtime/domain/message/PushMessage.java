package br.com.marmitas.realtime.domain.message;

import br.com.marmitas.realtime.domain.change.TransformedEvent;
import br.com.marmitas.realtime.domain.subscription.EventKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Push envelope delivered once per matching subscription.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PushMessage(
    String type,
    String subscriptionId,
    String entityType,
    String entityId,
    EventKind eventKind,
    JsonNode data,
    long timestamp
) {
    public static final String TYPE = "event";

    public static PushMessage of(String subscriptionId, TransformedEvent event) {
        return new PushMessage(TYPE, subscriptionId, event.entityType(), event.entityId(),
            event.eventKind(), event.data(), event.timestamp().toEpochMilli());
    }
}
