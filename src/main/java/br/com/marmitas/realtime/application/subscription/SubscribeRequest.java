package br.com.marmitas.realtime.application.subscription;

import java.util.List;
import java.util.Map;

/**
 * Parsed {@code subscribe} command. Only {@code entityType} is required.
 */
public record SubscribeRequest(
    String subscriptionId,
    String entityType,
    String entityId,
    List<String> eventKinds,
    Map<String, Object> filters,
    Map<String, Object> metadata
) {
    public static SubscribeRequest of(String entityType, String entityId) {
        return new SubscribeRequest(null, entityType, entityId, null, null, null);
    }
}
