package br.com.marmitas.realtime.domain.subscription;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A client's interest in changes to one entity type, optionally narrowed to one entity.
 *
 * A null {@code entityId} is a wildcard: every instance of {@code entityType} matches.
 * {@code filters} are equality checks applied to the pushed event data; empty means none.
 */
public record Subscription(
    String clientId,
    String subscriptionId,
    String entityType,
    String entityId,
    Set<EventKind> eventKinds,
    Instant createdAt,
    Map<String, Object> metadata,
    Map<String, Object> filters
) {
    public Subscription {
        eventKinds = eventKinds == null || eventKinds.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(EventKind.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(eventKinds));
        createdAt = createdAt != null ? createdAt : Instant.now();
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        if (entityId != null && entityId.isEmpty()) {
            entityId = null;
        }
    }

    public static Subscription of(String clientId, String subscriptionId, String entityType,
                                  String entityId, Set<EventKind> eventKinds) {
        return new Subscription(clientId, subscriptionId, entityType, entityId, eventKinds, null, null, null);
    }

    public boolean isWildcard() {
        return entityId == null;
    }

    public boolean accepts(EventKind kind) {
        return eventKinds.contains(kind);
    }

    /**
     * Key under which the lookup view stores this subscription.
     */
    public String memberKey() {
        return clientId + ":" + subscriptionId;
    }
}
