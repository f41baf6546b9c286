package br.com.marmitas.realtime.domain.message;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collection;
import java.util.List;

/**
 * Reply to {@code subscribe} and {@code unsubscribe} messages.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubscriptionResponse(
    String type,
    boolean success,
    String message,
    String subscriptionId,
    SubscriptionView subscription,
    List<String> supportedTypes,
    Integer removed
) {
    public static final String SUBSCRIBE_TYPE = "subscription_response";
    public static final String UNSUBSCRIBE_TYPE = "unsubscription_response";

    /**
     * Echo of the subscription the reply is about.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SubscriptionView(String entityType, String entityId, List<String> eventKinds) {}

    public static SubscriptionResponse subscribed(String subscriptionId, SubscriptionView view) {
        return new SubscriptionResponse(SUBSCRIBE_TYPE, true, "Subscription successful",
            subscriptionId, view, null, null);
    }

    public static SubscriptionResponse subscribeFailed(String message) {
        return new SubscriptionResponse(SUBSCRIBE_TYPE, false, message, null, null, null, null);
    }

    public static SubscriptionResponse unsupportedType(String type, String entityType, Collection<String> supported) {
        return new SubscriptionResponse(type, false, "Invalid entity type: " + entityType,
            null, null, List.copyOf(supported), null);
    }

    public static SubscriptionResponse unsubscribed(String subscriptionId) {
        return new SubscriptionResponse(UNSUBSCRIBE_TYPE, true, "Unsubscription successful",
            subscriptionId, null, null, 1);
    }

    public static SubscriptionResponse unsubscribedAll(int removed) {
        return new SubscriptionResponse(UNSUBSCRIBE_TYPE, true, "Unsubscribed from all entities",
            null, null, null, removed);
    }

    public static SubscriptionResponse unsubscribeFailed(String subscriptionId, String message) {
        return new SubscriptionResponse(UNSUBSCRIBE_TYPE, false, message, subscriptionId, null, null, null);
    }
}
