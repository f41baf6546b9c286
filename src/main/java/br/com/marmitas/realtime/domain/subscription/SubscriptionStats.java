package br.com.marmitas.realtime.domain.subscription;

import java.util.Map;

/**
 * Point-in-time view of the subscription registry.
 */
public record SubscriptionStats(
    int totalClients,
    int totalSubscriptions,
    Map<String, Integer> subscriptionsByEntityType
) {
    public SubscriptionStats {
        subscriptionsByEntityType = Map.copyOf(subscriptionsByEntityType);
    }
}
