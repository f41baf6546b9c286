package br.com.marmitas.realtime.application.subscription;

import br.com.marmitas.realtime.domain.subscription.Subscription;
import br.com.marmitas.realtime.domain.subscription.SubscriptionStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory, dual-indexed store of client subscriptions.
 *
 * Two views over the same set, kept consistent on every mutation:
 * - ownership: clientId -> subscriptionId -> Subscription (teardown by client)
 * - lookup: entityType -> entityId|wildcard -> {"clientId:subscriptionId"} (fan-out)
 *
 * Wildcard subscriptions live under a sentinel bucket that no real entity id can
 * collide with; an instance lookup always reads that bucket too, so type-wide
 * subscribers see instance-level events without scanning all subscriptions.
 *
 * {@link #add} rejects a null subscription, a blank client id, subscription id or
 * entity type, an empty event-kind set, and a client id containing {@code ':'}.
 * Member keys are split on the first {@code ':'}, so subscription ids may contain it.
 *
 * Mutations run under the write lock and are linearizable. Lookups run under the
 * read lock and return copies.
 */
public final class SubscriptionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    // Never equal to a user-supplied id: compared by reference, not content
    private static final Object WILDCARD = new Object();

    private final Map<String, Map<String, Subscription>> clientSubscriptions = new HashMap<>();
    private final Map<String, Map<Object, Set<String>>> entitySubscriptions = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Store a subscription, replacing any existing one with the same (clientId, subscriptionId).
     *
     * @return false, with no mutation, if clientId, subscriptionId, entityType or eventKinds is missing
     */
    public boolean add(Subscription subscription) {
        if (!isValid(subscription)) {
            log.warn("Rejected invalid subscription: {}", subscription);
            return false;
        }

        String clientId = subscription.clientId();
        String subscriptionId = subscription.subscriptionId();

        lock.writeLock().lock();
        try {
            Map<String, Subscription> owned = clientSubscriptions.computeIfAbsent(clientId, k -> new LinkedHashMap<>());
            Subscription previous = owned.put(subscriptionId, subscription);
            if (previous != null) {
                removeFromEntityIndex(previous);
                log.debug("Replaced subscription {}:{} ({} -> {})", clientId, subscriptionId,
                    describe(previous), describe(subscription));
            }
            addToEntityIndex(subscription);
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Added subscription {}:{} on {}", clientId, subscriptionId, describe(subscription));
        return true;
    }

    /**
     * @return false if no such subscription exists
     */
    public boolean remove(String clientId, String subscriptionId) {
        if (clientId == null || subscriptionId == null) {
            return false;
        }

        Subscription removed;
        lock.writeLock().lock();
        try {
            Map<String, Subscription> owned = clientSubscriptions.get(clientId);
            if (owned == null) {
                return false;
            }
            removed = owned.remove(subscriptionId);
            if (removed == null) {
                return false;
            }
            if (owned.isEmpty()) {
                clientSubscriptions.remove(clientId);
            }
            removeFromEntityIndex(removed);
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Removed subscription {}:{} on {}", clientId, subscriptionId, describe(removed));
        return true;
    }

    /**
     * Drop every subscription owned by a client. Called on disconnect.
     *
     * @return number of subscriptions removed, 0 for an unknown client
     */
    public int removeAllForClient(String clientId) {
        if (clientId == null) {
            return 0;
        }

        int count;
        lock.writeLock().lock();
        try {
            Map<String, Subscription> owned = clientSubscriptions.remove(clientId);
            if (owned == null) {
                return 0;
            }
            for (Subscription subscription : owned.values()) {
                removeFromEntityIndex(subscription);
            }
            count = owned.size();
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Removed all {} subscriptions for client {}", count, clientId);
        return count;
    }

    public Optional<Subscription> get(String clientId, String subscriptionId) {
        lock.readLock().lock();
        try {
            Map<String, Subscription> owned = clientSubscriptions.get(clientId);
            return owned == null ? Optional.empty() : Optional.ofNullable(owned.get(subscriptionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Subscription> listForClient(String clientId) {
        lock.readLock().lock();
        try {
            Map<String, Subscription> owned = clientSubscriptions.get(clientId);
            return owned == null ? List.of() : new ArrayList<>(owned.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Subscribers of an entity: the instance bucket (when {@code entityId} is given)
     * united with the wildcard bucket, without duplicates.
     *
     * @return "clientId:subscriptionId" keys
     */
    public List<String> findSubscribers(String entityType, String entityId) {
        lock.readLock().lock();
        try {
            Map<Object, Set<String>> buckets = entitySubscriptions.get(entityType);
            if (buckets == null) {
                return List.of();
            }

            Set<String> result = new LinkedHashSet<>();
            if (entityId != null && !entityId.isEmpty()) {
                Set<String> specific = buckets.get(entityId);
                if (specific != null) {
                    result.addAll(specific);
                }
            }
            Set<String> typeWide = buckets.get(WILDCARD);
            if (typeWide != null) {
                result.addAll(typeWide);
            }
            return new ArrayList<>(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Subscribers of every instance of a type, i.e. the wildcard bucket only.
     */
    public List<String> findSubscribers(String entityType) {
        return findSubscribers(entityType, null);
    }

    /**
     * Same match as {@link #findSubscribers(String, String)}, grouped by client.
     */
    public Map<String, List<String>> findSubscribedClients(String entityType, String entityId) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String member : findSubscribers(entityType, entityId)) {
            int sep = member.indexOf(':');
            String clientId = member.substring(0, sep);
            String subscriptionId = member.substring(sep + 1);
            result.computeIfAbsent(clientId, k -> new ArrayList<>()).add(subscriptionId);
        }
        return result;
    }

    public SubscriptionStats stats() {
        lock.readLock().lock();
        try {
            int total = 0;
            Map<String, Integer> byEntityType = new HashMap<>();
            for (Map<String, Subscription> owned : clientSubscriptions.values()) {
                total += owned.size();
                for (Subscription subscription : owned.values()) {
                    byEntityType.merge(subscription.entityType(), 1, Integer::sum);
                }
            }
            return new SubscriptionStats(clientSubscriptions.size(), total, byEntityType);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasSubscriptions(String clientId) {
        lock.readLock().lock();
        try {
            Map<String, Subscription> owned = clientSubscriptions.get(clientId);
            return owned != null && !owned.isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // LOOKUP VIEW MAINTENANCE (caller holds the write lock)
    // ========================================================================

    private void addToEntityIndex(Subscription subscription) {
        entitySubscriptions
            .computeIfAbsent(subscription.entityType(), k -> new HashMap<>())
            .computeIfAbsent(bucketKey(subscription), k -> new LinkedHashSet<>())
            .add(subscription.memberKey());
    }

    private void removeFromEntityIndex(Subscription subscription) {
        Map<Object, Set<String>> buckets = entitySubscriptions.get(subscription.entityType());
        if (buckets == null) {
            return;
        }

        Object key = bucketKey(subscription);
        Set<String> members = buckets.get(key);
        if (members == null) {
            return;
        }

        members.remove(subscription.memberKey());
        if (members.isEmpty()) {
            buckets.remove(key);
        }
        if (buckets.isEmpty()) {
            entitySubscriptions.remove(subscription.entityType());
        }
    }

    private static Object bucketKey(Subscription subscription) {
        return subscription.isWildcard() ? WILDCARD : subscription.entityId();
    }

    private static boolean isValid(Subscription subscription) {
        return subscription != null
            && notBlank(subscription.clientId())
            && subscription.clientId().indexOf(':') < 0   // member keys split on the first ':'
            && notBlank(subscription.subscriptionId())
            && notBlank(subscription.entityType())
            && !subscription.eventKinds().isEmpty();
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String describe(Subscription subscription) {
        return subscription.entityType() + "/" + (subscription.isWildcard() ? "*" : subscription.entityId());
    }
}
