package br.com.marmitas.realtime.application.subscription;

import br.com.marmitas.realtime.application.auth.ConnectionAuthGate;
import br.com.marmitas.realtime.application.port.output.ConnectionTransport;
import br.com.marmitas.realtime.domain.message.SubscriptionResponse;
import br.com.marmitas.realtime.domain.message.SubscriptionResponse.SubscriptionView;
import br.com.marmitas.realtime.domain.subscription.EventKind;
import br.com.marmitas.realtime.domain.subscription.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Applies {@code subscribe} / {@code unsubscribe} commands from a connection to the registry.
 *
 * The connection id is used as the registry's client id, so disconnect cleanup
 * can drop everything a socket owned in one call.
 */
public final class SubscriptionCommandHandler {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionCommandHandler.class);

    static final String AUTH_REQUIRED = "Authentication required for subscriptions";
    static final String MISSING_ENTITY_TYPE = "Entity type is required";
    static final String INVALID_SUBSCRIPTION = "Invalid subscription";
    static final String NO_MATCH = "No matching subscription found";
    static final String MISSING_SUBSCRIPTION_ID = "Subscription ID is required";
    static final String CONNECTION_CLOSED = "Connection is closed";

    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final SubscriptionRegistry registry;
    private final ConnectionTransport transport;
    private final ConnectionAuthGate authGate;
    private final boolean requireAuthentication;
    private final Set<String> supportedEntityTypes;

    public SubscriptionCommandHandler(SubscriptionRegistry registry, ConnectionTransport transport,
                                      ConnectionAuthGate authGate, boolean requireAuthentication,
                                      Collection<String> supportedEntityTypes) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.authGate = Objects.requireNonNull(authGate, "authGate");
        this.requireAuthentication = requireAuthentication;
        this.supportedEntityTypes = new CopyOnWriteArraySet<>(supportedEntityTypes);
    }

    /**
     * Register a subscription for the connection and reply with the outcome.
     */
    public SubscriptionResponse subscribe(String connectionId, SubscribeRequest request) {
        SubscriptionResponse response = doSubscribe(connectionId, request);
        transport.sendToConnection(connectionId, response);
        return response;
    }

    private SubscriptionResponse doSubscribe(String connectionId, SubscribeRequest request) {
        if (transport.getConnection(connectionId).isEmpty()) {
            log.debug("Ignoring subscribe from closed connection {}", connectionId);
            return SubscriptionResponse.subscribeFailed(CONNECTION_CLOSED);
        }
        if (requireAuthentication && !authGate.isAuthenticated(connectionId)) {
            return SubscriptionResponse.subscribeFailed(AUTH_REQUIRED);
        }

        String entityType = request.entityType();
        if (entityType == null || entityType.isBlank()) {
            return SubscriptionResponse.subscribeFailed(MISSING_ENTITY_TYPE);
        }
        if (!supportedEntityTypes.contains(entityType)) {
            log.warn("Connection {} tried to subscribe to unsupported entity type {}", connectionId, entityType);
            return SubscriptionResponse.unsupportedType(SubscriptionResponse.SUBSCRIBE_TYPE, entityType,
                getSupportedEntityTypes());
        }

        Set<EventKind> kinds = request.eventKinds() == null || request.eventKinds().isEmpty()
            ? EnumSet.allOf(EventKind.class)
            : EventKind.parseAll(request.eventKinds());

        String subscriptionId = request.subscriptionId() != null && !request.subscriptionId().isBlank()
            ? request.subscriptionId()
            : generateSubscriptionId(entityType, request.entityId());

        Subscription subscription = new Subscription(connectionId, subscriptionId, entityType,
            request.entityId(), kinds, Instant.now(), request.metadata(), request.filters());

        if (!registry.add(subscription)) {
            return SubscriptionResponse.subscribeFailed(INVALID_SUBSCRIPTION);
        }

        // Close cleanup runs once; undo an add that lost the race with it
        if (transport.getConnection(connectionId).isEmpty()) {
            registry.remove(connectionId, subscriptionId);
            log.debug("Connection {} closed while subscribing {}, rolled back", connectionId, subscriptionId);
            return SubscriptionResponse.subscribeFailed(CONNECTION_CLOSED);
        }

        log.debug("Connection {} subscribed {} to {}/{}", connectionId, subscriptionId, entityType,
            subscription.isWildcard() ? "*" : subscription.entityId());

        List<String> kindNames = new ArrayList<>();
        for (EventKind kind : subscription.eventKinds()) {
            kindNames.add(kind.wireName());
        }
        return SubscriptionResponse.subscribed(subscriptionId,
            new SubscriptionView(entityType, subscription.entityId(), kindNames));
    }

    /**
     * Remove one subscription, or all of the connection's subscriptions when {@code all} is set.
     */
    public SubscriptionResponse unsubscribe(String connectionId, String subscriptionId, boolean all) {
        SubscriptionResponse response;
        if (all) {
            int removed = registry.removeAllForClient(connectionId);
            response = SubscriptionResponse.unsubscribedAll(removed);
        } else if (subscriptionId == null || subscriptionId.isBlank()) {
            response = SubscriptionResponse.unsubscribeFailed(null, MISSING_SUBSCRIPTION_ID);
        } else if (registry.remove(connectionId, subscriptionId)) {
            response = SubscriptionResponse.unsubscribed(subscriptionId);
        } else {
            response = SubscriptionResponse.unsubscribeFailed(subscriptionId, NO_MATCH);
        }
        transport.sendToConnection(connectionId, response);
        return response;
    }

    public void addSupportedEntityType(String entityType) {
        if (entityType != null && !entityType.isBlank() && supportedEntityTypes.add(entityType)) {
            log.info("Added supported entity type {}", entityType);
        }
    }

    public List<String> getSupportedEntityTypes() {
        return new ArrayList<>(supportedEntityTypes);
    }

    /**
     * {@code entityType[.entityId].<epochMillis>.<random>}
     */
    static String generateSubscriptionId(String entityType, String entityId) {
        StringBuilder id = new StringBuilder(entityType);
        if (entityId != null && !entityId.isEmpty()) {
            id.append('.').append(entityId);
        }
        id.append('.').append(System.currentTimeMillis()).append('.');
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < 6; i++) {
            id.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return id.toString();
    }
}
