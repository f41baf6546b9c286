package br.com.marmitas.realtime.application.subscription;

import br.com.marmitas.realtime.application.auth.ConnectionAuthGate;
import br.com.marmitas.realtime.application.port.output.RealtimeMetrics;
import br.com.marmitas.realtime.application.port.output.TokenVerifier;
import br.com.marmitas.realtime.domain.connection.ClientConnection;
import br.com.marmitas.realtime.domain.message.SubscriptionResponse;
import br.com.marmitas.realtime.domain.subscription.EventKind;
import br.com.marmitas.realtime.domain.subscription.Subscription;
import br.com.marmitas.realtime.support.RecordingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class SubscriptionCommandHandlerTest {

    private static final List<String> TYPES = List.of("products", "orders");
    private static final SubscribeRequest LATE = new SubscribeRequest("late", "orders", null, null, null, null);

    @Mock
    private TokenVerifier verifier;
    @Mock
    private RealtimeMetrics metrics;

    private RecordingTransport transport;
    private SubscriptionRegistry registry;
    private SubscriptionCommandHandler handler;

    @BeforeEach
    void setUp() {
        transport = new RecordingTransport();
        transport.connect("c1");
        registry = new SubscriptionRegistry();
        handler = newHandler(false);
    }

    private SubscriptionCommandHandler newHandler(boolean requireAuth) {
        ConnectionAuthGate gate = new ConnectionAuthGate(transport, verifier, metrics, true);
        return new SubscriptionCommandHandler(registry, transport, gate, requireAuth, TYPES);
    }

    @Test
    void subscribe_registersUnderConnectionId() {
        SubscriptionResponse response = handler.subscribe("c1", new SubscribeRequest(
            "my-sub", "orders", "42", List.of("updated"), Map.of("status", "paid"), Map.of("screen", "tracking")));

        assertTrue(response.success());
        assertEquals("my-sub", response.subscriptionId());
        assertEquals(List.of("updated"), response.subscription().eventKinds());
        assertEquals(response, transport.lastSentTo("c1", SubscriptionResponse.class));

        Subscription stored = registry.get("c1", "my-sub").orElseThrow();
        assertEquals("42", stored.entityId());
        assertEquals(Set.of(EventKind.UPDATED), stored.eventKinds());
        assertEquals(Map.of("status", "paid"), stored.filters());
        assertEquals(Map.of("screen", "tracking"), stored.metadata());
    }

    @Test
    void subscribe_defaultsToAllKindsAndGeneratedId() {
        SubscriptionResponse response = handler.subscribe("c1", SubscribeRequest.of("orders", "42"));

        assertTrue(response.success());
        assertTrue(response.subscriptionId().matches("orders\\.42\\.\\d+\\.[a-z0-9]{6}"), response.subscriptionId());
        assertEquals(Set.of(EventKind.values()),
            registry.get("c1", response.subscriptionId()).orElseThrow().eventKinds());
    }

    @Test
    void subscribe_anyExpandsToAllKinds() {
        SubscriptionResponse response = handler.subscribe("c1",
            new SubscribeRequest("s", "orders", null, List.of("any"), null, null));

        assertEquals(3, response.subscription().eventKinds().size());
        assertNull(response.subscription().entityId());
    }

    @Test
    void subscribe_unknownEntityTypeListsSupported() {
        SubscriptionResponse response = handler.subscribe("c1", SubscribeRequest.of("invoices", null));

        assertFalse(response.success());
        assertEquals("Invalid entity type: invoices", response.message());
        assertEquals(TYPES, response.supportedTypes());
        assertFalse(registry.hasSubscriptions("c1"));
    }

    @Test
    void subscribe_missingEntityType() {
        SubscriptionResponse response = handler.subscribe("c1", SubscribeRequest.of(null, null));

        assertEquals(SubscriptionCommandHandler.MISSING_ENTITY_TYPE, response.message());
    }

    @Test
    void subscribe_onlyUnknownKindsIsInvalid() {
        SubscriptionResponse response = handler.subscribe("c1",
            new SubscribeRequest("s", "orders", null, List.of("archived"), null, null));

        assertFalse(response.success());
        assertEquals(SubscriptionCommandHandler.INVALID_SUBSCRIPTION, response.message());
    }

    @Test
    void subscribe_requiresAuthenticationWhenConfigured() {
        SubscriptionCommandHandler strict = newHandler(true);

        SubscriptionResponse anonymous = strict.subscribe("c1", SubscribeRequest.of("orders", null));
        assertEquals(SubscriptionCommandHandler.AUTH_REQUIRED, anonymous.message());

        transport.getConnection("c1").orElseThrow().authenticate("user-1");
        assertTrue(strict.subscribe("c1", SubscribeRequest.of("orders", null)).success());
    }

    @Test
    void addSupportedEntityType_allowsNewType() {
        handler.addSupportedEntityType("reviews");

        assertTrue(handler.getSupportedEntityTypes().contains("reviews"));
        assertTrue(handler.subscribe("c1", SubscribeRequest.of("reviews", null)).success());
    }

    @Test
    void unsubscribe_single() {
        handler.subscribe("c1", new SubscribeRequest("s1", "orders", null, null, null, null));

        assertTrue(handler.unsubscribe("c1", "s1", false).success());

        SubscriptionResponse again = handler.unsubscribe("c1", "s1", false);
        assertFalse(again.success());
        assertEquals(SubscriptionCommandHandler.NO_MATCH, again.message());
        assertEquals(SubscriptionResponse.UNSUBSCRIBE_TYPE, again.type());
    }

    @Test
    void unsubscribe_all() {
        handler.subscribe("c1", SubscribeRequest.of("orders", null));
        handler.subscribe("c1", SubscribeRequest.of("products", "3"));

        SubscriptionResponse response = handler.unsubscribe("c1", null, true);

        assertTrue(response.success());
        assertEquals(2, response.removed());
        assertFalse(registry.hasSubscriptions("c1"));
    }

    @Test
    void unsubscribe_withoutIdIsRejected() {
        assertEquals(SubscriptionCommandHandler.MISSING_SUBSCRIPTION_ID,
            handler.unsubscribe("c1", null, false).message());
    }

    @Test
    void generatedIdsOmitMissingEntityId() {
        String id = SubscriptionCommandHandler.generateSubscriptionId("products", null);

        assertTrue(id.matches("products\\.\\d+\\.[a-z0-9]{6}"), id);
    }

    @Test
    void subscribe_afterDisconnectIsRejected() {
        transport.disconnect("c1");
        registry.removeAllForClient("c1");

        SubscriptionResponse response = handler.subscribe("c1", LATE);

        assertFalse(response.success());
        assertEquals(SubscriptionCommandHandler.CONNECTION_CLOSED, response.message());
        assertFalse(registry.hasSubscriptions("c1"));
        assertEquals(0, registry.stats().totalSubscriptions());
    }

    @Test
    void subscribe_rolledBackWhenConnectionClosesDuringAdd() {
        AtomicInteger lookups = new AtomicInteger();
        RecordingTransport closing = new RecordingTransport() {
            @Override
            public Optional<ClientConnection> getConnection(String connectionId) {
                // Open on the first lookup, closed afterwards
                return lookups.getAndIncrement() == 0 ? super.getConnection(connectionId) : Optional.empty();
            }
        };
        closing.connect("c1");
        ConnectionAuthGate gate = new ConnectionAuthGate(closing, verifier, metrics, true);
        SubscriptionCommandHandler racing = new SubscriptionCommandHandler(registry, closing, gate, false, TYPES);

        SubscriptionResponse response = racing.subscribe("c1", LATE);

        assertFalse(response.success());
        assertEquals(SubscriptionCommandHandler.CONNECTION_CLOSED, response.message());
        assertTrue(registry.get("c1", "late").isEmpty());
        assertTrue(registry.findSubscribedClients("orders", null).isEmpty());
    }
}
