package br.com.marmitas.realtime.application.subscription;

import br.com.marmitas.realtime.domain.subscription.EventKind;
import br.com.marmitas.realtime.domain.subscription.Subscription;
import br.com.marmitas.realtime.domain.subscription.SubscriptionStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionRegistryTest {

    private static final Set<EventKind> ALL = EnumSet.allOf(EventKind.class);

    private SubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry();
    }

    @Test
    void add_indexesUnderOwnerAndEntity() {
        assertTrue(registry.add(Subscription.of("A", "s1", "order", "42", ALL)));

        assertEquals(1, registry.listForClient("A").size());
        assertTrue(registry.get("A", "s1").isPresent());
        assertEquals(List.of("A:s1"), registry.findSubscribers("order", "42"));
        assertTrue(registry.hasSubscriptions("A"));
    }

    @Test
    void add_rejectsIncompleteSubscriptions() {
        assertFalse(registry.add(null));
        assertFalse(registry.add(Subscription.of(null, "s1", "order", null, ALL)));
        assertFalse(registry.add(Subscription.of("A", "", "order", null, ALL)));
        assertFalse(registry.add(Subscription.of("A", "s1", " ", null, ALL)));
        assertFalse(registry.add(Subscription.of("A", "s1", "order", null, Set.of())));
        assertFalse(registry.add(Subscription.of("A:B", "s1", "order", null, ALL)));

        assertEquals(0, registry.stats().totalSubscriptions());
        assertTrue(registry.findSubscribers("order").isEmpty());
    }

    @Test
    void instanceLookupIncludesWildcardSubscribers() {
        registry.add(Subscription.of("A", "s1", "order", "42", ALL));
        registry.add(Subscription.of("B", "s2", "order", null, ALL));
        registry.add(Subscription.of("C", "s3", "order", "7", ALL));

        List<String> subscribers = registry.findSubscribers("order", "42");

        assertEquals(2, subscribers.size());
        assertTrue(subscribers.containsAll(List.of("A:s1", "B:s2")));
        assertEquals(List.of("B:s2"), registry.findSubscribers("order"));
        assertTrue(registry.findSubscribers("product", "42").isEmpty());
    }

    @Test
    void sameClientWithInstanceAndWildcardIsListedTwice() {
        registry.add(Subscription.of("A", "one", "order", "42", ALL));
        registry.add(Subscription.of("A", "all", "order", null, ALL));

        Map<String, List<String>> clients = registry.findSubscribedClients("order", "42");

        assertEquals(1, clients.size());
        assertEquals(Set.of("one", "all"), Set.copyOf(clients.get("A")));
    }

    @Test
    void subscriptionIdWithColonSplitsOnFirstSeparator() {
        registry.add(Subscription.of("A", "orders:42:x", "order", "42", ALL));

        assertEquals(Map.of("A", List.of("orders:42:x")), registry.findSubscribedClients("order", "42"));
    }

    @Test
    void remove_isIdempotentAndPrunesIndexes() {
        registry.add(Subscription.of("A", "s1", "order", "42", ALL));

        assertTrue(registry.remove("A", "s1"));
        assertFalse(registry.remove("A", "s1"));
        assertFalse(registry.remove("nobody", "s1"));
        assertFalse(registry.remove(null, null));

        assertTrue(registry.findSubscribers("order", "42").isEmpty());
        assertFalse(registry.hasSubscriptions("A"));
        assertEquals(new SubscriptionStats(0, 0, Map.of()), registry.stats());
    }

    @Test
    void removeAllForClient_leavesOtherClientsIntact() {
        registry.add(Subscription.of("A", "s1", "order", "42", ALL));
        registry.add(Subscription.of("A", "s2", "product", null, ALL));
        registry.add(Subscription.of("B", "s1", "order", "42", ALL));

        assertEquals(2, registry.removeAllForClient("A"));
        assertEquals(0, registry.removeAllForClient("A"));
        assertEquals(0, registry.removeAllForClient(null));

        assertEquals(List.of("B:s1"), registry.findSubscribers("order", "42"));
        assertTrue(registry.findSubscribers("product").isEmpty());
        assertTrue(registry.listForClient("A").isEmpty());
    }

    @Test
    void add_withExistingIdReplacesLookupMembership() {
        registry.add(Subscription.of("A", "s1", "order", "42", ALL));
        registry.add(Subscription.of("A", "s1", "product", "9", EnumSet.of(EventKind.DELETED)));

        assertTrue(registry.findSubscribers("order", "42").isEmpty());
        assertEquals(List.of("A:s1"), registry.findSubscribers("product", "9"));
        assertEquals(1, registry.stats().totalSubscriptions());
        assertEquals(Set.of(EventKind.DELETED), registry.get("A", "s1").orElseThrow().eventKinds());
    }

    @Test
    void stats_countsByEntityType() {
        registry.add(Subscription.of("A", "s1", "order", "42", ALL));
        registry.add(Subscription.of("A", "s2", "order", null, ALL));
        registry.add(Subscription.of("B", "s1", "product", null, ALL));

        SubscriptionStats stats = registry.stats();

        assertEquals(2, stats.totalClients());
        assertEquals(3, stats.totalSubscriptions());
        assertEquals(Map.of("order", 2, "product", 1), stats.subscriptionsByEntityType());
    }

    @Test
    void returnedCollectionsAreCopies() {
        registry.add(Subscription.of("A", "s1", "order", "42", ALL));

        List<String> subscribers = new ArrayList<>(registry.findSubscribers("order", "42"));
        registry.listForClient("A").clear();
        subscribers.clear();

        assertEquals(1, registry.listForClient("A").size());
        assertEquals(1, registry.findSubscribers("order", "42").size());
    }

    @Test
    void concurrentAddAndRemoveKeepViewsConsistent() throws Exception {
        int clients = 8;
        int perClient = 200;
        ExecutorService pool = Executors.newFixedThreadPool(clients);
        CountDownLatch done = new CountDownLatch(clients);

        for (int c = 0; c < clients; c++) {
            String clientId = "client-" + c;
            pool.submit(() -> {
                try {
                    for (int i = 0; i < perClient; i++) {
                        registry.add(Subscription.of(clientId, "s" + i, "order", String.valueOf(i % 10), ALL));
                        if (i % 2 == 0) {
                            registry.remove(clientId, "s" + i);
                        }
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();

        int fromLookup = 0;
        for (int id = 0; id < 10; id++) {
            fromLookup += registry.findSubscribers("order", String.valueOf(id)).size();
        }
        assertEquals(clients * perClient / 2, registry.stats().totalSubscriptions());
        assertEquals(registry.stats().totalSubscriptions(), fromLookup);
    }
}
