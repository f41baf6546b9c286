package br.com.marmitas.realtime.transport.ws;

import br.com.marmitas.realtime.application.auth.ConnectionAuthGate;
import br.com.marmitas.realtime.application.fanout.FanOutCoordinator;
import br.com.marmitas.realtime.application.monitoring.AlertService;
import br.com.marmitas.realtime.application.monitoring.ConnectionMonitor;
import br.com.marmitas.realtime.application.subscription.SubscriptionCommandHandler;
import br.com.marmitas.realtime.application.subscription.SubscriptionRegistry;
import br.com.marmitas.realtime.application.transform.EventTransformer;
import br.com.marmitas.realtime.auth.JwtService;
import br.com.marmitas.realtime.domain.change.ChangeRecord;
import br.com.marmitas.realtime.infrastructure.metrics.PrometheusRealtimeMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test over a real socket: connect, authenticate, subscribe, receive a push, disconnect.
 */
public class WsHubTest {

    private static final int TEST_PORT = 19091;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Undertow server;
    private WsHub hub;
    private SubscriptionRegistry registry;
    private JwtService jwt;
    private FanOutCoordinator fanOut;
    private WebSocket socket;
    private final BlockingQueue<JsonNode> inbox = new LinkedBlockingQueue<>();

    @BeforeEach
    public void setUp() throws Exception {
        PrometheusRealtimeMetrics metrics = new PrometheusRealtimeMetrics(new CollectorRegistry());
        registry = new SubscriptionRegistry();
        jwt = new JwtService("ws-test-secret", 60_000);
        hub = new WsHub(Duration.ofMinutes(1), Duration.ofMinutes(2));

        EventTransformer transformer = EventTransformer.withDefaults(List.of("orders"), metrics);
        ConnectionAuthGate gate = new ConnectionAuthGate(hub, jwt, metrics, true);
        ConnectionMonitor monitor = new ConnectionMonitor(hub, registry, metrics, new AlertService(),
            Duration.ofMinutes(1), 0);
        SubscriptionCommandHandler commands = new SubscriptionCommandHandler(registry, hub, gate, true,
            List.of("orders"));
        WsMessageRouter router = new WsMessageRouter(hub, gate, commands, registry, monitor, metrics);
        fanOut = new FanOutCoordinator(registry, transformer, hub, metrics, monitor);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.routing().get("/ws", hub.websocketHandler(router)))
            .build();
        server.start();
        hub.start();

        socket = HttpClient.newHttpClient().newWebSocketBuilder()
            .buildAsync(URI.create("ws://localhost:" + TEST_PORT + "/ws"), new WebSocket.Listener() {
                private final StringBuilder partial = new StringBuilder();

                @Override
                public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
                    partial.append(data);
                    if (last) {
                        try {
                            inbox.add(MAPPER.readTree(partial.toString()));
                        } catch (Exception e) {
                            fail("Server sent invalid JSON: " + partial);
                        }
                        partial.setLength(0);
                    }
                    ws.request(1);
                    return null;
                }
            })
            .get(5, TimeUnit.SECONDS);
    }

    @AfterEach
    public void tearDown() {
        if (socket != null) {
            socket.abort();
        }
        hub.stop();
        server.stop();
    }

    private JsonNode next() throws InterruptedException {
        JsonNode message = inbox.poll(5, TimeUnit.SECONDS);
        assertNotNull(message, "no message received");
        return message;
    }

    private void send(String json) throws Exception {
        socket.sendText(json, true).get(5, TimeUnit.SECONDS);
    }

    @Test
    public void fullSessionFlow() throws Exception {
        JsonNode welcome = next();
        assertEquals("connection", welcome.get("type").asText());
        String connectionId = welcome.get("connectionId").asText();
        assertEquals(1, hub.getConnectionCount());

        send("{\"type\":\"subscribe\",\"entityType\":\"orders\"}");
        JsonNode denied = next();
        assertFalse(denied.get("success").asBoolean());

        send("{\"type\":\"authenticate\",\"token\":\"" + jwt.generateToken("user-1", "a@b.c", "CUSTOMER") + "\"}");
        JsonNode auth = next();
        assertEquals("auth_response", auth.get("type").asText());
        assertTrue(auth.get("success").asBoolean());
        assertEquals(1, hub.getAuthenticatedConnectionCount());

        send("{\"type\":\"subscribe\",\"subscriptionId\":\"mine\",\"entityType\":\"orders\",\"entityId\":\"42\"}");
        assertTrue(next().get("success").asBoolean());

        fanOut.onChange(ChangeRecord.insert("orders", MAPPER.readTree("{\"id\":42,\"status\":\"new\"}")));
        JsonNode push = next();
        assertEquals("event", push.get("type").asText());
        assertEquals("mine", push.get("subscriptionId").asText());
        assertEquals("created", push.get("eventKind").asText());
        assertEquals("new", push.get("data").get("status").asText());

        send("{\"type\":\"ping\"}");
        assertEquals("pong", next().get("type").asText());

        socket.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(5, TimeUnit.SECONDS);
        long deadline = System.currentTimeMillis() + 5000;
        while (hub.getConnection(connectionId).isPresent() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(hub.getConnection(connectionId).isEmpty());
        assertFalse(registry.hasSubscriptions(connectionId));
    }

    @Test
    public void sendToUnknownConnectionFails() throws Exception {
        next();
        assertFalse(hub.sendToConnection("nope", "{}"));
        assertEquals(0, hub.broadcastToConnections(List.of("nope"), "{}"));
    }
}
