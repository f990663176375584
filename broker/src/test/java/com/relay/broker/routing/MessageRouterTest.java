package com.relay.broker.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relay.broker.BrokerExecutor;
import com.relay.broker.session.ClientMetadata;
import com.relay.broker.session.SessionRegistry;
import com.relay.broker.testing.EventRecorder;
import com.relay.broker.testing.FakeConnection;
import com.relay.broker.testing.Loops;
import com.relay.broker.testing.MutableClock;
import com.relay.common.BrokerConfig;
import com.relay.protocol.ClientRole;
import com.relay.protocol.ErrorCode;
import com.relay.protocol.MessageKind;
import com.relay.protocol.Messages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.relay.broker.testing.Futures.failure;
import static com.relay.broker.testing.Futures.get;
import static org.junit.jupiter.api.Assertions.*;

class MessageRouterTest {

    private BrokerExecutor  loop;
    private SessionRegistry registry;
    private MessageRouter   router;

    @BeforeEach
    void setUp() {
        MutableClock  clock  = new MutableClock();
        EventRecorder events = new EventRecorder();
        loop     = new BrokerExecutor("router-test");
        registry = new SessionRegistry(loop, BrokerConfig.defaults(), clock, events);
        router   = new MessageRouter(loop, registry, clock, events);
    }

    @AfterEach
    void tearDown() {
        loop.shutdownGracefully();
    }

    // ── Role routing ──────────────────────────────────────────────────────────

    @Test
    void requestGoesToFirstTargetOnly() {
        FakeConnection a = connect("a", ClientRole.RESPONDER);
        FakeConnection b = connect("b", ClientRole.RESPONDER);
        connect("req", ClientRole.REQUESTER);

        RouteReport report = get(router.route(request("1"), ClientRole.RESPONDER, "req"));

        assertEquals(MessageKind.REQUEST, report.kind());
        assertEquals(List.of("a"), report.delivered());
        assertEquals(1, a.sent.size());
        assertTrue(b.sent.isEmpty(), "Requests are point-to-point");
        assertEquals(1, router.inFlightCount());
    }

    @Test
    void requestWithoutTargetFails() {
        connect("req", ClientRole.REQUESTER);

        assertEquals(ErrorCode.NO_TARGET_AVAILABLE,
                failure(router.route(request("1"), ClientRole.RESPONDER, "req")));
        assertEquals(0, router.inFlightCount());
    }

    @Test
    void responseFansOutAndClearsInFlight() {
        connect("a", ClientRole.RESPONDER);
        FakeConnection r1 = connect("r1", ClientRole.REQUESTER);
        FakeConnection r2 = connect("r2", ClientRole.REQUESTER);
        get(router.route(request("42"), ClientRole.RESPONDER, "r1"));

        ObjectNode response = Messages.object().put("id", "42");
        response.putObject("result").put("ok", true);
        RouteReport report = get(router.route(response, ClientRole.REQUESTER, "a"));

        assertEquals(MessageKind.RESPONSE, report.kind());
        assertEquals(List.of("r1", "r2"), report.delivered());
        assertEquals(1, r1.sent.size());
        assertEquals(1, r2.sent.size());
        assertEquals(0, router.inFlightCount());
    }

    @Test
    void notificationReportsFailedTargetsAsQueued() {
        FakeConnection a = connect("a", ClientRole.RESPONDER);
        FakeConnection b = connect("b", ClientRole.RESPONDER);
        b.failSends = true;
        FakeConnection c = connect("c", ClientRole.RESPONDER);

        RouteReport report = get(router.route(notification("changed"), ClientRole.RESPONDER, null));

        assertEquals(MessageKind.NOTIFICATION, report.kind());
        assertEquals(List.of("a", "c"), report.delivered());
        assertEquals(List.of("b"), report.queued());
        assertEquals(1, a.sent.size());
        assertEquals(1, c.sent.size());
        assertEquals(1, router.queuedCount("b"));
    }

    @Test
    void notificationWithoutTargetsDeliversNothing() {
        RouteReport report = get(router.route(notification("x"), ClientRole.REQUESTER, null));
        assertTrue(report.delivered().isEmpty());
        assertTrue(report.queued().isEmpty());
    }

    @Test
    void routingIgnoresMessageContent() {
        FakeConnection responder = connect("a", ClientRole.RESPONDER);
        FakeConnection requester = connect("r", ClientRole.REQUESTER);

        ObjectNode msg = notification("x");
        msg.putObject("target").put("type", "ai_client");
        get(router.route(msg, ClientRole.RESPONDER, null));

        assertEquals(1, responder.sent.size());
        assertTrue(requester.sent.isEmpty());
    }

    // ── Store and forward ─────────────────────────────────────────────────────

    @Test
    void messagesForOfflineClientAreReplayedInOrderOnConnect() {
        for (int i = 1; i <= 3; i++) {
            assertEquals(ErrorCode.CLIENT_QUEUED, failure(router.deliver("late", notification("m" + i))));
        }
        assertEquals(3, router.queuedCount("late"));
        assertEquals(3, router.queuedCount());

        FakeConnection conn = connect("late", ClientRole.RESPONDER);
        Loops.settle(loop);

        assertEquals(List.of("m1", "m2", "m3"), methods(conn.sent));
        assertEquals(0, router.queuedCount("late"));
        assertEquals(0, router.stats().queuedClients());
    }

    @Test
    void failedReplayKeepsRemainingMessagesInOrder() {
        for (int i = 1; i <= 3; i++) router.deliver("c", notification("m" + i));
        Loops.settle(loop);

        FakeConnection broken = new FakeConnection();
        broken.failSends = true;
        get(registry.register("c", ClientRole.RESPONDER, md(), broken));
        Loops.settle(loop);

        assertFalse(registry.isConnected("c"), "Send failure disconnects the client");
        assertEquals(3, router.queuedCount("c"));

        FakeConnection healthy = connect("c", ClientRole.RESPONDER);
        Loops.settle(loop);

        assertEquals(List.of("m1", "m2", "m3"), methods(healthy.sent));
        assertEquals(0, router.queuedCount("c"));
    }

    @Test
    void deliverToConnectedClientSendsImmediately() {
        FakeConnection conn = connect("a", ClientRole.RESPONDER);

        get(router.deliver("a", notification("now")));

        assertEquals(List.of("now"), methods(conn.sent));
        assertEquals(0, router.queuedCount());
    }

    @Test
    void failedSendQueuesMessage() {
        FakeConnection conn = connect("a", ClientRole.RESPONDER);
        conn.failSends = true;

        assertEquals(ErrorCode.CLIENT_QUEUED, failure(router.deliver("a", notification("x"))));

        assertEquals(1, router.queuedCount("a"));
        assertFalse(registry.isConnected("a"));
    }

    @Test
    void disconnectDropsInFlightRequestsButKeepsQueue() {
        connect("a", ClientRole.RESPONDER);
        connect("req", ClientRole.REQUESTER);
        get(router.route(request("1"), ClientRole.RESPONDER, "req"));
        router.deliver("offline", notification("kept"));

        get(registry.disconnect("req", "bye"));

        assertEquals(0, router.inFlightCount());
        assertEquals(1, router.queuedCount("offline"));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private FakeConnection connect(String id, ClientRole role) {
        FakeConnection conn = new FakeConnection();
        get(registry.register(id, role, md(), conn));
        return conn;
    }

    private static ObjectNode request(String id) {
        ObjectNode m = Messages.object();
        m.put("id", id);
        m.put("method", "workspace.open");
        return m;
    }

    private static ObjectNode notification(String method) {
        return Messages.object().put("method", method);
    }

    private static List<String> methods(List<JsonNode> sent) {
        List<String> out = new ArrayList<>();
        for (JsonNode m : sent) out.add(m.path("method").asText());
        return out;
    }

    private static ClientMetadata md() {
        return new ClientMetadata("test", "1.0", List.of(), null, null);
    }
}
