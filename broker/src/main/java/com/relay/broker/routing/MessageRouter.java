package com.relay.broker.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.relay.broker.BrokerException;
import com.relay.broker.BrokerExecutor;
import com.relay.broker.event.BrokerEventListener;
import com.relay.broker.event.ErrorOccurred;
import com.relay.broker.session.ClientSession;
import com.relay.broker.session.SessionListener;
import com.relay.broker.session.SessionRegistry;
import com.relay.protocol.ClientRole;
import com.relay.protocol.ErrorCode;
import com.relay.protocol.MessageKind;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Role-based message routing with store-and-forward for offline targets.
 *
 * Targets are resolved only from the declared role; message content never
 * influences who receives it. Messages for a client that is offline (or
 * already has a backlog) are appended to that client's queue and replayed in
 * arrival order when the registry reports it connected again.
 *
 * Queues survive disconnects and are keyed by client id, so replay happens
 * only when a client comes back under the same id.
 */
public final class MessageRouter implements SessionListener {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final BrokerExecutor      loop;
    private final SessionRegistry     registry;
    private final Clock               clock;
    private final BrokerEventListener events;

    // clientId -> FIFO backlog; an entry exists only while non-empty (or mid-drain)
    private final Map<String, ArrayDeque<JsonNode>> queues   = new HashMap<>();
    private final Set<String>                        draining = new HashSet<>();
    // request id -> origin client id, for requests still awaiting a response
    private final Map<String, String>                inFlight = new HashMap<>();

    public MessageRouter(BrokerExecutor loop, SessionRegistry registry, Clock clock, BrokerEventListener events) {
        this.loop     = loop;
        this.registry = registry;
        this.clock    = clock;
        this.events   = events;
        registry.addListener(this);
    }

    // ── Routing ───────────────────────────────────────────────────────────────

    /**
     * Routes a message to clients of {@code targetRole}.
     *
     * Requests go to exactly one target (the first registered), responses and
     * notifications to all of them.
     *
     * @param originId sending client, or null for broker-originated messages
     */
    public Future<RouteReport> route(JsonNode message, ClientRole targetRole, String originId) {
        return loop.flatCall(() -> {
            MessageKind kind = MessageKind.classify(message);
            log.debug("Routing {} id={} method={} to {}", kind, message.path("id").asText(null),
                    message.path("method").asText(null), targetRole);
            return switch (kind) {
                case REQUEST  -> routeRequest(message, targetRole, originId);
                case RESPONSE -> {
                    inFlight.remove(message.path("id").asText());
                    yield routeToAll(kind, message, targetRole);
                }
                case NOTIFICATION -> routeToAll(kind, message, targetRole);
            };
        });
    }

    private Future<RouteReport> routeRequest(JsonNode message, ClientRole targetRole, String originId) {
        List<String> targets = targetIds(targetRole);
        if (targets.isEmpty()) {
            return loop.failed(new BrokerException(ErrorCode.NO_TARGET_AVAILABLE,
                    "No " + targetRole.wireName + " clients available for request"));
        }
        String target = targets.get(0);
        if (originId != null) {
            inFlight.put(message.path("id").asText(), originId);
        }

        Promise<RouteReport> promise = loop.newPromise();
        deliver0(target, message).addListener(f -> {
            if (f.isSuccess()) {
                promise.trySuccess(new RouteReport(MessageKind.REQUEST, List.of(target), List.of()));
            } else {
                promise.tryFailure(f.cause());
            }
        });
        return promise;
    }

    private Future<RouteReport> routeToAll(MessageKind kind, JsonNode message, ClientRole targetRole) {
        List<String> targets = targetIds(targetRole);
        Promise<RouteReport> promise = loop.newPromise();
        if (targets.isEmpty()) {
            log.debug("No {} clients for {}", targetRole, kind);
            promise.trySuccess(new RouteReport(kind, List.of(), List.of()));
            return promise;
        }

        List<String> delivered = new ArrayList<>();
        List<String> queued    = new ArrayList<>();
        int[] remaining = { targets.size() };
        for (String target : targets) {
            deliver0(target, message).addListener(f -> {
                if (f.isSuccess()) {
                    delivered.add(target);
                } else {
                    log.warn("Failed to route {} to client {}: {}", kind, target, f.cause().getMessage());
                    if (BrokerException.codeOf(f.cause()) == ErrorCode.CLIENT_QUEUED) queued.add(target);
                }
                if (--remaining[0] == 0) {
                    promise.trySuccess(new RouteReport(kind, inOrder(targets, delivered), inOrder(targets, queued)));
                }
            });
        }
        return promise;
    }

    private List<String> targetIds(ClientRole role) {
        List<String> ids = new ArrayList<>();
        for (ClientSession s : registry.sessions(role)) ids.add(s.id);
        return ids;
    }

    // ── Store and forward ─────────────────────────────────────────────────────

    /**
     * Point-to-point delivery. When the client is offline, has a backlog, or the
     * send fails, the message is queued and the future fails with CLIENT_QUEUED.
     */
    public Future<Void> deliver(String clientId, JsonNode message) {
        return loop.flatCall(() -> deliver0(clientId, message));
    }

    private Future<Void> deliver0(String clientId, JsonNode message) {
        if (queues.containsKey(clientId) || !registry.isConnected(clientId)) {
            enqueue(clientId, message);
            return loop.failed(new BrokerException(ErrorCode.CLIENT_QUEUED,
                    "Client " + clientId + " not connected, message queued"));
        }

        Promise<Void> promise = loop.newPromise();
        registry.send(clientId, message).addListener(f -> {
            if (f.isSuccess()) {
                promise.trySuccess(null);
                return;
            }
            enqueue(clientId, message);
            promise.tryFailure(new BrokerException(ErrorCode.CLIENT_QUEUED,
                    "Delivery to client " + clientId + " failed, message queued", f.cause()));
        });
        return promise;
    }

    private void enqueue(String clientId, JsonNode message) {
        queues.computeIfAbsent(clientId, k -> new ArrayDeque<>()).addLast(message);
        log.debug("Message queued for client {} (backlog={})", clientId, queues.get(clientId).size());
    }

    /**
     * Replays a client's backlog one message at a time, each send awaited before
     * the next. A failed send puts the message back at the head and stops.
     */
    private void drain(String clientId) {
        ArrayDeque<JsonNode> queue = queues.get(clientId);
        if (queue == null || !draining.add(clientId)) return;
        log.info("Processing queued messages for client {} (count={})", clientId, queue.size());
        drainNext(clientId, queue);
    }

    private void drainNext(String clientId, ArrayDeque<JsonNode> queue) {
        JsonNode next = queue.pollFirst();
        if (next == null) {
            queues.remove(clientId);
            draining.remove(clientId);
            log.debug("Backlog for client {} drained", clientId);
            return;
        }
        registry.send(clientId, next).addListener(f -> {
            if (f.isSuccess()) {
                drainNext(clientId, queue);
                return;
            }
            queue.addFirst(next);
            draining.remove(clientId);
            log.warn("Failed to send queued message to client {}, {} left in backlog: {}",
                    clientId, queue.size(), f.cause().getMessage());
            events.onEvent(new ErrorOccurred(clock.instant(), ErrorOccurred.ErrorKind.ROUTING,
                    "Queued message replay failed", clientId, f.cause()));
        });
    }

    // ── Session events ────────────────────────────────────────────────────────

    @Override
    public void onClientConnected(ClientSession session) {
        drain(session.id);
    }

    @Override
    public void onClientDisconnected(ClientSession session, String reason) {
        int before = inFlight.size();
        inFlight.values().removeIf(origin -> origin.equals(session.id));
        log.debug("Cleaned up {} in-flight request(s) for disconnected client {}", before - inFlight.size(), session.id);
    }

    // ── Stats ─────────────────────────────────────────────────────────────────

    public int queuedCount(String clientId) {
        return loop.await(() -> {
            ArrayDeque<JsonNode> q = queues.get(clientId);
            return q != null ? q.size() : 0;
        });
    }

    public int queuedCount() {
        return loop.await(() -> queues.values().stream().mapToInt(ArrayDeque::size).sum());
    }

    public int inFlightCount() {
        return loop.await(inFlight::size);
    }

    public RoutingStats stats() {
        return loop.await(() -> new RoutingStats(
                inFlight.size(),
                queues.values().stream().mapToInt(ArrayDeque::size).sum(),
                queues.size()));
    }

    private static List<String> inOrder(List<String> targets, List<String> subset) {
        List<String> out = new ArrayList<>(subset.size());
        for (String t : targets) {
            if (subset.contains(t)) out.add(t);
        }
        return out;
    }
}
