package com.relay.broker.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.relay.broker.BrokerException;
import com.relay.broker.BrokerExecutor;
import com.relay.broker.event.BrokerEventListener;
import com.relay.broker.event.ClientConnected;
import com.relay.broker.event.ClientDisconnected;
import com.relay.broker.event.ErrorOccurred;
import com.relay.common.BrokerConfig;
import com.relay.common.LatencyStats;
import com.relay.protocol.ClientRole;
import com.relay.protocol.ErrorCode;
import com.relay.protocol.Messages;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of pending and identified client connections.
 *
 * Per physical connection:
 *   accept → pending ──identify──► session ──disconnect / stale / send failure──► gone
 *
 * All state lives on the broker loop. Iteration order of the session map is
 * registration order; the router relies on it to pick "the first" target.
 */
public final class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    /** Idle sessions older than this many heartbeat periods get a liveness check. */
    static final int STALE_MULTIPLIER = 3;

    public static final String REASON_SEND_FAILURE = "Send failure";
    public static final String REASON_STALE        = "Stale connection";
    public static final String REASON_SHUTDOWN     = "Server shutdown";

    private final BrokerExecutor      loop;
    private final BrokerConfig        cfg;
    private final Clock               clock;
    private final BrokerEventListener events;
    private final LatencyStats        sendLatency = new LatencyStats("send-latency");

    private final Object2ObjectLinkedOpenHashMap<String, ClientSession>     sessions = new Object2ObjectLinkedOpenHashMap<>();
    private final Object2ObjectLinkedOpenHashMap<String, PendingConnection> pending  = new Object2ObjectLinkedOpenHashMap<>();
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private ScheduledFuture<?> heartbeatTimer;

    public SessionRegistry(BrokerExecutor loop, BrokerConfig cfg, Clock clock, BrokerEventListener events) {
        this.loop   = loop;
        this.cfg    = cfg;
        this.clock  = clock;
        this.events = events;
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    public void start() {
        loop.execute(() -> {
            if (heartbeatTimer != null) return;
            heartbeatTimer = loop.scheduleAtFixedRate(this::heartbeatTick, cfg.heartbeatInterval());
            log.info("Session registry started: heartbeat={}ms maxClients={}", cfg.heartbeatIntervalMs, cfg.maxClients);
        });
    }

    /**
     * Stops the heartbeat and disconnects every session. The returned future
     * completes once all of them are closed; individual close failures are
     * logged and do not fail it.
     */
    public Future<Void> shutdown() {
        return loop.flatCall(() -> {
            if (heartbeatTimer != null) {
                heartbeatTimer.cancel(false);
                heartbeatTimer = null;
            }
            List<Future<Void>> closing = new ArrayList<>();
            for (String id : new ArrayList<>(pending.keySet())) {
                closing.add(disconnect0(id, REASON_SHUTDOWN));
            }
            for (String id : new ArrayList<>(sessions.keySet())) {
                closing.add(disconnect0(id, REASON_SHUTDOWN));
            }
            log.info("Session registry stopping, closing {} connection(s)", closing.size());
            return allSettled(closing);
        });
    }

    // ── Connection establishment ─────────────────────────────────────────────

    /**
     * Records a freshly opened connection that has not identified yet.
     * @return the id the session will carry once identified
     */
    public String accept(ClientConnection connection, String userAgent) {
        String id = UUID.randomUUID().toString();
        loop.execute(() -> {
            pending.put(id, new PendingConnection(id, connection, userAgent, clock.instant()));
            log.info("New connection: id={} userAgent={}", id, userAgent);
        });
        return id;
    }

    /**
     * Promotes a pending connection to a session.
     * Completes with null (logging only) when the pending connection has already gone.
     */
    public Future<ClientSession> identify(String pendingId, JsonNode params) {
        return loop.call(() -> identify0(pendingId, params));
    }

    private ClientSession identify0(String pendingId, JsonNode params) {
        PendingConnection p = pending.get(pendingId);
        if (p == null) {
            log.warn("Identify for unknown or closed connection {}", pendingId);
            return null;
        }
        if (sessions.size() >= cfg.maxClients) {
            throw new BrokerException(ErrorCode.CAPACITY_EXCEEDED, "Maximum client limit reached (" + cfg.maxClients + ")");
        }
        pending.remove(pendingId);

        ClientRole     role     = ClientRole.fromClientType(params.path("clientType").asText(null));
        ClientMetadata metadata = ClientMetadata.fromIdentifyParams(p.userAgent(), params);

        // Ack goes out before connect listeners run so it precedes any replayed queue
        p.connection().send(Messages.connectionAck(pendingId)).addListener(f -> {
            if (!f.isSuccess()) {
                log.error("Failed to send connection acknowledgment to {}: {}", pendingId, f.cause().toString());
            }
        });
        return add(pendingId, role, metadata, p.connection());
    }

    /**
     * Direct registration path for clients whose identity is chosen by the caller
     * (e.g. connections established through another transport).
     */
    public Future<ClientSession> register(String id, ClientRole role, ClientMetadata metadata, ClientConnection connection) {
        return loop.call(() -> {
            if (sessions.containsKey(id)) {
                throw new BrokerException(ErrorCode.INVALID_STATE, "Client " + id + " is already connected");
            }
            if (sessions.size() >= cfg.maxClients) {
                throw new BrokerException(ErrorCode.CAPACITY_EXCEEDED, "Maximum client limit reached (" + cfg.maxClients + ")");
            }
            return add(id, role, metadata, connection);
        });
    }

    private ClientSession add(String id, ClientRole role, ClientMetadata metadata, ClientConnection connection) {
        Instant now = clock.instant();
        ClientSession session = new ClientSession(id, role, metadata, connection, now);
        sessions.put(id, session);

        log.info("Client connected: id={} role={} name={} version={}", id, role, metadata.clientName(), metadata.version());
        events.onEvent(new ClientConnected(now, id, role, metadata));
        for (SessionListener l : listeners) {
            try {
                l.onClientConnected(session);
            } catch (RuntimeException e) {
                log.error("Connect listener failed for client {}", id, e);
            }
        }
        return session;
    }

    /**
     * Writes a final message to a connection that failed identification, then
     * closes it. No-op when the connection is no longer pending.
     */
    public Future<Void> rejectPending(String pendingId, JsonNode message, String reason) {
        return loop.flatCall(() -> {
            PendingConnection p = pending.get(pendingId);
            if (p == null) return loop.succeeded(null);
            Promise<Void> done = loop.newPromise();
            Future<Void> write;
            try {
                write = p.connection().send(message);
            } catch (RuntimeException e) {
                write = loop.failed(e);
            }
            write.addListener(f -> loop.execute(() -> {
                if (!f.isSuccess()) {
                    log.debug("Could not deliver rejection to {}: {}", pendingId, f.cause().toString());
                }
                BrokerExecutor.cascade(disconnect0(pendingId, reason), done);
            }));
            return done;
        });
    }

    // ── Teardown ──────────────────────────────────────────────────────────────

    /**
     * Idempotent. Completes once the connection close has finished; close errors
     * are logged, never propagated.
     */
    public Future<Void> disconnect(String id, String reason) {
        return loop.flatCall(() -> disconnect0(id, reason));
    }

    private Future<Void> disconnect0(String id, String reason) {
        PendingConnection p = pending.remove(id);
        if (p != null) {
            log.debug("Pending connection {} closed before identifying: {}", id, reason);
            return closeQuietly(id, p.connection());
        }

        ClientSession session = sessions.remove(id);
        if (session == null) return loop.succeeded(null);

        log.info("Client disconnected: id={} reason={}", id, reason);
        events.onEvent(new ClientDisconnected(clock.instant(), id, session.role, reason));
        for (SessionListener l : listeners) {
            try {
                l.onClientDisconnected(session, reason);
            } catch (RuntimeException e) {
                log.error("Disconnect listener failed for client {}", id, e);
            }
        }
        return closeQuietly(id, session.connection);
    }

    private Future<Void> closeQuietly(String id, ClientConnection connection) {
        Promise<Void> done = loop.newPromise();
        Future<Void> close;
        try {
            close = connection.close();
        } catch (RuntimeException e) {
            close = loop.failed(e);
        }
        close.addListener(f -> {
            if (!f.isSuccess()) {
                log.warn("Error closing connection {}: {}", id, f.cause().toString());
            }
            done.trySuccess(null);
        });
        return done;
    }

    // ── Outbound ──────────────────────────────────────────────────────────────

    /**
     * Point-to-point send. A transport failure disconnects the client and fails
     * the returned future; nothing is retried here.
     */
    public Future<Void> send(String id, JsonNode message) {
        return loop.flatCall(() -> send0(id, message));
    }

    private Future<Void> send0(String id, JsonNode message) {
        ClientSession session = sessions.get(id);
        if (session == null) {
            return loop.failed(new BrokerException(ErrorCode.NOT_FOUND, "Client " + id + " not found"));
        }
        if (!session.connection.isAlive()) {
            return loop.failed(new BrokerException(ErrorCode.CONNECTION_NOT_ALIVE, "Client " + id + " connection is not alive"));
        }

        Promise<Void> promise = loop.newPromise();
        long start = System.nanoTime();
        Future<Void> write;
        try {
            write = session.connection.send(message);
        } catch (RuntimeException e) {
            write = loop.failed(e);
        }
        write.addListener(f -> loop.execute(() -> {
            if (f.isSuccess()) {
                sendLatency.record(System.nanoTime() - start);
                session.touch(clock.instant());
                promise.trySuccess(null);
                return;
            }
            Throwable cause = f.cause();
            log.error("Failed to send message to client {}: {}", id, cause.toString());
            events.onEvent(new ErrorOccurred(clock.instant(), ErrorOccurred.ErrorKind.CONNECTION,
                    "Send to client " + id + " failed", id, cause));
            if (sessions.get(id) == session) {
                disconnect0(id, REASON_SEND_FAILURE);
            }
            promise.tryFailure(new BrokerException(ErrorCode.SEND_FAILURE,
                    "Send to client " + id + " failed: " + cause.getMessage(), cause));
        }));
        return promise;
    }

    /**
     * Sends to every session of the role. Per-target failures are logged and
     * left out of the result; they never abort the broadcast.
     *
     * @return ids that received the message, in registration order
     */
    public Future<List<String>> broadcast(ClientRole role, JsonNode message) {
        return loop.flatCall(() -> {
            List<ClientSession> targets = sessions0(role);
            Promise<List<String>> promise = loop.newPromise();
            if (targets.isEmpty()) {
                promise.trySuccess(List.of());
                return promise;
            }
            boolean[] ok = new boolean[targets.size()];
            int[] remaining = { targets.size() };
            for (int i = 0; i < targets.size(); i++) {
                int idx = i;
                String id = targets.get(i).id;
                send0(id, message).addListener(f -> {
                    if (f.isSuccess()) {
                        ok[idx] = true;
                    } else {
                        log.warn("Failed to broadcast to client {}: {}", id, f.cause().getMessage());
                    }
                    if (--remaining[0] == 0) {
                        List<String> delivered = new ArrayList<>();
                        for (int j = 0; j < ok.length; j++) {
                            if (ok[j]) delivered.add(targets.get(j).id);
                        }
                        promise.trySuccess(delivered);
                    }
                });
            }
            return promise;
        });
    }

    /** Records inbound activity from a client. */
    public void touch(String id) {
        loop.execute(() -> {
            ClientSession s = sessions.get(id);
            if (s != null) s.touch(clock.instant());
        });
    }

    // ── Liveness ──────────────────────────────────────────────────────────────

    private void heartbeatTick() {
        try {
            sweep0();
        } catch (RuntimeException e) {
            log.error("Liveness sweep failed", e);
        }
    }

    /**
     * Evicts idle sessions whose connection is dead and pings the rest.
     * @return number of sessions evicted
     */
    public Future<Integer> sweep() {
        return loop.call(this::sweep0);
    }

    private int sweep0() {
        Instant now = clock.instant();
        Instant staleBefore = now.minus(cfg.heartbeatInterval().multipliedBy(STALE_MULTIPLIER));
        int evicted = 0;

        for (ClientSession s : new ArrayList<>(sessions.values())) {
            try {
                if (s.lastActivity().isBefore(staleBefore)) {
                    log.warn("Client {} appears stale (last activity {}), checking connection", s.id, s.lastActivity());
                    if (!s.connection.isAlive()) {
                        log.info("Removing stale client {}", s.id);
                        disconnect0(s.id, REASON_STALE);
                        evicted++;
                        continue;
                    }
                }
                send0(s.id, Messages.ping(now)).addListener(f -> {
                    if (!f.isSuccess()) {
                        log.debug("Heartbeat ping failed for {}: {}", s.id, f.cause().getMessage());
                    }
                });
            } catch (RuntimeException e) {
                log.error("Liveness check failed for client {}", s.id, e);
            }
        }
        return evicted;
    }

    public void reportMetrics() {
        loop.execute(sendLatency::logAndReset);
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    public Optional<ClientSession> session(String id) {
        return loop.await(() -> Optional.ofNullable(sessions.get(id)));
    }

    public boolean isConnected(String id) {
        return loop.await(() -> sessions.containsKey(id));
    }

    public List<ClientSession> sessions() {
        return loop.await(() -> new ArrayList<>(sessions.values()));
    }

    public List<ClientSession> sessions(ClientRole role) {
        return loop.await(() -> sessions0(role));
    }

    private List<ClientSession> sessions0(ClientRole role) {
        List<ClientSession> out = new ArrayList<>();
        for (ClientSession s : sessions.values()) {
            if (s.role == role) out.add(s);
        }
        return out;
    }

    /** The session of the role with the most recent activity, if any. */
    public Optional<ClientSession> mostRecentlyActive(ClientRole role) {
        return loop.await(() -> sessions0(role).stream()
                .max(Comparator.comparing(ClientSession::lastActivity)));
    }

    public int activeCount() {
        return loop.await(sessions::size);
    }

    public int pendingCount() {
        return loop.await(pending::size);
    }

    Duration staleAfter() {
        return cfg.heartbeatInterval().multipliedBy(STALE_MULTIPLIER);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Future<Void> allSettled(List<Future<Void>> futures) {
        Promise<Void> all = loop.newPromise();
        if (futures.isEmpty()) {
            all.trySuccess(null);
            return all;
        }
        int[] remaining = { futures.size() };
        for (Future<Void> f : futures) {
            f.addListener(x -> {
                if (--remaining[0] == 0) all.trySuccess(null);
            });
        }
        return all;
    }
}
