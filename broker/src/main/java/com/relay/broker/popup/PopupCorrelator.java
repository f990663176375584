package com.relay.broker.popup;

import com.fasterxml.jackson.databind.JsonNode;
import com.relay.broker.BrokerException;
import com.relay.broker.BrokerExecutor;
import com.relay.broker.event.BrokerEventListener;
import com.relay.broker.event.ErrorOccurred;
import com.relay.broker.event.PopupCreated;
import com.relay.broker.event.PopupResolved;
import com.relay.broker.routing.MessageRouter;
import com.relay.broker.session.ClientSession;
import com.relay.broker.session.SessionListener;
import com.relay.common.BrokerConfig;
import com.relay.protocol.ErrorCode;
import com.relay.protocol.Messages;
import io.netty.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Correlates popup requests sent to responders with the results they report back.
 *
 * Callers wait either on one interaction ({@link #awaitResult}) or on whichever
 * interaction completes next ({@link #awaitAny}). Resolutions and interaction
 * timeouts release every waiter of that interaction plus the oldest "any"
 * waiter; cancellations release only the interaction's own waiters.
 *
 * Terminal interactions stay queryable for the retention window, then are purged.
 * Waiters owned by a client are dropped when that client disconnects.
 */
public final class PopupCorrelator implements SessionListener {

    private static final Logger log = LoggerFactory.getLogger(PopupCorrelator.class);

    private final BrokerExecutor      loop;
    private final BrokerConfig        cfg;
    private final Clock               clock;
    private final MessageRouter       router;
    private final BrokerEventListener events;

    private final Map<String, Interaction> interactions = new LinkedHashMap<>();
    private final ArrayDeque<Waiter>       anyWaiters   = new ArrayDeque<>();

    public PopupCorrelator(BrokerExecutor loop, BrokerConfig cfg, Clock clock,
                           MessageRouter router, BrokerEventListener events) {
        this.loop   = loop;
        this.cfg    = cfg;
        this.clock  = clock;
        this.router = router;
        this.events = events;
    }

    // ── Create ────────────────────────────────────────────────────────────────

    /**
     * Opens an interaction and dispatches the popup request to the responder.
     * Completes with the popup id as soon as the interaction exists; delivery
     * happens (or is queued) in the background.
     */
    public Future<String> create(String requesterId, String responderId, JsonNode options) {
        return loop.call(() -> {
            JsonNode opts = options != null ? options : Messages.object();
            String id = UUID.randomUUID().toString();
            Interaction i = new Interaction(id, requesterId, responderId, opts, clock.instant());
            interactions.put(id, i);

            long timeoutMs = opts.path("timeout").asLong(0);
            if (timeoutMs > 0) {
                i.timeoutTimer = loop.schedule(() -> timeout(id), Duration.ofMillis(timeoutMs));
            }

            log.debug("Popup created: id={} requester={} responder={}", id, requesterId, responderId);
            events.onEvent(new PopupCreated(i.createdAt, id, requesterId, responderId));
            dispatch(i);
            return id;
        });
    }

    private void dispatch(Interaction i) {
        router.deliver(i.responderId, Messages.popupRequest(i.id, i.options)).addListener(f -> {
            if (f.isSuccess()) {
                log.debug("Popup {} sent to responder {}", i.id, i.responderId);
                return;
            }
            if (BrokerException.codeOf(f.cause()) == ErrorCode.CLIENT_QUEUED) {
                log.info("Responder {} unavailable, popup {} queued for delivery", i.responderId, i.id);
                return;
            }
            log.error("Failed to send popup {} to responder {}: {}", i.id, i.responderId, f.cause().toString());
            events.onEvent(new ErrorOccurred(clock.instant(), ErrorOccurred.ErrorKind.POPUP,
                    "Popup dispatch failed", i.responderId, f.cause()));
        });
    }

    // ── Terminal transitions ──────────────────────────────────────────────────

    public Future<Void> resolve(String popupId, JsonNode result) {
        return loop.call(() -> {
            Interaction i = pending(popupId);
            complete(i, PopupStatus.RESOLVED, result != null ? result : Messages.object(), true);
            return null;
        });
    }

    public Future<Void> cancel(String popupId) {
        return loop.call(() -> {
            cancel0(popupId);
            return null;
        });
    }

    private void cancel0(String popupId) {
        Interaction i = pending(popupId);
        log.info("Popup closed: {}", popupId);
        complete(i, PopupStatus.CANCELLED, Messages.cancelledResult(), false);
    }

    /**
     * Cancels every pending interaction, or only those of one responder.
     * @return ids actually cancelled
     */
    public Future<List<String>> closeAll(String responderId) {
        return loop.call(() -> {
            List<String> closed = new ArrayList<>();
            for (Interaction i : new ArrayList<>(interactions.values())) {
                if (i.status != PopupStatus.PENDING) continue;
                if (responderId != null && !responderId.equals(i.responderId)) continue;
                try {
                    cancel0(i.id);
                    closed.add(i.id);
                } catch (RuntimeException e) {
                    log.warn("Failed to close popup {}: {}", i.id, e.getMessage());
                }
            }
            log.info("Closed {} popup(s) for responder {}", closed.size(), responderId != null ? responderId : "*");
            return closed;
        });
    }

    private void timeout(String popupId) {
        Interaction i = interactions.get(popupId);
        if (i == null || i.status != PopupStatus.PENDING) return;
        log.info("Popup timed out: {}", popupId);
        complete(i, PopupStatus.TIMED_OUT, Messages.timedOutResult(), true);
    }

    private Interaction pending(String popupId) {
        Interaction i = interactions.get(popupId);
        if (i == null) {
            throw new BrokerException(ErrorCode.NOT_FOUND, "Popup " + popupId + " not found");
        }
        if (i.status != PopupStatus.PENDING) {
            throw new BrokerException(ErrorCode.INVALID_STATE,
                    "Popup " + popupId + " is not pending (current status: " + i.status.wireName + ")");
        }
        return i;
    }

    private void complete(Interaction i, PopupStatus terminal, JsonNode result, boolean releaseAny) {
        Instant now = clock.instant();
        i.complete(terminal, result, now);

        for (Waiter w : i.waiters) {
            w.release(result);
        }
        i.waiters.clear();

        if (releaseAny) {
            // Skip waiters whose deadline already claimed them
            Waiter w;
            while ((w = anyWaiters.pollFirst()) != null) {
                if (w.release(result)) break;
            }
        }

        events.onEvent(new PopupResolved(now, i.id, terminal, result));
        i.purgeTimer = loop.schedule(() -> purge(i.id), cfg.popupRetention());
    }

    private void purge(String popupId) {
        Interaction i = interactions.get(popupId);
        if (i != null && i.status.isTerminal()) {
            interactions.remove(popupId);
            log.debug("Popup cleaned up: {}", popupId);
        }
    }

    // ── Waiting ───────────────────────────────────────────────────────────────

    /**
     * Waits for one interaction's result. Completes immediately when it is
     * already terminal; fails with TIMEOUT once the deadline passes.
     *
     * @param timeout null (or non-positive) for the configured default
     */
    public Future<JsonNode> awaitResult(String popupId, Duration timeout) {
        return awaitResult(popupId, null, timeout);
    }

    /** As {@link #awaitResult(String, Duration)}, released early if {@code ownerId} disconnects. */
    public Future<JsonNode> awaitResult(String popupId, String ownerId, Duration timeout) {
        return loop.flatCall(() -> {
            Interaction i = interactions.get(popupId);
            if (i == null) {
                return loop.failed(new BrokerException(ErrorCode.NOT_FOUND, "Popup " + popupId + " not found"));
            }
            if (i.status.isTerminal()) {
                return loop.succeeded(i.result);
            }

            Duration effective = effective(timeout);
            Waiter w = new Waiter(loop.newPromise(), ownerId);
            i.waiters.add(w);
            w.deadline = loop.schedule(() -> {
                if (w.fail(new BrokerException(ErrorCode.TIMEOUT,
                        "Timeout waiting for popup " + popupId + " after " + effective.toMillis() + "ms"))) {
                    i.waiters.remove(w);
                }
            }, effective);
            log.debug("Added popup waiter for {}", popupId);
            return w.promise;
        });
    }

    /** Waits for whichever interaction resolves or times out next. Cancellations do not count. */
    public Future<JsonNode> awaitAny(Duration timeout) {
        return awaitAny(null, timeout);
    }

    /** As {@link #awaitAny(Duration)}, released early if {@code ownerId} disconnects. */
    public Future<JsonNode> awaitAny(String ownerId, Duration timeout) {
        return loop.flatCall(() -> {
            Duration effective = effective(timeout);
            Waiter w = new Waiter(loop.newPromise(), ownerId);
            anyWaiters.addLast(w);
            w.deadline = loop.schedule(() -> {
                if (w.fail(new BrokerException(ErrorCode.TIMEOUT,
                        "Timeout waiting for any popup response after " + effective.toMillis() + "ms"))) {
                    anyWaiters.remove(w);
                }
            }, effective);
            log.debug("Added global popup waiter (timeout={}ms)", effective.toMillis());
            return w.promise;
        });
    }

    private Duration effective(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative() ? timeout : cfg.popupTimeout();
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    public Optional<PopupInfo> get(String popupId) {
        return loop.await(() -> {
            Interaction i = interactions.get(popupId);
            return i != null ? Optional.of(i.snapshot()) : Optional.empty();
        });
    }

    /** Pending interactions, optionally only those of one responder. */
    public List<PopupInfo> active(String responderId) {
        return loop.await(() -> {
            List<PopupInfo> out = new ArrayList<>();
            for (Interaction i : interactions.values()) {
                if (i.status != PopupStatus.PENDING) continue;
                if (responderId != null && !responderId.equals(i.responderId)) continue;
                out.add(i.snapshot());
            }
            return out;
        });
    }

    public int activeCount() {
        return loop.await(() -> (int) interactions.values().stream()
                .filter(i -> i.status == PopupStatus.PENDING).count());
    }

    public PopupStats stats() {
        return loop.await(() -> {
            int active = 0, resolved = 0, timedOut = 0, cancelled = 0, waiting = anyWaiters.size();
            for (Interaction i : interactions.values()) {
                switch (i.status) {
                    case PENDING   -> active++;
                    case RESOLVED  -> resolved++;
                    case TIMED_OUT -> timedOut++;
                    case CANCELLED -> cancelled++;
                }
                waiting += i.waiters.size();
            }
            return new PopupStats(interactions.size(), active, resolved, timedOut, cancelled, waiting);
        });
    }

    // ── Session events ────────────────────────────────────────────────────────

    @Override
    public void onClientConnected(ClientSession session) {
    }

    /** Fails and forgets every waiter the departed client owned. Interactions are untouched. */
    @Override
    public void onClientDisconnected(ClientSession session, String reason) {
        BrokerException gone = new BrokerException(ErrorCode.CONNECTION_NOT_ALIVE,
                "Client " + session.id + " disconnected");
        int dropped = 0;
        for (Interaction i : interactions.values()) {
            dropped += dropOwned(i.waiters.iterator(), session.id, gone);
        }
        dropped += dropOwned(anyWaiters.iterator(), session.id, gone);
        if (dropped > 0) {
            log.debug("Dropped {} popup waiter(s) of disconnected client {}", dropped, session.id);
        }
    }

    private static int dropOwned(Iterator<Waiter> it, String clientId, Throwable cause) {
        int n = 0;
        while (it.hasNext()) {
            Waiter w = it.next();
            if (!w.ownedBy(clientId)) continue;
            it.remove();
            w.fail(cause);
            n++;
        }
        return n;
    }

    // ── Shutdown ──────────────────────────────────────────────────────────────

    /** Cancels all timers and fails every outstanding waiter. Interactions are left as they are. */
    public Future<Void> shutdown() {
        return loop.call(() -> {
            BrokerException closing = new BrokerException(ErrorCode.INVALID_STATE, "Broker shutting down");
            int failed = 0;
            for (Interaction i : interactions.values()) {
                if (i.timeoutTimer != null) i.timeoutTimer.cancel(false);
                if (i.purgeTimer != null) i.purgeTimer.cancel(false);
                for (Waiter w : i.waiters) {
                    if (w.fail(closing)) failed++;
                }
                i.waiters.clear();
            }
            Waiter w;
            while ((w = anyWaiters.pollFirst()) != null) {
                if (w.fail(closing)) failed++;
            }
            log.info("Popup correlator stopped ({} waiter(s) released)", failed);
            return null;
        });
    }
}
