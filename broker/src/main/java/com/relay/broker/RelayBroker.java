package com.relay.broker;

import com.relay.broker.event.BrokerEvent;
import com.relay.broker.event.BrokerEventListener;
import com.relay.broker.event.BrokerEvents;
import com.relay.broker.event.ErrorOccurred;
import com.relay.broker.health.HealthMetrics;
import com.relay.broker.health.HealthObserver;
import com.relay.broker.popup.PopupCorrelator;
import com.relay.broker.routing.MessageRouter;
import com.relay.broker.session.ClientConnection;
import com.relay.broker.session.SessionRegistry;
import com.relay.common.BrokerConfig;
import com.relay.protocol.ClientRole;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Composes the broker components on one loop and wires them together.
 *
 * Subscriptions are fixed at construction:
 *   SessionRegistry ──session events──► MessageRouter, PopupCorrelator
 *   every component ──BrokerEvents──► log, HealthObserver, external listeners
 *
 * Transports talk to the broker only through {@link #onConnectionOpened},
 * {@link #onRawMessage} and {@link #onConnectionClosed}.
 */
public final class RelayBroker {

    private static final Logger log = LoggerFactory.getLogger(RelayBroker.class);

    private final BrokerConfig   cfg;
    private final Clock          clock;
    private final BrokerExecutor loop;
    private final BrokerEvents   events = new BrokerEvents();

    private final SessionRegistry      registry;
    private final MessageRouter        router;
    private final PopupCorrelator      popups;
    private final HealthObserver       health;
    private final ClientMessageHandler handler;

    private final List<ScheduledFuture<?>> timers = new ArrayList<>();

    private Future<Void> stopFuture;

    public RelayBroker(BrokerConfig cfg) {
        this(cfg, Clock.systemUTC());
    }

    public RelayBroker(BrokerConfig cfg, Clock clock) {
        this(cfg, clock, new BrokerExecutor("relay-broker"));
    }

    RelayBroker(BrokerConfig cfg, Clock clock, BrokerExecutor loop) {
        this.cfg   = cfg;
        this.clock = clock;
        this.loop  = loop;

        this.registry = new SessionRegistry(loop, cfg, clock, events);
        this.router   = new MessageRouter(loop, registry, clock, events);
        this.popups   = new PopupCorrelator(loop, cfg, clock, router, events);
        this.health   = new HealthObserver(cfg, clock, events);
        registry.addListener(popups);
        this.handler  = new ClientMessageHandler(loop, registry, router, popups, clock, events);

        events.subscribe(RelayBroker::logEvent);
        events.subscribe(health);
    }

    public void addListener(BrokerEventListener listener) {
        events.subscribe(listener);
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    public void start() {
        registry.start();
        loop.execute(() -> {
            timers.add(loop.scheduleAtFixedRate(this::healthTick, cfg.healthCheckInterval()));
            if (cfg.metricsIntervalSecs > 0) {
                timers.add(loop.scheduleAtFixedRate(registry::reportMetrics,
                        Duration.ofSeconds(cfg.metricsIntervalSecs)));
            }
        });
        log.info("Relay broker started: {}", cfg);
    }

    private void healthTick() {
        try {
            health.check();
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
        }
    }

    /**
     * Disconnects every session, releases popup waiters and stops the loop.
     * Completes only after all sessions have been closed. Repeated calls return
     * the same future.
     */
    public synchronized Future<Void> stop() {
        if (stopFuture != null) return stopFuture;
        Promise<Void> stopped = GlobalEventExecutor.INSTANCE.newPromise();
        stopFuture = stopped;
        log.info("Relay broker stopping");
        loop.execute(() -> {
            for (ScheduledFuture<?> t : timers) t.cancel(false);
            timers.clear();
        });
        registry.shutdown().addListener(r -> popups.shutdown().addListener(p -> {
            if (!p.isSuccess()) {
                log.warn("Popup shutdown failed: {}", p.cause().toString());
            }
            loop.shutdownGracefully().addListener(x -> {
                log.info("Relay broker stopped");
                stopped.trySuccess(null);
            });
        }));
        return stopped;
    }

    // ── Transport entry points ────────────────────────────────────────────────

    /** @return the connection id, which becomes the session id once the client identifies */
    public String onConnectionOpened(ClientConnection connection, String userAgent) {
        return registry.accept(connection, userAgent);
    }

    public void onRawMessage(String connectionId, String text) {
        loop.execute(() -> {
            try {
                handler.handleRaw(connectionId, text);
            } catch (RuntimeException e) {
                internalError(connectionId, e);
            }
        });
    }

    public Future<Void> onConnectionClosed(String connectionId, String reason) {
        return registry.disconnect(connectionId, reason);
    }

    /** Reports a transport-level failure on a connection. */
    public void onConnectionError(String connectionId, Throwable cause) {
        loop.execute(() -> events.onEvent(new ErrorOccurred(clock.instant(), ErrorOccurred.ErrorKind.CONNECTION,
                "Connection error: " + cause.getMessage(), connectionId, cause)));
    }

    private void internalError(String connectionId, RuntimeException e) {
        log.error("Failed to handle message from {}", connectionId, e);
        events.onEvent(new ErrorOccurred(clock.instant(), ErrorOccurred.ErrorKind.INTERNAL,
                "Message handling failed: " + e.getMessage(), connectionId, e));
    }

    // ── Components ────────────────────────────────────────────────────────────

    public SessionRegistry sessions()  { return registry; }
    public MessageRouter   router()    { return router; }
    public PopupCorrelator popups()    { return popups; }
    public HealthObserver  healthObserver() { return health; }
    public BrokerConfig    config()    { return cfg; }

    public BrokerHealth health() {
        HealthMetrics m = health.metrics();
        return new BrokerHealth(
                m.status(),
                m.uptime(),
                registry.activeCount(),
                registry.sessions(ClientRole.REQUESTER).size(),
                registry.sessions(ClientRole.RESPONDER).size(),
                popups.activeCount(),
                router.queuedCount(),
                m.heapUsedBytes(),
                m.errorsLastHour(),
                m.recentErrors());
    }

    private static void logEvent(BrokerEvent e) {
        if (log.isDebugEnabled()) {
            log.debug("Event {}: {}", e.name(), e);
        }
    }
}
