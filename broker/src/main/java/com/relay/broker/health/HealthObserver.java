package com.relay.broker.health;

import com.relay.broker.event.BrokerEvent;
import com.relay.broker.event.BrokerEventListener;
import com.relay.broker.event.ErrorOccurred;
import com.relay.broker.event.StatusChanged;
import com.relay.common.BrokerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Derives a health status from recent errors and heap usage.
 *
 * Purely observational: nothing in the broker changes behaviour based on it.
 * Fed by {@code error_occurred} events; recomputed on every recorded error and
 * on each periodic {@link #check()}.
 *
 * Thread safety: all methods synchronized; errors arrive from the broker loop
 * while queries come from the health endpoint.
 */
public final class HealthObserver implements BrokerEventListener {

    private static final Logger log = LoggerFactory.getLogger(HealthObserver.class);

    static final Duration STATUS_WINDOW       = Duration.ofMinutes(5);
    static final int      UNHEALTHY_THRESHOLD = 10;
    static final int      DEGRADED_THRESHOLD  = 5;
    static final int      RECENT_IN_METRICS   = 5;

    private final BrokerConfig        cfg;
    private final Clock               clock;
    private final BrokerEventListener events;
    private final LongSupplier        heapUsed;
    private final Instant             startedAt;

    private final ArrayDeque<ErrorOccurred> errors = new ArrayDeque<>();
    private HealthStatus status = HealthStatus.HEALTHY;

    public HealthObserver(BrokerConfig cfg, Clock clock, BrokerEventListener events) {
        this(cfg, clock, events, HealthObserver::jvmHeapUsed);
    }

    public HealthObserver(BrokerConfig cfg, Clock clock, BrokerEventListener events, LongSupplier heapUsed) {
        this.cfg       = cfg;
        this.clock     = clock;
        this.events    = events;
        this.heapUsed  = heapUsed;
        this.startedAt = clock.instant();
    }

    @Override
    public void onEvent(BrokerEvent event) {
        if (event instanceof ErrorOccurred e) record(e);
    }

    public void record(ErrorOccurred error) {
        synchronized (this) {
            errors.addLast(error);
            while (errors.size() > cfg.errorHistorySize) errors.pollFirst();
        }
        log.warn("Error recorded: kind={} client={} message={}", error.kind(), error.clientId(), error.message());
        check();
    }

    /** Recomputes the status, emitting {@code status_changed} on a transition. */
    public HealthStatus check() {
        HealthStatus from;
        HealthStatus to;
        int  recent;
        long heap = heapUsed.getAsLong();
        synchronized (this) {
            recent = errorCount0(STATUS_WINDOW);
            from   = status;
            if (recent > UNHEALTHY_THRESHOLD) {
                to = HealthStatus.UNHEALTHY;
            } else if (recent > DEGRADED_THRESHOLD || heap > cfg.memoryPressureBytes) {
                to = HealthStatus.DEGRADED;
            } else {
                to = HealthStatus.HEALTHY;
            }
            status = to;
        }
        log.debug("Health check completed: status={} recentErrors={} heapUsed={}", to, recent, heap);

        if (from != to) {
            log.info("Health status changed: {} -> {}", from, to);
            events.onEvent(new StatusChanged(clock.instant(), from, to));
        }
        return to;
    }

    public synchronized HealthStatus status() {
        return status;
    }

    /** The newest {@code n} errors, oldest first. */
    public synchronized List<ErrorOccurred> recentErrors(int n) {
        List<ErrorOccurred> all = new ArrayList<>(errors);
        return List.copyOf(all.subList(Math.max(0, all.size() - n), all.size()));
    }

    public synchronized int errorCount(Duration window) {
        return errorCount0(window);
    }

    private int errorCount0(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        int n = 0;
        for (ErrorOccurred e : errors) {
            if (e.timestamp().isAfter(cutoff)) n++;
        }
        return n;
    }

    public HealthMetrics metrics() {
        long heap = heapUsed.getAsLong();
        Instant now = clock.instant();
        synchronized (this) {
            return new HealthMetrics(
                    status,
                    Duration.between(startedAt, now),
                    heap,
                    errors.size(),
                    errorCount0(Duration.ofHours(1)),
                    errorCount0(Duration.ofDays(1)),
                    recentErrors(RECENT_IN_METRICS),
                    now);
        }
    }

    private static long jvmHeapUsed() {
        Runtime rt = Runtime.getRuntime();
        return rt.totalMemory() - rt.freeMemory();
    }
}
