package com.relay.broker.health;

import com.relay.broker.event.ClientDisconnected;
import com.relay.broker.event.ErrorOccurred;
import com.relay.broker.event.StatusChanged;
import com.relay.broker.testing.EventRecorder;
import com.relay.broker.testing.MutableClock;
import com.relay.common.BrokerConfig;
import com.relay.protocol.ClientRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class HealthObserverTest {

    private MutableClock   clock;
    private EventRecorder  events;
    private AtomicLong     heap;
    private HealthObserver health;

    @BeforeEach
    void setUp() {
        clock  = new MutableClock();
        events = new EventRecorder();
        heap   = new AtomicLong(64L * 1024 * 1024);
        health = new HealthObserver(BrokerConfig.defaults(), clock, events, heap::get);
    }

    @Test
    void healthyWithoutErrors() {
        assertEquals(HealthStatus.HEALTHY, health.check());
        assertTrue(events.of(StatusChanged.class).isEmpty());
    }

    @Test
    void moreThanFiveRecentErrorsDegrade() {
        recordErrors(5);
        assertEquals(HealthStatus.HEALTHY, health.status(), "Five errors is still healthy");

        recordErrors(1);

        assertEquals(HealthStatus.DEGRADED, health.status());
        List<StatusChanged> changes = events.of(StatusChanged.class);
        assertEquals(1, changes.size());
        assertEquals(HealthStatus.HEALTHY,  changes.get(0).from());
        assertEquals(HealthStatus.DEGRADED, changes.get(0).to());
    }

    @Test
    void moreThanTenRecentErrorsAreUnhealthy() {
        recordErrors(11);

        assertEquals(HealthStatus.UNHEALTHY, health.status());
        List<StatusChanged> changes = events.of(StatusChanged.class);
        assertEquals(2, changes.size(), "healthy → degraded → unhealthy");
        assertEquals(HealthStatus.UNHEALTHY, changes.get(1).to());
    }

    @Test
    void errorsOutsideFiveMinuteWindowStopCounting() {
        recordErrors(11);
        clock.advance(Duration.ofMinutes(5).plusSeconds(1));

        assertEquals(HealthStatus.HEALTHY, health.check());
        assertEquals(HealthStatus.HEALTHY, events.of(StatusChanged.class).get(2).to());
        assertEquals(11, health.errorCount(Duration.ofHours(1)));
        assertEquals(0, health.errorCount(Duration.ofMinutes(5)));
    }

    @Test
    void heapPressureDegrades() {
        heap.set(600L * 1024 * 1024);

        assertEquals(HealthStatus.DEGRADED, health.check());

        heap.set(10L * 1024 * 1024);
        assertEquals(HealthStatus.HEALTHY, health.check());
        assertEquals(2, events.of(StatusChanged.class).size());
    }

    @Test
    void historyKeepsOnlyNewestErrors() {
        recordErrors(150);

        HealthMetrics m = health.metrics();
        assertEquals(100, m.totalErrors());
        assertEquals(5, m.recentErrors().size());
        assertEquals("error 149", m.recentErrors().get(4).message());
        assertEquals("error 145", m.recentErrors().get(0).message());
    }

    @Test
    void metricsSplitErrorsByAge() {
        recordErrors(2);
        clock.advance(Duration.ofHours(2));
        recordErrors(3);
        clock.advance(Duration.ofMinutes(10));

        HealthMetrics m = health.metrics();
        assertEquals(5, m.totalErrors());
        assertEquals(3, m.errorsLastHour());
        assertEquals(5, m.errorsLastDay());
        assertEquals(Duration.ofHours(2).plusMinutes(10), m.uptime());
        assertEquals(HealthStatus.HEALTHY, m.status());
    }

    @Test
    void onlyErrorEventsAreRecorded() {
        health.onEvent(new ClientDisconnected(clock.instant(), "a", ClientRole.REQUESTER, "bye"));
        health.onEvent(error(0));

        assertEquals(1, health.recentErrors(10).size());
    }

    private void recordErrors(int n) {
        for (int i = 0; i < n; i++) {
            health.record(error(i));
        }
    }

    private ErrorOccurred error(int i) {
        return new ErrorOccurred(clock.instant(), ErrorOccurred.ErrorKind.CONNECTION, "error " + i, "client", null);
    }
}
