package com.relay.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LatencyStatsTest {

    @Test
    void recordsAndResets() {
        LatencyStats stats = new LatencyStats("send");
        stats.record(1_000);
        stats.record(2_000);
        stats.record(3_000);

        assertEquals(3, stats.count());
        assertTrue(stats.percentileMicros(100) >= 2.9, "max should be ~3µs");

        stats.logAndReset();
        assertEquals(0, stats.count());
    }

    @Test
    void negativeSamplesAreClamped() {
        LatencyStats stats = new LatencyStats("send");
        stats.record(-5);
        assertEquals(1, stats.count());
        assertEquals(0.0, stats.percentileMicros(50));
    }
}
