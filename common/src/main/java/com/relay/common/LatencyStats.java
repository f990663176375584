package com.relay.common;

import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Latency tracking using HdrHistogram.
 * Record nanos; report percentiles periodically.
 *
 * Not thread-safe: record and report from the same thread.
 */
public final class LatencyStats {

    private static final Logger log = LoggerFactory.getLogger(LatencyStats.class);

    private final Histogram histogram;
    private final String name;
    private long count;

    public LatencyStats(String name) {
        this.name = name;
        // max 60 seconds, 3 sig figs
        this.histogram = new Histogram(60_000_000_000L, 3);
    }

    public void record(long latencyNanos) {
        histogram.recordValue(Math.min(Math.max(latencyNanos, 0), histogram.getHighestTrackableValue()));
        count++;
    }

    public long count() { return count; }

    public double percentileMicros(double percentile) {
        return histogram.getValueAtPercentile(percentile) / 1_000.0;
    }

    public void logAndReset() {
        long total = count;
        count = 0;
        if (total == 0) return;
        log.info("[metrics] {} count={} p50={}µs p99={}µs p999={}µs max={}µs",
                name, total,
                String.format("%.1f", histogram.getValueAtPercentile(50) / 1_000.0),
                String.format("%.1f", histogram.getValueAtPercentile(99) / 1_000.0),
                String.format("%.1f", histogram.getValueAtPercentile(99.9) / 1_000.0),
                String.format("%.1f", histogram.getMaxValue() / 1_000.0));
        histogram.reset();
    }
}
