package com.relay.broker.health;

import com.relay.broker.event.ErrorOccurred;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Point-in-time health report. {@code recentErrors} holds at most the five newest, oldest first. */
public record HealthMetrics(HealthStatus status,
                            Duration uptime,
                            long heapUsedBytes,
                            int totalErrors,
                            int errorsLastHour,
                            int errorsLastDay,
                            List<ErrorOccurred> recentErrors,
                            Instant timestamp) {}
