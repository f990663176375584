package com.relay.broker;

import com.relay.broker.event.ErrorOccurred;
import com.relay.broker.health.HealthStatus;

import java.time.Duration;
import java.util.List;

/** Snapshot served by the health endpoint. */
public record BrokerHealth(HealthStatus status,
                           Duration uptime,
                           int activeClients,
                           int requesters,
                           int responders,
                           int activePopups,
                           int queuedMessages,
                           long heapUsedBytes,
                           int errorsLastHour,
                           List<ErrorOccurred> recentErrors) {}
