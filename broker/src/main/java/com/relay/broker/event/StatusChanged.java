package com.relay.broker.event;

import com.relay.broker.health.HealthStatus;

import java.time.Instant;

public record StatusChanged(Instant timestamp, HealthStatus from, HealthStatus to) implements BrokerEvent {

    @Override
    public String name() { return "status_changed"; }
}
