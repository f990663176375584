package com.relay.broker.health;

public enum HealthStatus {
    HEALTHY   ("healthy"),
    DEGRADED  ("degraded"),
    UNHEALTHY ("unhealthy");

    public final String wireName;

    HealthStatus(String wireName) { this.wireName = wireName; }
}
