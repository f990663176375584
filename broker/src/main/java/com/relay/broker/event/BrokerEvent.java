package com.relay.broker.event;

import java.time.Instant;

/**
 * Something observable happened inside the broker.
 * These are the only integration points for logging and monitoring collaborators.
 */
public interface BrokerEvent {

    /** Wire/log name, e.g. {@code client_connected}. */
    String name();

    Instant timestamp();
}
