package com.relay.broker.event;

import java.time.Instant;

/**
 * A recorded failure. {@code clientId} and {@code cause} are null when not applicable.
 */
public record ErrorOccurred(Instant timestamp, ErrorKind kind, String message, String clientId, Throwable cause)
        implements BrokerEvent {

    public enum ErrorKind { CONNECTION, PROTOCOL, ROUTING, POPUP, INTERNAL }

    @Override
    public String name() { return "error_occurred"; }
}
