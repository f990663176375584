package com.relay.broker.event;

import com.relay.protocol.ClientRole;

import java.time.Instant;

public record ClientDisconnected(Instant timestamp, String clientId, ClientRole role, String reason)
        implements BrokerEvent {

    @Override
    public String name() { return "client_disconnected"; }
}
