package com.relay.broker.event;

import com.relay.broker.session.ClientMetadata;
import com.relay.protocol.ClientRole;

import java.time.Instant;

public record ClientConnected(Instant timestamp, String clientId, ClientRole role, ClientMetadata metadata)
        implements BrokerEvent {

    @Override
    public String name() { return "client_connected"; }
}
