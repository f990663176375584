package com.relay.broker.event;

import java.time.Instant;

public record PopupCreated(Instant timestamp, String popupId, String requesterId, String responderId)
        implements BrokerEvent {

    @Override
    public String name() { return "popup_created"; }
}
