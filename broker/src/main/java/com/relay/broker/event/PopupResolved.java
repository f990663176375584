package com.relay.broker.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.relay.broker.popup.PopupStatus;

import java.time.Instant;

/** Emitted for every terminal transition: resolved, cancelled and timed out. */
public record PopupResolved(Instant timestamp, String popupId, PopupStatus status, JsonNode result)
        implements BrokerEvent {

    @Override
    public String name() { return "popup_resolved"; }
}
