package com.relay.broker.popup;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.util.concurrent.ScheduledFuture;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable interaction state, owned by the correlator and touched only on the broker loop.
 * Status moves PENDING → one terminal state, exactly once.
 */
final class Interaction {

    final String   id;
    final String   requesterId;
    final String   responderId;
    final JsonNode options;
    final Instant  createdAt;

    PopupStatus status = PopupStatus.PENDING;
    JsonNode    result;
    Instant     resolvedAt;

    ScheduledFuture<?> timeoutTimer;
    ScheduledFuture<?> purgeTimer;
    final List<Waiter> waiters = new ArrayList<>();

    Interaction(String id, String requesterId, String responderId, JsonNode options, Instant createdAt) {
        this.id          = id;
        this.requesterId = requesterId;
        this.responderId = responderId;
        this.options     = options;
        this.createdAt   = createdAt;
    }

    void complete(PopupStatus terminal, JsonNode value, Instant at) {
        status     = terminal;
        result     = value;
        resolvedAt = at;
        if (timeoutTimer != null) {
            timeoutTimer.cancel(false);
            timeoutTimer = null;
        }
    }

    PopupInfo snapshot() {
        return new PopupInfo(id, requesterId, responderId, options, status, result, createdAt, resolvedAt);
    }
}
