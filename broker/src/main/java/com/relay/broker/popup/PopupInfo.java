package com.relay.broker.popup;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Immutable snapshot of an interaction. {@code result} and {@code resolvedAt}
 * are null while the interaction is pending.
 */
public record PopupInfo(String id,
                        String requesterId,
                        String responderId,
                        JsonNode options,
                        PopupStatus status,
                        JsonNode result,
                        Instant createdAt,
                        Instant resolvedAt) {}
