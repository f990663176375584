package com.relay.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Message classes distinguished purely by which fields are present.
 *
 * Precedence: REQUEST (method + id), then RESPONSE (result or error), else NOTIFICATION.
 */
public enum MessageKind {
    REQUEST,
    RESPONSE,
    NOTIFICATION;

    public static MessageKind classify(JsonNode message) {
        if (has(message, "method") && has(message, "id")) return REQUEST;
        if (has(message, "result") || has(message, "error")) return RESPONSE;
        return NOTIFICATION;
    }

    private static boolean has(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && !v.isNull() && !v.isMissingNode();
    }
}
