package com.relay.protocol;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.List;

/**
 * JSON wire vocabulary exchanged with clients.
 *
 * Inbound (client → broker):
 *   identify:        { method:"identify", params:{ clientType, version?, capabilities?, instanceId?, clientName? } }
 *   popup_response:  { type:"popup_response", popupId, result }
 *   pong:            { method:"pong" }
 *   popup ops:       { id, method:"popup.create"|"popup.await"|..., params }
 *   routed:          any request/response/notification carrying target:{ type:<role> }
 *
 * Outbound (broker → client):
 *   connection ack:  { id:"connection_ack", result:{ sessionId, serverCapabilities } }
 *   ping:            { method:"ping", params:{ timestamp } }
 *   popup request:   { type:"popup_request", popupId, options }
 *   responses:       { id, result } or { id, error:{ code, message } }
 */
public final class Messages {

    public static final String METHOD_IDENTIFY    = "identify";
    public static final String METHOD_PING        = "ping";
    public static final String METHOD_PONG        = "pong";
    public static final String TYPE_POPUP_REQUEST  = "popup_request";
    public static final String TYPE_POPUP_RESPONSE = "popup_response";
    public static final String CONNECTION_ACK_ID  = "connection_ack";

    public static final List<String> SERVER_CAPABILITIES = List.of("popup_management", "message_routing");

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Messages() {}

    // ── Client → Broker ─────────────────────────────────────────────────────

    public static JsonNode parse(String json) throws JsonProcessingException {
        JsonNode node = MAPPER.readTree(json);
        if (node == null || !node.isObject()) {
            throw new JsonParseException((JsonParser) null, "Message must be a JSON object");
        }
        return node;
    }

    public static String method(JsonNode node) {
        return node.path("method").asText("");
    }

    public static String type(JsonNode node) {
        return node.path("type").asText("");
    }

    /** The routing target role, or null when the message carries no target. */
    public static ClientRole targetRole(JsonNode node) {
        JsonNode target = node.get("target");
        if (target == null || !target.isObject()) return null;
        return ClientRole.fromWireName(target.path("type").asText(null));
    }

    // ── Broker → Client ─────────────────────────────────────────────────────

    public static ObjectNode connectionAck(String sessionId) {
        ObjectNode result = NODES.objectNode();
        result.put("sessionId", sessionId);
        ArrayNode caps = result.putArray("serverCapabilities");
        SERVER_CAPABILITIES.forEach(caps::add);
        return response(CONNECTION_ACK_ID, result);
    }

    public static ObjectNode ping(Instant now) {
        ObjectNode m = NODES.objectNode();
        m.put("method", METHOD_PING);
        m.putObject("params").put("timestamp", now.toString());
        return m;
    }

    public static ObjectNode popupRequest(String popupId, JsonNode options) {
        ObjectNode m = NODES.objectNode();
        m.put("type", TYPE_POPUP_REQUEST);
        m.put("popupId", popupId);
        m.set("options", options != null ? options.deepCopy() : NODES.objectNode());
        return m;
    }

    public static ObjectNode response(String id, JsonNode result) {
        ObjectNode m = NODES.objectNode();
        m.put("id", id);
        m.set("result", result);
        return m;
    }

    public static ObjectNode response(JsonNode id, JsonNode result) {
        ObjectNode m = NODES.objectNode();
        m.set("id", id);
        m.set("result", result);
        return m;
    }

    public static ObjectNode error(JsonNode id, ErrorCode code, String message) {
        ObjectNode m = NODES.objectNode();
        m.set("id", id != null ? id : NODES.nullNode());
        ObjectNode err = m.putObject("error");
        err.put("code", code.name());
        err.put("message", message);
        return m;
    }

    public static ObjectNode cancelledResult() {
        return NODES.objectNode().put("cancelled", true);
    }

    public static ObjectNode timedOutResult() {
        return NODES.objectNode().put("timedOut", true);
    }

    public static ObjectNode object() {
        return NODES.objectNode();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    public static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return "{\"error\":{\"code\":\"INTERNAL\",\"message\":\"serialize failed\"}}";
        }
    }
}
