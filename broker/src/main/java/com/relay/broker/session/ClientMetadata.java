package com.relay.broker.session;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Attributes a client supplies at identification. Stored and reported, never interpreted.
 */
public record ClientMetadata(String userAgent,
                             String version,
                             List<String> capabilities,
                             String instanceId,
                             String clientName) {

    public ClientMetadata {
        userAgent    = userAgent != null ? userAgent : "Unknown";
        capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
    }

    public static ClientMetadata fromIdentifyParams(String userAgent, JsonNode params) {
        List<String> caps = new ArrayList<>();
        JsonNode capsNode = params.path("capabilities");
        if (capsNode.isArray()) {
            capsNode.forEach(c -> caps.add(c.asText()));
        }
        return new ClientMetadata(
                userAgent,
                params.path("version").asText(null),
                caps,
                params.path("instanceId").asText(null),
                params.path("clientName").asText(null));
    }
}
