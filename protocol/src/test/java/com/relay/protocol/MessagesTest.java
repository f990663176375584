package com.relay.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MessagesTest {

    @Test
    void requestNeedsBothMethodAndId() throws Exception {
        assertEquals(MessageKind.REQUEST,
                MessageKind.classify(Messages.parse("{\"id\":1,\"method\":\"tools/call\"}")));
        // method without id is not a request
        assertEquals(MessageKind.NOTIFICATION,
                MessageKind.classify(Messages.parse("{\"method\":\"ping\"}")));
        // null id counts as absent
        assertEquals(MessageKind.NOTIFICATION,
                MessageKind.classify(Messages.parse("{\"id\":null,\"method\":\"ping\"}")));
    }

    @Test
    void requestTakesPrecedenceOverResponse() throws Exception {
        JsonNode both = Messages.parse("{\"id\":7,\"method\":\"x\",\"result\":{}}");
        assertEquals(MessageKind.REQUEST, MessageKind.classify(both));
    }

    @Test
    void resultOrErrorMakesAResponse() throws Exception {
        assertEquals(MessageKind.RESPONSE, MessageKind.classify(Messages.parse("{\"id\":1,\"result\":{}}")));
        assertEquals(MessageKind.RESPONSE, MessageKind.classify(Messages.parse("{\"error\":{\"code\":\"X\"}}")));
        assertEquals(MessageKind.NOTIFICATION, MessageKind.classify(Messages.parse("{\"type\":\"status\"}")));
    }

    @Test
    void nonObjectPayloadIsRejected() {
        assertThrows(JsonProcessingException.class, () -> Messages.parse("[1,2,3]"));
        assertThrows(JsonProcessingException.class, () -> Messages.parse("{not json"));
    }

    @Test
    void clientTypeMapsToRoleWithRequesterDefault() {
        assertEquals(ClientRole.RESPONDER, ClientRole.fromClientType("vscode_instance"));
        assertEquals(ClientRole.RESPONDER, ClientRole.fromClientType("responder"));
        assertEquals(ClientRole.REQUESTER, ClientRole.fromClientType("ai_client"));
        assertEquals(ClientRole.REQUESTER, ClientRole.fromClientType("something_else"));
        assertEquals(ClientRole.REQUESTER, ClientRole.fromClientType(null));
        assertNull(ClientRole.fromWireName("something_else"));
    }

    @Test
    void targetRoleIsReadFromTargetType() throws Exception {
        assertEquals(ClientRole.RESPONDER,
                Messages.targetRole(Messages.parse("{\"method\":\"n\",\"target\":{\"type\":\"vscode_instance\"}}")));
        assertNull(Messages.targetRole(Messages.parse("{\"method\":\"n\"}")));
        assertNull(Messages.targetRole(Messages.parse("{\"target\":\"responder\"}")));
    }

    @Test
    void connectionAckCarriesSessionAndCapabilities() {
        JsonNode ack = Messages.connectionAck("abc");
        assertEquals("connection_ack", ack.get("id").asText());
        assertEquals("abc", ack.path("result").path("sessionId").asText());
        assertEquals("popup_management", ack.path("result").path("serverCapabilities").get(0).asText());
        assertEquals("message_routing",  ack.path("result").path("serverCapabilities").get(1).asText());
    }

    @Test
    void pingAndErrorShapes() {
        JsonNode ping = Messages.ping(Instant.parse("2024-01-01T00:00:00Z"));
        assertEquals("ping", ping.get("method").asText());
        assertEquals("2024-01-01T00:00:00Z", ping.path("params").path("timestamp").asText());

        JsonNode err = Messages.error(null, ErrorCode.NOT_FOUND, "Popup p1 not found");
        assertTrue(err.get("id").isNull());
        assertEquals("NOT_FOUND", err.path("error").path("code").asText());
        assertEquals(ErrorCode.NOT_FOUND, ErrorCode.fromName(err.path("error").path("code").asText()));
        assertEquals(ErrorCode.INTERNAL, ErrorCode.fromName("???"));
    }
}
