package com.relay.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.relay.broker.RelayBroker;
import com.relay.common.BrokerConfig;
import com.relay.protocol.Messages;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ClientSocketHandlerTest {

    private RelayBroker broker;

    @BeforeEach
    void setUp() {
        broker = new RelayBroker(BrokerConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        broker.stop().awaitUninterruptibly(5, TimeUnit.SECONDS);
    }

    @Test
    void handshakeIdentifyAndClose() throws Exception {
        ClientSocketHandler handler = new ClientSocketHandler(broker);
        EmbeddedChannel ch = new EmbeddedChannel(handler);

        DefaultHttpHeaders headers = new DefaultHttpHeaders();
        headers.set(HttpHeaderNames.USER_AGENT, "vscode-extension/2.0");
        ch.pipeline().fireUserEventTriggered(new WebSocketServerProtocolHandler.HandshakeComplete("/ws", headers, null));
        String id = handler.connectionId();
        assertNotNull(id);

        ch.writeInbound(new TextWebSocketFrame("{\"method\":\"identify\",\"params\":{\"clientType\":\"vscode_instance\"}}"));
        waitFor(() -> broker.sessions().isConnected(id));

        assertEquals("vscode-extension/2.0", broker.sessions().session(id).orElseThrow().metadata.userAgent());
        TextWebSocketFrame ack = ch.readOutbound();
        JsonNode json = Messages.parse(ack.text());
        assertEquals("connection_ack", json.path("id").asText());
        assertEquals(id, json.path("result").path("sessionId").asText());
        ack.release();

        ch.close();
        waitFor(() -> !broker.sessions().isConnected(id));
    }

    @Test
    void framesBeforeHandshakeAreIgnored() {
        EmbeddedChannel ch = new EmbeddedChannel(new ClientSocketHandler(broker));

        ch.writeInbound(new TextWebSocketFrame("{\"method\":\"identify\",\"params\":{}}"));

        assertNull(ch.readOutbound());
        assertEquals(0, broker.sessions().pendingCount());
        assertEquals(0, broker.sessions().activeCount());
    }

    private static void waitFor(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            assertTrue(System.currentTimeMillis() < deadline, "condition not met in time");
            Thread.sleep(5);
        }
    }
}
