package com.relay.gateway;

import com.relay.broker.RelayBroker;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One instance per client WebSocket connection.
 *
 * Lifecycle:
 *   handshake complete → register with the broker as a pending connection
 *   text frame         → hand the raw JSON to the broker
 *   channelInactive    → tell the broker the connection is gone
 */
public final class ClientSocketHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(ClientSocketHandler.class);

    static final String REASON_CLOSED = "Connection closed";

    private final RelayBroker broker;

    private String connectionId;

    public ClientSocketHandler(RelayBroker broker) {
        this.broker = broker;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete hs) {
            String userAgent = hs.requestHeaders().get(HttpHeaderNames.USER_AGENT);
            connectionId = broker.onConnectionOpened(new WebSocketConnection(ctx.channel()), userAgent);
            log.debug("WS handshake complete: channel={} connectionId={}", ctx.channel().remoteAddress(), connectionId);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (connectionId != null) {
            broker.onConnectionClosed(connectionId, REASON_CLOSED);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("WS error for connectionId={}: {}", connectionId != null ? connectionId : "?", cause.getMessage());
        if (connectionId != null) {
            broker.onConnectionError(connectionId, cause);
        }
        ctx.close();
    }

    // ── Message handling ──────────────────────────────────────────────────────

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (!(frame instanceof TextWebSocketFrame text)) {
            log.warn("Ignoring non-text frame from {}: {}", connectionId, frame.getClass().getSimpleName());
            return;
        }
        if (connectionId == null) {
            log.warn("Frame before handshake completed on {}", ctx.channel());
            return;
        }
        broker.onRawMessage(connectionId, text.text());
    }

    String connectionId() {
        return connectionId;
    }
}
