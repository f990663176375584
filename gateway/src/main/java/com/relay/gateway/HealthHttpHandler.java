package com.relay.gateway;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relay.broker.BrokerHealth;
import com.relay.broker.RelayBroker;
import com.relay.broker.event.ErrorOccurred;
import com.relay.broker.health.HealthStatus;
import com.relay.protocol.Messages;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.ReferenceCountUtil;

import java.nio.charset.StandardCharsets;

/**
 * Answers {@code GET /health} with a JSON snapshot; every other request passes
 * through to the WebSocket upgrade handler.
 */
@ChannelHandler.Sharable
public final class HealthHttpHandler extends ChannelInboundHandlerAdapter {

    static final String PATH = "/health";

    private final RelayBroker broker;

    public HealthHttpHandler(RelayBroker broker) {
        this.broker = broker;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof FullHttpRequest req
                && req.method() == HttpMethod.GET
                && PATH.equals(new QueryStringDecoder(req.uri()).path())) {
            try {
                BrokerHealth h = broker.health();
                byte[] body = Messages.write(toJson(h)).getBytes(StandardCharsets.UTF_8);
                HttpResponseStatus status = h.status() == HealthStatus.UNHEALTHY
                        ? HttpResponseStatus.SERVICE_UNAVAILABLE
                        : HttpResponseStatus.OK;
                FullHttpResponse resp = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
                        Unpooled.wrappedBuffer(body));
                resp.headers()
                        .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                        .setInt(HttpHeaderNames.CONTENT_LENGTH, body.length)
                        .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
                ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
            } finally {
                ReferenceCountUtil.release(req);
            }
            return;
        }
        super.channelRead(ctx, msg);
    }

    static ObjectNode toJson(BrokerHealth h) {
        ObjectNode n = Messages.object();
        n.put("status", h.status().wireName);
        n.put("uptimeMs", h.uptime().toMillis());
        n.put("activeClients", h.activeClients());
        n.put("requesters", h.requesters());
        n.put("responders", h.responders());
        n.put("activePopups", h.activePopups());
        n.put("queuedMessages", h.queuedMessages());
        n.put("heapUsedBytes", h.heapUsedBytes());
        n.put("errorsLastHour", h.errorsLastHour());
        ArrayNode recent = n.putArray("recentErrors");
        for (ErrorOccurred e : h.recentErrors()) {
            ObjectNode r = recent.addObject();
            r.put("timestamp", e.timestamp().toString());
            r.put("kind", e.kind().name());
            r.put("message", e.message());
            if (e.clientId() != null) r.put("clientId", e.clientId());
        }
        return n;
    }
}
