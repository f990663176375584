package com.relay.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.relay.broker.BrokerException;
import com.relay.broker.session.ClientConnection;
import com.relay.protocol.ErrorCode;
import com.relay.protocol.Messages;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.util.concurrent.Future;

/**
 * {@link ClientConnection} over a WebSocket channel. Each message is one text frame.
 */
public final class WebSocketConnection implements ClientConnection {

    private final Channel channel;

    public WebSocketConnection(Channel channel) {
        this.channel = channel;
    }

    @Override
    public Future<Void> send(JsonNode message) {
        if (!channel.isActive()) {
            return channel.newFailedFuture(new BrokerException(ErrorCode.CONNECTION_NOT_ALIVE,
                    "Channel " + channel.id().asShortText() + " is closed"));
        }
        return channel.writeAndFlush(new TextWebSocketFrame(Messages.write(message)));
    }

    @Override
    public Future<Void> close() {
        if (!channel.isActive()) return channel.close();
        channel.writeAndFlush(new CloseWebSocketFrame(WebSocketCloseStatus.NORMAL_CLOSURE))
                .addListener(ChannelFutureListener.CLOSE);
        return channel.closeFuture();
    }

    @Override
    public boolean isAlive() {
        return channel.isActive();
    }

    @Override
    public String toString() {
        return "WebSocketConnection{" + channel + "}";
    }
}
