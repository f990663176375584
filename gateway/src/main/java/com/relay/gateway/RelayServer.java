package com.relay.gateway;

import com.relay.broker.RelayBroker;
import com.relay.common.BrokerConfig;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Netty HTTP server that serves GET /health and upgrades the configured path to WebSocket.
 *
 * Pipeline per connection:
 *   HttpServerCodec
 *   → HttpObjectAggregator
 *   → HealthHttpHandler              (GET /health, shared)
 *   → WebSocketServerCompressionHandler
 *   → WebSocketServerProtocolHandler (upgrade + ping/pong/close frames)
 *   → ClientSocketHandler            (one per connection)
 */
public final class RelayServer {

    private static final Logger log = LoggerFactory.getLogger(RelayServer.class);

    private static final int MAX_HTTP_CONTENT = 65536;

    private final BrokerConfig      cfg;
    private final RelayBroker       broker;
    private final NioEventLoopGroup bossGroup;
    private final NioEventLoopGroup workerGroup;
    private final HealthHttpHandler healthHandler;

    private Channel serverChannel;

    public RelayServer(BrokerConfig cfg, RelayBroker broker,
                       NioEventLoopGroup bossGroup, NioEventLoopGroup workerGroup) {
        this.cfg           = cfg;
        this.broker        = broker;
        this.bossGroup     = bossGroup;
        this.workerGroup   = workerGroup;
        this.healthHandler = new HealthHttpHandler(broker);
    }

    public void start() throws InterruptedException {
        ServerBootstrap b = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new HttpServerCodec())
                                .addLast(new HttpObjectAggregator(MAX_HTTP_CONTENT))
                                .addLast(healthHandler)
                                .addLast(new WebSocketServerCompressionHandler())
                                .addLast(new WebSocketServerProtocolHandler(cfg.wsPath, null, true, cfg.maxFrameBytes))
                                .addLast(new ClientSocketHandler(broker));
                    }
                });

        serverChannel = b.bind(cfg.port).sync().channel();
        log.info("Relay server listening on ws://localhost:{}{} (health: http://localhost:{}{})",
                port(), cfg.wsPath, port(), HealthHttpHandler.PATH);
    }

    /** The bound port; differs from the configured one when that was 0. */
    public int port() {
        return serverChannel != null ? ((InetSocketAddress) serverChannel.localAddress()).getPort() : cfg.port;
    }

    public void stop() throws InterruptedException {
        if (serverChannel != null) serverChannel.close().sync();
    }
}
