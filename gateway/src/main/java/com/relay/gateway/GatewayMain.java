package com.relay.gateway;

import com.relay.broker.RelayBroker;
import com.relay.common.BrokerConfig;
import io.netty.channel.nio.NioEventLoopGroup;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Relay broker process entry point.
 *
 * Usage:
 *   java -jar relay-gateway-fat.jar [relay-config-path]
 *
 * On SIGINT/SIGTERM the broker disconnects every client before the listener closes.
 */
public final class GatewayMain {

    private static final Logger log = LoggerFactory.getLogger(GatewayMain.class);

    private static final long STOP_TIMEOUT_SECS = 10;

    public static void main(String[] args) throws Exception {
        String configPath = args.length > 0 ? args[0] : null;
        BrokerConfig cfg = BrokerConfig.load(configPath);

        log.info("Starting relay broker: port={} wsPath={} maxClients={}", cfg.port, cfg.wsPath, cfg.maxClients);

        NioEventLoopGroup bossGroup   = new NioEventLoopGroup(1);
        NioEventLoopGroup workerGroup = new NioEventLoopGroup(4);

        RelayBroker broker = new RelayBroker(cfg);
        broker.start();

        RelayServer server = new RelayServer(cfg, broker, bossGroup, workerGroup);
        try {
            server.start();
        } catch (Exception e) {
            log.error("Failed to bind port {}", cfg.port, e);
            broker.stop().await(STOP_TIMEOUT_SECS, TimeUnit.SECONDS);
            workerGroup.shutdownGracefully();
            bossGroup.shutdownGracefully();
            throw e;
        }

        log.info("Relay broker is UP. Ctrl-C to stop.");
        new ShutdownSignalBarrier().await();

        if (!broker.stop().await(STOP_TIMEOUT_SECS, TimeUnit.SECONDS)) {
            log.warn("Broker did not stop within {}s", STOP_TIMEOUT_SECS);
        }
        server.stop();
        workerGroup.shutdownGracefully();
        bossGroup.shutdownGracefully();
        log.info("Relay broker stopped.");
    }
}
