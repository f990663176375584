package com.relay.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrokerConfigTest {

    @Test
    void defaultsMatchDevelopmentSetup() {
        BrokerConfig cfg = BrokerConfig.defaults();

        assertEquals(8080,       cfg.port);
        assertEquals("/ws",      cfg.wsPath);
        assertEquals(30_000L,    cfg.heartbeatIntervalMs);
        assertEquals(10,         cfg.maxClients);
        assertEquals(30_000L,    cfg.popupTimeoutMs);
        assertEquals(60_000L,    cfg.popupRetentionMs);
        assertEquals(100,        cfg.errorHistorySize);
        assertEquals(500L * 1024 * 1024, cfg.memoryPressureBytes);
    }

    @Test
    void loadsClasspathDefaultWhenNoPathGiven() {
        BrokerConfig cfg = BrokerConfig.load(null);

        assertEquals(9091,    cfg.port);
        assertEquals(5_000L,  cfg.heartbeatIntervalMs);
        assertEquals(4,       cfg.maxClients);
        assertEquals(15_000L, cfg.popupTimeoutMs);
        // Keys absent from the file keep their defaults
        assertEquals(60_000L, cfg.popupRetentionMs);
    }

    @Test
    void fileOverridesClasspath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.yml");
        Files.writeString(file, "port: 7100\nwsPath: /relay\nmaxClients: 2\n");

        BrokerConfig cfg = BrokerConfig.load(file.toString());

        assertEquals(7100,     cfg.port);
        assertEquals("/relay", cfg.wsPath);
        assertEquals(2,        cfg.maxClients);
        assertEquals(30_000L,  cfg.heartbeatIntervalMs);
    }

    @Test
    void malformedFileFallsBackToDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("broken.yml");
        Files.writeString(file, "port: [unterminated\n");

        BrokerConfig cfg = BrokerConfig.load(file.toString());

        assertEquals(8080, cfg.port);
    }

    @Test
    void invalidValueInFileIsReportedNotSwallowed(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("invalid.yml");
        Files.writeString(file, "port: 7100\nheartbeatIntervalMs: 0\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> BrokerConfig.load(file.toString()));
        assertTrue(e.getMessage().contains("heartbeatIntervalMs"), e.getMessage());
        assertTrue(e.getMessage().contains(file.toString()), e.getMessage());
    }

    @Test
    void missingFileFallsBackToClasspath(@TempDir Path dir) {
        BrokerConfig cfg = BrokerConfig.load(dir.resolve("absent.yml").toString());

        assertEquals(9091, cfg.port);
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> BrokerConfig.fromMap(Map.of("heartbeatIntervalMs", 0)));
        assertThrows(IllegalArgumentException.class,
                () -> BrokerConfig.fromMap(Map.of("maxClients", 0)));
    }
}
