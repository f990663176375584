package com.relay.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;

/**
 * Broker configuration loaded from relay.yml (or classpath default).
 * All fields have sensible defaults for localhost development.
 *
 * Immutable once loaded: components receive one instance at construction
 * and never see it change.
 */
public final class BrokerConfig {

    private static final Logger log = LoggerFactory.getLogger(BrokerConfig.class);

    // Listener
    public final int    port;
    public final String wsPath;
    public final int    maxFrameBytes;

    // Sessions
    public final long heartbeatIntervalMs;
    public final int  maxClients;

    // Popups
    public final long popupTimeoutMs;
    public final long popupRetentionMs;

    // Health
    public final long healthCheckIntervalMs;
    public final int  errorHistorySize;
    public final long memoryPressureBytes;

    // Metrics
    public final int metricsIntervalSecs;

    private BrokerConfig(Map<String, Object> map) {
        this.port                  = intValue(map, "port", 8080);
        this.wsPath                = stringValue(map, "wsPath", "/ws");
        this.maxFrameBytes         = intValue(map, "maxFrameBytes", 1024 * 1024);
        this.heartbeatIntervalMs   = longValue(map, "heartbeatIntervalMs", 30_000L);
        this.maxClients            = intValue(map, "maxClients", 10);
        this.popupTimeoutMs        = longValue(map, "popupTimeoutMs", 30_000L);
        this.popupRetentionMs      = longValue(map, "popupRetentionMs", 60_000L);
        this.healthCheckIntervalMs = longValue(map, "healthCheckIntervalMs", 30_000L);
        this.errorHistorySize      = intValue(map, "errorHistorySize", 100);
        this.memoryPressureBytes   = longValue(map, "memoryPressureBytes", 500L * 1024 * 1024);
        this.metricsIntervalSecs   = intValue(map, "metricsIntervalSecs", 60);

        if (heartbeatIntervalMs <= 0) throw new IllegalArgumentException("heartbeatIntervalMs must be positive");
        if (maxClients < 1)           throw new IllegalArgumentException("maxClients must be at least 1");
        if (popupTimeoutMs <= 0)      throw new IllegalArgumentException("popupTimeoutMs must be positive");
        if (errorHistorySize < 1)     throw new IllegalArgumentException("errorHistorySize must be at least 1");
    }

    public static BrokerConfig defaults() {
        return new BrokerConfig(Collections.emptyMap());
    }

    /** Builds a config from already-parsed key/value pairs; unknown keys are ignored. */
    public static BrokerConfig fromMap(Map<String, Object> map) {
        return new BrokerConfig(map != null ? map : Collections.emptyMap());
    }

    /**
     * Reads {@code path}, or the classpath {@code /relay.yml} when no path is given or
     * the file does not exist. An unreadable file falls back to defaults; a readable
     * file with an invalid value throws {@link IllegalArgumentException}.
     */
    public static BrokerConfig load(String path) {
        boolean fromFile = path != null && Files.exists(Paths.get(path));
        if (path != null && !fromFile) {
            log.warn("Config file {} not found, trying classpath:/relay.yml", path);
        }
        String source = fromFile ? path : "classpath:/relay.yml";

        Map<String, Object> map;
        try (InputStream is = fromFile
                ? Files.newInputStream(Paths.get(path))
                : BrokerConfig.class.getResourceAsStream("/relay.yml")) {
            if (is == null) {
                log.warn("No config found, using defaults");
                return defaults();
            }
            map = new Yaml().load(is);
        } catch (Exception e) {
            log.warn("Failed to read config from {}, using defaults: {}", source, e.getMessage());
            return defaults();
        }
        try {
            return fromMap(map);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid config in " + source + ": " + e.getMessage(), e);
        }
    }

    public Duration heartbeatInterval() { return Duration.ofMillis(heartbeatIntervalMs); }
    public Duration popupTimeout()      { return Duration.ofMillis(popupTimeoutMs); }
    public Duration popupRetention()    { return Duration.ofMillis(popupRetentionMs); }
    public Duration healthCheckInterval() { return Duration.ofMillis(healthCheckIntervalMs); }

    @Override
    public String toString() {
        return "BrokerConfig{port=" + port + ", wsPath=" + wsPath + ", heartbeatIntervalMs=" + heartbeatIntervalMs
                + ", maxClients=" + maxClients + ", popupTimeoutMs=" + popupTimeoutMs
                + ", popupRetentionMs=" + popupRetentionMs + "}";
    }

    private static int intValue(Map<String, Object> map, String key, int def) {
        Object v = map.get(key);
        return v instanceof Number n ? n.intValue() : def;
    }

    private static long longValue(Map<String, Object> map, String key, long def) {
        Object v = map.get(key);
        return v instanceof Number n ? n.longValue() : def;
    }

    private static String stringValue(Map<String, Object> map, String key, String def) {
        Object v = map.get(key);
        return v != null ? v.toString() : def;
    }
}
