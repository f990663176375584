package com.relay.broker.session;

import com.relay.protocol.ClientRole;

import java.time.Instant;

/**
 * Broker-side state for an identified client.
 *
 * Thread safety: id, role, metadata, connectedAt and connection are immutable.
 * lastActivity is written only on the broker loop; volatile so snapshots read
 * from other threads (health endpoint, tests) see the latest value.
 */
public final class ClientSession {

    public final String           id;
    public final ClientRole       role;
    public final ClientMetadata   metadata;
    public final Instant          connectedAt;

    // Owned exclusively; closed by the registry on teardown
    final ClientConnection connection;

    private volatile Instant lastActivity;

    ClientSession(String id, ClientRole role, ClientMetadata metadata,
                  ClientConnection connection, Instant connectedAt) {
        this.id           = id;
        this.role         = role;
        this.metadata     = metadata;
        this.connection   = connection;
        this.connectedAt  = connectedAt;
        this.lastActivity = connectedAt;
    }

    public Instant lastActivity() { return lastActivity; }

    void touch(Instant now) { lastActivity = now; }

    public boolean isAlive() { return connection.isAlive(); }

    @Override
    public String toString() {
        return "ClientSession{" + id + ", " + role + ", lastActivity=" + lastActivity + "}";
    }
}
