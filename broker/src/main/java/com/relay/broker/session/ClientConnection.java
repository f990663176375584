package com.relay.broker.session;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.util.concurrent.Future;

/**
 * Capability-level view of one physical connection.
 *
 * Implementations are the only code allowed to touch the transport. A send on a
 * connection that is not open must fail its future; failures are never swallowed.
 */
public interface ClientConnection {

    Future<Void> send(JsonNode message);

    Future<Void> close();

    boolean isAlive();
}
