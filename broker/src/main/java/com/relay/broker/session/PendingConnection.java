package com.relay.broker.session;

import java.time.Instant;

/** A connection that has not identified itself yet. */
record PendingConnection(String id, ClientConnection connection, String userAgent, Instant acceptedAt) {}
