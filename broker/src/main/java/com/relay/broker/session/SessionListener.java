package com.relay.broker.session;

/**
 * Lifecycle callbacks from the {@link SessionRegistry}, invoked on the broker loop.
 */
public interface SessionListener {

    void onClientConnected(ClientSession session);

    void onClientDisconnected(ClientSession session, String reason);
}
