package com.relay.broker.event;

@FunctionalInterface
public interface BrokerEventListener {

    BrokerEventListener NOOP = event -> {};

    void onEvent(BrokerEvent event);
}
