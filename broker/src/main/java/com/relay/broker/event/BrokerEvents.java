package com.relay.broker.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fan-out of broker events to the listeners wired by the owning broker.
 *
 * One instance per broker; there is no process-wide bus. A failing listener is
 * logged and never prevents delivery to the others.
 */
public final class BrokerEvents implements BrokerEventListener {

    private static final Logger log = LoggerFactory.getLogger(BrokerEvents.class);

    private final List<BrokerEventListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(BrokerEventListener listener) {
        listeners.add(listener);
    }

    @Override
    public void onEvent(BrokerEvent event) {
        for (BrokerEventListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener failed on {}: {}", event.name(), e.toString());
            }
        }
    }
}
