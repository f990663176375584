package com.relay.broker.testing;

import com.relay.broker.event.BrokerEvent;
import com.relay.broker.event.BrokerEventListener;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class EventRecorder implements BrokerEventListener {

    public final List<BrokerEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(BrokerEvent event) {
        events.add(event);
    }

    public <T extends BrokerEvent> List<T> of(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (BrokerEvent e : events) {
            if (type.isInstance(e)) out.add(type.cast(e));
        }
        return out;
    }
}
