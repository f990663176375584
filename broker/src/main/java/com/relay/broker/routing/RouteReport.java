package com.relay.broker.routing;

import com.relay.protocol.MessageKind;

import java.util.List;

/**
 * Outcome of one {@link MessageRouter#route} call.
 *
 * @param delivered clients the message was written to
 * @param queued    clients that were offline or failed; the message waits in their backlog
 */
public record RouteReport(MessageKind kind, List<String> delivered, List<String> queued) {

    public RouteReport {
        delivered = List.copyOf(delivered);
        queued    = List.copyOf(queued);
    }
}
