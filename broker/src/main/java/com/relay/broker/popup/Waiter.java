package com.relay.broker.popup;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;

/**
 * One caller blocked on a result. The promise is the one-shot claim: whichever of
 * release or deadline completes it first wins, the other becomes a no-op.
 */
final class Waiter {

    final Promise<JsonNode> promise;
    /** Client the result is for; null when not tied to a connection. */
    final String            owner;
    ScheduledFuture<?>      deadline;

    Waiter(Promise<JsonNode> promise, String owner) {
        this.promise = promise;
        this.owner   = owner;
    }

    boolean ownedBy(String clientId) {
        return owner != null && owner.equals(clientId);
    }

    /** @return false if the deadline (or shutdown) got there first */
    boolean release(JsonNode result) {
        if (!promise.trySuccess(result)) return false;
        if (deadline != null) deadline.cancel(false);
        return true;
    }

    boolean fail(Throwable cause) {
        if (!promise.tryFailure(cause)) return false;
        if (deadline != null) deadline.cancel(false);
        return true;
    }
}
