package com.relay.broker.testing;

import com.relay.broker.BrokerExecutor;

import java.util.function.BooleanSupplier;

public final class Loops {

    private Loops() {}

    /** Returns once every task submitted to the loop so far has run. */
    public static void settle(BrokerExecutor loop) {
        loop.await(() -> null);
    }

    /** Polls until the condition holds; for work finished by loop timers. */
    public static void eventually(BooleanSupplier condition, long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not met within " + timeoutMs + "ms");
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted", e);
            }
        }
    }
}
