package com.relay.broker;

import com.relay.protocol.ErrorCode;
import io.netty.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static com.relay.broker.testing.Futures.failure;
import static com.relay.broker.testing.Futures.get;
import static org.junit.jupiter.api.Assertions.*;

class BrokerExecutorTest {

    private final BrokerExecutor loop = new BrokerExecutor("executor-test");

    @AfterEach
    void tearDown() {
        loop.shutdownGracefully();
    }

    @Test
    void callRunsOnLoopThread() {
        assertFalse(loop.inLoop());
        assertTrue(get(loop.call(loop::inLoop)));
    }

    @Test
    void nestedCallRunsInline() {
        AtomicReference<Future<String>> inner = new AtomicReference<>();
        get(loop.call(() -> {
            inner.set(loop.call(() -> "inner"));
            return null;
        }));

        assertTrue(inner.get().isDone(), "Calls made on the loop complete without a second hop");
        assertEquals("inner", inner.get().getNow());
    }

    @Test
    void failuresTravelThroughFutures() {
        Future<Object> f = loop.call(() -> {
            throw new BrokerException(ErrorCode.NOT_FOUND, "gone");
        });
        assertEquals(ErrorCode.NOT_FOUND, failure(f));

        Future<Object> flat = loop.flatCall(() -> loop.failed(new BrokerException(ErrorCode.TIMEOUT, "late")));
        assertEquals(ErrorCode.TIMEOUT, failure(flat));
    }

    @Test
    void awaitRethrowsRuntimeExceptions() {
        BrokerException e = assertThrows(BrokerException.class, () -> loop.await(() -> {
            throw new BrokerException(ErrorCode.INVALID_STATE, "bad");
        }));
        assertEquals(ErrorCode.INVALID_STATE, e.code());
    }

    @Test
    void codeOfWalksCauses() {
        Exception wrapped = new RuntimeException(new BrokerException(ErrorCode.SEND_FAILURE, "x"));
        assertEquals(ErrorCode.SEND_FAILURE, BrokerException.codeOf(wrapped));
        assertEquals(ErrorCode.INTERNAL, BrokerException.codeOf(new IllegalStateException()));
        assertTrue(new BrokerException(ErrorCode.CLIENT_QUEUED, "q").isRetryable());
    }
}
