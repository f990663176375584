package com.relay.broker;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * The single logical thread that owns all broker state.
 *
 * Every registry map, queue, interaction table and waiter list is mutated only
 * from this executor, so none of them need locks. Callers on other threads
 * (Netty I/O threads, tests) hop onto the loop through {@link #call} or
 * {@link #execute}; timers are scheduled here too.
 */
public final class BrokerExecutor {

    private final EventExecutor loop;

    public BrokerExecutor(String name) {
        this(new DefaultEventExecutor(new DefaultThreadFactory(name, true)));
    }

    public BrokerExecutor(EventExecutor loop) {
        this.loop = loop;
    }

    public boolean inLoop() { return loop.inEventLoop(); }

    public void execute(Runnable task) {
        if (loop.inEventLoop()) {
            task.run();
        } else {
            loop.execute(task);
        }
    }

    /**
     * Runs the task on the loop. Inline when already on the loop, so a task may
     * call other broker operations without deadlocking.
     */
    public <T> Future<T> call(Callable<T> task) {
        if (loop.inEventLoop()) {
            try {
                return loop.newSucceededFuture(task.call());
            } catch (Throwable t) {
                return loop.newFailedFuture(t);
            }
        }
        return loop.submit(task);
    }

    /** Like {@link #call} but for tasks that produce their own future. */
    public <T> Future<T> flatCall(Callable<Future<T>> task) {
        if (loop.inEventLoop()) {
            try {
                return task.call();
            } catch (Throwable t) {
                return loop.newFailedFuture(t);
            }
        }
        Promise<T> promise = loop.newPromise();
        loop.execute(() -> {
            try {
                cascade(task.call(), promise);
            } catch (Throwable t) {
                promise.tryFailure(t);
            }
        });
        return promise;
    }

    /**
     * Blocks the calling thread until the loop has answered. Used by read-only
     * queries, which must see a consistent snapshot of loop-owned state.
     */
    public <T> T await(Callable<T> query) {
        if (loop.inEventLoop()) {
            try {
                return query.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
        try {
            return loop.submit(query).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for broker loop", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new IllegalStateException(cause);
        }
    }

    public <T> Promise<T> newPromise() { return loop.newPromise(); }

    public <T> Future<T> succeeded(T value) { return loop.newSucceededFuture(value); }

    public <T> Future<T> failed(Throwable cause) { return loop.newFailedFuture(cause); }

    public ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        return loop.schedule(task, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
    }

    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        long ms = period.toMillis();
        return loop.scheduleAtFixedRate(task, ms, ms, TimeUnit.MILLISECONDS);
    }

    public Future<?> shutdownGracefully() {
        return loop.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    /** Completes {@code promise} with the outcome of {@code future}. */
    public static <T> void cascade(Future<T> future, Promise<T> promise) {
        future.addListener(f -> {
            if (f.isSuccess()) {
                @SuppressWarnings("unchecked")
                T value = (T) f.getNow();
                promise.trySuccess(value);
            } else if (f.isCancelled()) {
                promise.cancel(false);
            } else {
                promise.tryFailure(f.cause());
            }
        });
    }
}
