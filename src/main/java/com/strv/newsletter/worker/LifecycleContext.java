package com.strv.newsletter.worker;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellable lifecycle signal shared by the process and the worker pool.
 *
 * <p>Cancelling asks everything bound to it to wind down. It does not abort work in progress.
 * <p>Cancellation is one way and happens at most once.
 */
public class LifecycleContext {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch done = new CountDownLatch(1);

    /**
     * Cancels the context, releasing every thread blocked in {@link #await()}.
     *
     * @return True if this call cancelled the context.
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        done.countDown();
        return true;
    }

    /**
     * Is cancelled.
     *
     * @return Boolean.
     */
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Blocks until cancelled.
     *
     * @throws InterruptedException If interrupted while waiting.
     */
    public void await() throws InterruptedException {
        done.await();
    }

    /**
     * Blocks until cancelled or the timeout elapses.
     *
     * @param timeout Timeout.
     * @param unit    Unit.
     * @return True if cancelled.
     * @throws InterruptedException If interrupted while waiting.
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit);
    }
}
