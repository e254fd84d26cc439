package com.resource.lock.time;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation flag shared between the party that wants to stop a
 * wait and the thread doing the waiting.
 *
 * <p>Once cancelled a signal stays cancelled. Threads parked in
 * {@link #await(long, TimeUnit)} are woken immediately.</p>
 */
public final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    /**
     * Returns a signal that is already cancelled.
     */
    public static CancellationSignal cancelled() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        return signal;
    }

    /**
     * Requests cancellation. Idempotent.
     */
    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Waits until the signal is cancelled or the timeout elapses.
     *
     * @return true if the signal was cancelled
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return latch.await(timeout, unit);
    }

    @Override
    public String toString() {
        return "CancellationSignal{cancelled=" + isCancelled() + '}';
    }
}
