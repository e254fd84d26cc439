package com.resource.lock.time;

/**
 * Suspends the calling thread for a number of milliseconds, returning early
 * when the supplied {@link CancellationSignal} fires.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * @param millis time to sleep; values {@code <= 0} return immediately
     * @param signal optional cancellation signal, may be {@code null}
     * @throws InterruptedException if the calling thread is interrupted while sleeping
     */
    void sleep(long millis, CancellationSignal signal) throws InterruptedException;
}
