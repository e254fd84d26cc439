package com.resource.lock.metrics;

import com.resource.lock.AcquireOutcome;

import java.time.Duration;

/**
 * Interface for recording lock metrics.
 * The default {@link NoOpLockMetrics} does nothing; {@link MicrometerLockMetrics}
 * publishes to a Micrometer registry.
 */
public interface LockMetrics {

    /**
     * Records one atomic claim attempt ({@code tryAcquire}).
     *
     * @param backend  backend name, e.g. {@code memory}
     * @param acquired whether the claim succeeded
     */
    void recordAttempt(String backend, boolean acquired);

    /**
     * Records a completed {@code acquire} call and the time spent waiting in it.
     */
    void recordAcquire(String backend, AcquireOutcome outcome, Duration waited);

    /**
     * Records a lease leaving the held state, whatever the cause.
     */
    void recordRelease(String backend);
}
