package com.resource.lock.metrics;

import com.resource.lock.AcquireOutcome;

import java.time.Duration;

/**
 * No-op implementation of {@link LockMetrics}.
 */
public class NoOpLockMetrics implements LockMetrics {

    @Override
    public void recordAttempt(String backend, boolean acquired) {
    }

    @Override
    public void recordAcquire(String backend, AcquireOutcome outcome, Duration waited) {
    }

    @Override
    public void recordRelease(String backend) {
    }
}
