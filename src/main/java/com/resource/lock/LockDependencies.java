package com.resource.lock;

import com.resource.lock.metrics.LockMetrics;
import com.resource.lock.metrics.NoOpLockMetrics;
import com.resource.lock.time.Clock;
import com.resource.lock.time.Sleeper;
import com.resource.lock.time.SystemClock;
import com.resource.lock.time.SystemSleeper;

import java.util.Objects;

/**
 * Collaborators injected into lock implementations.
 *
 * @param clock   time source for poll deadlines
 * @param sleeper cancellable sleep between poll attempts
 * @param metrics metrics sink
 */
public record LockDependencies(Clock clock, Sleeper sleeper, LockMetrics metrics) {

    public LockDependencies {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(sleeper, "sleeper");
        Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * System clock, real sleeping, no metrics.
     */
    public static LockDependencies defaults() {
        return new LockDependencies(SystemClock.instance(), SystemSleeper.instance(), new NoOpLockMetrics());
    }

    public LockDependencies withMetrics(LockMetrics metrics) {
        return new LockDependencies(clock, sleeper, metrics);
    }
}
