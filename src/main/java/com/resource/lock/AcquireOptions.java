package com.resource.lock;

import com.resource.lock.time.CancellationSignal;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for {@link Lock#acquire(String, AcquireOptions)}.
 *
 * @param ttl     how long the lease is valid before auto-expiring
 * @param timeout max time to wait; {@code null} falls back to {@link LockConfig#defaultTimeout()}
 * @param signal  aborts the wait early; {@code null} for none. No effect once the lock is acquired.
 */
public record AcquireOptions(Duration ttl, Duration timeout, CancellationSignal signal) {

    public AcquireOptions {
        Objects.requireNonNull(ttl, "ttl");
    }

    public static AcquireOptions of(Duration ttl) {
        return new AcquireOptions(ttl, null, null);
    }

    public AcquireOptions withTimeout(Duration timeout) {
        return new AcquireOptions(ttl, timeout, signal);
    }

    public AcquireOptions withSignal(CancellationSignal signal) {
        return new AcquireOptions(ttl, timeout, signal);
    }
}
