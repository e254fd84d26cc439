package com.resource.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * Grants exclusive, time-bounded ownership of a named resource.
 *
 * <p>"Did not get the lock" is always reported as {@link Optional#empty()};
 * thrown exceptions mean invalid arguments or a broken backend.</p>
 */
public interface Lock {

    /**
     * Acquires {@code key}, waiting up to the configured timeout while it is held elsewhere.
     *
     * <p>If the options carry an already-cancelled signal, returns empty without
     * attempting. A zero timeout makes exactly one attempt. Cancellation after
     * the lease has been obtained has no effect.</p>
     *
     * @param key     the lock key
     * @param options TTL, optional timeout (defaults to {@link LockConfig#defaultTimeout()}) and signal
     * @return the lease, or empty if the timeout elapsed or the wait was cancelled
     * @throws IllegalArgumentException if the timeout is negative or unbounded, or the TTL is invalid
     */
    Optional<Lease> acquire(String key, AcquireOptions options);

    /**
     * Acquires {@code key} with the default timeout and no cancellation signal.
     */
    default Optional<Lease> acquire(String key, Duration ttl) {
        return acquire(key, AcquireOptions.of(ttl));
    }

    /**
     * Makes a single atomic attempt to claim {@code key}. Never waits for contention.
     *
     * @param key the lock key
     * @param ttl lease lifetime, must be finite and {@code > 0}
     * @return the lease, or empty if the key is currently held
     * @throws IllegalArgumentException if the TTL is invalid
     */
    Optional<Lease> tryAcquire(String key, Duration ttl);
}
