package com.resource.lock;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Helpers that run a task while holding a lease and always release it afterwards.
 */
public final class Locks {

    private Locks() {
    }

    /**
     * Runs {@code task} if {@code key} can be claimed immediately.
     *
     * @return the task result, or empty if the lock was held (the task is not run)
     * @throws NullPointerException if the task returns {@code null}, which would
     *                              be indistinguishable from "not acquired"
     */
    public static <T> Optional<T> tryWithLock(Lock lock, String key, Duration ttl, Supplier<T> task) {
        Optional<Lease> lease = lock.tryAcquire(key, ttl);
        if (lease.isEmpty()) {
            return Optional.empty();
        }
        try (Lease held = lease.get()) {
            return Optional.of(Objects.requireNonNull(task.get(), "task result for lock " + key));
        }
    }

    /**
     * Acquires {@code key} (waiting per {@code options}), runs {@code task}, then releases.
     *
     * @throws LockAcquisitionException if the wait was cancelled or timed out
     */
    public static <T> T withLock(Lock lock, String key, AcquireOptions options, Supplier<T> task) {
        if (options.signal() != null && options.signal().isCancelled()) {
            throw new LockAcquisitionException("Lock acquisition cancelled for key: " + key);
        }

        Lease lease = lock.acquire(key, options)
                .orElseThrow(() -> new LockAcquisitionException("Failed to acquire lock for key: " + key));

        try (Lease held = lease) {
            return task.get();
        }
    }
}
