package com.resource.lock;

import java.time.Duration;

/**
 * Ownership of one lock key, obtained from a successful acquisition.
 *
 * <p>A lease moves from held to released exactly once: by {@link #release()},
 * by its TTL elapsing, or (for session-bound backends) by the backing session
 * going away. Implements {@link AutoCloseable} so it can be used in
 * try-with-resources.</p>
 */
public interface Lease extends AutoCloseable {

    /**
     * The key this lease holds.
     */
    String key();

    /**
     * Releases the lock if still owned. Idempotent: later calls are no-ops.
     * A lock already reclaimed by someone else is not an error.
     */
    void release();

    /**
     * Extends the lease TTL.
     *
     * <p>Some backends (Postgres advisory locks) cannot verify ownership
     * server-side. For those, this only reschedules the local auto-release
     * watchdog and cannot tell whether the lock was lost with its session.</p>
     *
     * @param ttl new lifetime measured from now, must be finite and {@code > 0}
     * @return false if the lease is no longer owned
     */
    boolean extend(Duration ttl);

    /**
     * Whether this lease has been released locally. {@code false} does not prove
     * the backend still considers it held.
     */
    boolean isReleased();

    /**
     * Equivalent to {@link #release()}.
     */
    @Override
    default void close() {
        release();
    }
}
