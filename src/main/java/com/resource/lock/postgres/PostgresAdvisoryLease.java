package com.resource.lock.postgres;

import com.resource.lock.Lease;
import com.resource.lock.LockBackendException;
import com.resource.lock.postgres.pool.ConnectionPool;
import com.resource.lock.validation.TimeValidation;
import com.resource.lock.watchdog.LeaseWatchdog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Lease handed out by {@link PostgresAdvisoryLock}. Holds the advisory lock id
 * and the connection whose session took it.
 */
final class PostgresAdvisoryLease implements Lease {
    private static final Logger log = LoggerFactory.getLogger(PostgresAdvisoryLease.class);

    private final String key;
    private final long lockId;
    private final Connection connection;
    private final ConnectionPool pool;
    private final LeaseWatchdog watchdog;
    private final Consumer<Lease> onReleased;
    private final AtomicBoolean released = new AtomicBoolean(false);

    // guarded by this
    private ScheduledFuture<?> ttlTimer;

    PostgresAdvisoryLease(String key, long lockId, Connection connection, ConnectionPool pool,
                          LeaseWatchdog watchdog, Consumer<Lease> onReleased) {
        this.key = key;
        this.lockId = lockId;
        this.connection = connection;
        this.pool = pool;
        this.watchdog = watchdog;
        this.onReleased = onReleased;
    }

    @Override
    public String key() {
        return key;
    }

    /**
     * Unlocks on the pinned session, then always gives the connection back.
     * If the unlock statement itself fails the session may still hold the
     * lock, so the connection is discarded instead of reused.
     */
    @Override
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }

        clearTtlTimer();
        try {
            unlockAndReturnConnection();
        } finally {
            onReleased.accept(this);
        }
    }

    /**
     * Undoes a claim that was never handed to the caller: unlocks and gives the
     * connection back without reporting a release.
     */
    void abandon() {
        if (released.compareAndSet(false, true)) {
            unlockAndReturnConnection();
        }
    }

    private void unlockAndReturnConnection() {
        boolean sessionClean = false;
        try {
            if (!unlock()) {
                log.warn("Advisory lock {} (id={}) was not held by its session at release", key, lockId);
            }
            sessionClean = true;
        } catch (SQLException e) {
            throw new LockBackendException("Failed to release advisory lock for key '" + key + "'", e);
        } finally {
            if (sessionClean) {
                pool.release(connection);
            } else {
                pool.invalidate(connection);
            }
        }
    }

    /**
     * Reschedules the local auto-release watchdog.
     *
     * <p>Advisory locks have no server-side TTL and no reliable "do I still own
     * this" check. A {@code true} result only means this lease has not been
     * released locally; the lock may already be gone with its session.</p>
     */
    @Override
    public boolean extend(Duration ttl) {
        if (released.get()) {
            return false;
        }
        long ttlMs = TimeValidation.requirePositiveMillis(ttl, "lease ttl");

        synchronized (this) {
            if (released.get()) {
                return false;
            }
            clearTtlTimer();
            scheduleAutoRelease(ttlMs);
        }
        return true;
    }

    @Override
    public boolean isReleased() {
        return released.get();
    }

    long lockId() {
        return lockId;
    }

    synchronized void scheduleAutoRelease(long ttlMs) {
        ttlTimer = watchdog.arm(key, ttlMs, this::release);
    }

    private synchronized void clearTtlTimer() {
        if (ttlTimer == null) {
            return;
        }
        ttlTimer.cancel(false);
        ttlTimer = null;
    }

    private boolean unlock() throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(PostgresAdvisoryLock.UNLOCK_SQL)) {
            statement.setLong(1, lockId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    @Override
    public String toString() {
        return "PostgresAdvisoryLease{key='" + key + "', lockId=" + lockId + ", released=" + released.get() + '}';
    }
}
