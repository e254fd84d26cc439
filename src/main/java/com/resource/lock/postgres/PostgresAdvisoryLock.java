package com.resource.lock.postgres;

import com.resource.lock.AbstractPollingLock;
import com.resource.lock.Lease;
import com.resource.lock.LockBackendException;
import com.resource.lock.LockConfig;
import com.resource.lock.LockDependencies;
import com.resource.lock.postgres.pool.ConnectionPool;
import com.resource.lock.watchdog.LeaseWatchdog;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * Lock backed by Postgres session-level advisory locks.
 *
 * <p>Keys are hashed to a 64-bit id ({@link AdvisoryKeyHasher}). A successful
 * claim pins the pooled connection to the lease for its whole lifetime, since
 * the advisory lock belongs to that session.</p>
 *
 * <p>Advisory locks have no server-side TTL. The lease TTL is enforced by a
 * local best-effort watchdog only, and {@link Lease#extend} cannot prove
 * continued ownership: if the pinned connection drops, Postgres releases the
 * lock and the client does not find out until its next statement fails.</p>
 */
public class PostgresAdvisoryLock extends AbstractPollingLock {

    public static final String BACKEND = "postgres";

    static final String TRY_LOCK_SQL = "SELECT pg_try_advisory_lock(?)";
    static final String UNLOCK_SQL = "SELECT pg_advisory_unlock(?)";

    private final ConnectionPool pool;
    private final AdvisoryKeyHasher hasher;
    private final LeaseWatchdog watchdog;

    public PostgresAdvisoryLock(ConnectionPool pool, LockConfig config) {
        this(pool, config, LockDependencies.defaults(), Sha256AdvisoryKeyHasher.INSTANCE, LeaseWatchdog.shared());
    }

    public PostgresAdvisoryLock(ConnectionPool pool, LockConfig config, LockDependencies dependencies,
                                AdvisoryKeyHasher hasher, LeaseWatchdog watchdog) {
        super(BACKEND, config, dependencies);
        this.pool = Objects.requireNonNull(pool, "pool");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.watchdog = Objects.requireNonNull(watchdog, "watchdog");
    }

    @Override
    protected Optional<Lease> claim(String key, long ttlMs) {
        long lockId = hasher.hash(key);
        Connection connection = pool.borrow();

        try {
            if (!tryAdvisoryLock(connection, lockId)) {
                pool.release(connection);
                return Optional.empty();
            }
        } catch (SQLException e) {
            pool.release(connection);
            throw new LockBackendException("Failed to acquire advisory lock for key '" + key + "'", e);
        } catch (RuntimeException e) {
            pool.release(connection);
            throw e;
        }

        PostgresAdvisoryLease lease = new PostgresAdvisoryLease(
                key, lockId, connection, pool, watchdog, this::onLeaseReleased);
        try {
            lease.scheduleAutoRelease(ttlMs);
        } catch (RuntimeException e) {
            try {
                lease.abandon();
            } catch (RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        return Optional.of(lease);
    }

    private static boolean tryAdvisoryLock(Connection connection, long lockId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(TRY_LOCK_SQL)) {
            statement.setLong(1, lockId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }
}
