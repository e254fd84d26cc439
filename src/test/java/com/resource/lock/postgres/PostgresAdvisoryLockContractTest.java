package com.resource.lock.postgres;

import com.resource.lock.Lease;
import com.resource.lock.Lock;
import com.resource.lock.LockConfig;
import com.resource.lock.LockContract;
import com.resource.lock.postgres.pool.PoolConfig;
import com.resource.lock.postgres.pool.SimpleConnectionPool;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the shared lock behavior against a real Postgres server.
 * Requires Docker; skipped when it is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
@Tag("integration")
@DisplayName("PostgresAdvisoryLock contract")
class PostgresAdvisoryLockContractTest extends LockContract {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private static SimpleConnectionPool pool;

    @BeforeAll
    static void createPool() {
        pool = new SimpleConnectionPool(PoolConfig.builder()
                .jdbcUrl(POSTGRES.getJdbcUrl())
                .username(POSTGRES.getUsername())
                .password(POSTGRES.getPassword())
                .maxTotal(10)
                .maxIdle(10)
                .build());
    }

    @AfterAll
    static void closePool() {
        if (pool != null) {
            pool.close();
        }
    }

    @Override
    protected Lock createLock(LockConfig config) {
        return new PostgresAdvisoryLock(pool, config);
    }

    @Test
    @DisplayName("Held lock is visible to other Postgres clients under the hashed id")
    void interoperatesWithOtherClients() throws SQLException {
        String key = uniqueKey("interop");
        long lockId = Sha256AdvisoryKeyHasher.INSTANCE.hash(key);
        Lease lease = lock().tryAcquire(key, TTL).orElseThrow();

        try (Connection other = DriverManager.getConnection(
                POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword())) {
            assertFalse(tryAdvisoryLock(other, lockId));

            lease.release();

            assertTrue(tryAdvisoryLock(other, lockId));
            unlock(other, lockId);
        }
    }

    @Test
    @DisplayName("Held leases do not exhaust the pool once released")
    void connectionsReturnToPool() {
        for (int i = 0; i < 25; i++) {
            Lease lease = lock().tryAcquire(uniqueKey("cycle"), Duration.ofSeconds(5)).orElseThrow();
            lease.release();
        }
        assertEquals(0, pool.getStats().activeConnections());
    }

    private static boolean tryAdvisoryLock(Connection connection, long lockId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_try_advisory_lock(?)")) {
            statement.setLong(1, lockId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    private static void unlock(Connection connection, long lockId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, lockId);
            statement.executeQuery().close();
        }
    }
}
