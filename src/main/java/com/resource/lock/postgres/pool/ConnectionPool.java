package com.resource.lock.postgres.pool;

import java.sql.Connection;

/**
 * Connection pool for JDBC {@link Connection}s.
 * Provides borrow/release semantics for safe concurrent access to Postgres.
 */
public interface ConnectionPool extends AutoCloseable {

    /**
     * Borrows a connection from the pool. Blocks until a connection is available
     * or the configured timeout expires.
     *
     * @return a connection
     * @throws IllegalStateException if the pool is closed or timeout expires
     */
    Connection borrow();

    /**
     * Returns a connection to the pool. Closed or broken connections are discarded.
     *
     * @param connection the connection to release
     */
    void release(Connection connection);

    /**
     * Discards a connection whose session state can no longer be trusted,
     * closing it and freeing its slot.
     *
     * @param connection the connection to discard
     */
    void invalidate(Connection connection);

    /**
     * Returns current pool statistics.
     */
    PoolStats getStats();

    /**
     * Closes the pool and all idle connections.
     */
    @Override
    void close();
}
