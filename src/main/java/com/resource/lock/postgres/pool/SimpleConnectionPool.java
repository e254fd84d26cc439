package com.resource.lock.postgres.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe connection pool using {@link Semaphore} for flow control
 * and {@link ConcurrentLinkedDeque} for idle connection management.
 *
 * <p>Connections are handed out exclusively: advisory locks live in the
 * session, so a borrowed connection must never be shared.</p>
 */
public class SimpleConnectionPool implements ConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(SimpleConnectionPool.class);

    private final PoolConfig config;
    private final ConnectionFactory factory;
    private final Semaphore permits;
    private final ConcurrentLinkedDeque<Connection> idleConnections = new ConcurrentLinkedDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong totalBorrowed = new AtomicLong(0);
    private final AtomicLong totalReleased = new AtomicLong(0);
    private final AtomicLong totalCreated = new AtomicLong(0);

    public SimpleConnectionPool(PoolConfig config) {
        this(config, ConnectionFactory.fromConfig(config));
    }

    public SimpleConnectionPool(PoolConfig config, ConnectionFactory factory) {
        this.config = config;
        this.factory = factory;
        this.permits = new Semaphore(config.getMaxTotal(), true);

        // Pre-create minIdle connections
        for (int i = 0; i < config.getMinIdle(); i++) {
            try {
                idleConnections.addLast(createConnection());
            } catch (IllegalStateException e) {
                log.warn("Failed to pre-create connection {}/{}: {}",
                        i + 1, config.getMinIdle(), e.getMessage());
            }
        }

        log.info("Connection pool initialized: {}", config);
    }

    @Override
    public Connection borrow() {
        if (closed.get()) {
            throw new IllegalStateException("Pool is closed");
        }

        try {
            if (!permits.tryAcquire(config.getMaxWaitMillis(), TimeUnit.MILLISECONDS)) {
                throw new IllegalStateException(
                        "Timeout waiting for connection (maxWait=" + config.getMaxWaitMillis() + "ms)");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for connection", e);
        }

        try {
            Connection conn = idleConnections.pollFirst();
            if (conn != null) {
                if (config.isTestOnBorrow() && !isUsable(conn)) {
                    log.debug("Idle connection failed validation, creating new one");
                    closeQuietly(conn);
                    conn = createConnection();
                }
            } else {
                conn = createConnection();
            }

            totalBorrowed.incrementAndGet();
            log.debug("Connection borrowed (active={}, idle={})",
                    getActiveCount(), idleConnections.size());
            return conn;
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    @Override
    public void release(Connection connection) {
        if (connection == null) {
            return;
        }

        totalReleased.incrementAndGet();

        if (closed.get() || idleConnections.size() >= config.getMaxIdle() || isClosed(connection)) {
            closeQuietly(connection);
        } else {
            idleConnections.addLast(connection);
        }

        permits.release();
        log.debug("Connection released (active={}, idle={})",
                getActiveCount(), idleConnections.size());
    }

    @Override
    public void invalidate(Connection connection) {
        if (connection == null) {
            return;
        }

        totalReleased.incrementAndGet();
        closeQuietly(connection);
        permits.release();
        log.debug("Connection invalidated (active={}, idle={})",
                getActiveCount(), idleConnections.size());
    }

    @Override
    public PoolStats getStats() {
        int idle = idleConnections.size();
        int active = getActiveCount();
        return new PoolStats(
                active + idle,
                active,
                idle,
                totalBorrowed.get(),
                totalReleased.get(),
                totalCreated.get()
        );
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing connection pool...");
            Connection conn;
            while ((conn = idleConnections.pollFirst()) != null) {
                closeQuietly(conn);
            }
            log.info("Connection pool closed");
        }
    }

    private Connection createConnection() {
        try {
            Connection conn = factory.create();
            totalCreated.incrementAndGet();
            return conn;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to open connection: " + e.getMessage(), e);
        }
    }

    // idle connections hold no permit
    private int getActiveCount() {
        return config.getMaxTotal() - permits.availablePermits();
    }

    private boolean isUsable(Connection connection) {
        try {
            return connection.isValid(config.getValidationTimeoutSeconds());
        } catch (SQLException e) {
            return false;
        }
    }

    private boolean isClosed(Connection connection) {
        try {
            return connection.isClosed();
        } catch (SQLException e) {
            return true;
        }
    }

    private void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (Exception e) {
            log.warn("Error closing connection: {}", e.getMessage());
        }
    }
}
