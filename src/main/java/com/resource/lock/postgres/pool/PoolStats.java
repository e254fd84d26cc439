package com.resource.lock.postgres.pool;

/**
 * Statistics for a {@link ConnectionPool}.
 *
 * @param totalConnections  total number of managed connections (active + idle)
 * @param activeConnections connections currently borrowed
 * @param idleConnections   connections available for borrowing
 * @param totalBorrowed     cumulative borrow count since pool creation
 * @param totalReleased     cumulative release count, including invalidations
 * @param totalCreated      cumulative connection creation count
 */
public record PoolStats(
        int totalConnections,
        int activeConnections,
        int idleConnections,
        long totalBorrowed,
        long totalReleased,
        long totalCreated
) {
}
