package com.resource.lock.watchdog;

import com.resource.lock.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Schedules local TTL expiry callbacks for leases.
 *
 * <p>Runs on daemon threads so a pending expiry never keeps the JVM alive.
 * Cancelled expiries are removed from the queue immediately. The scheduler
 * thread only triggers expiries; callbacks run on a separate worker pool, so a
 * release blocked on I/O cannot delay the expiry of any other lease. A
 * callback that throws is logged and dropped.</p>
 */
public final class LeaseWatchdog implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LeaseWatchdog.class);

    private static final long WORKER_KEEP_ALIVE_SECONDS = 30;

    private static final LeaseWatchdog SHARED = new LeaseWatchdog("lease-watchdog");

    private final ScheduledThreadPoolExecutor scheduler;
    private final ThreadPoolExecutor workers;

    public LeaseWatchdog(String threadNamePrefix) {
        this.scheduler = new ScheduledThreadPoolExecutor(1, daemonThreads(threadNamePrefix));
        this.scheduler.setRemoveOnCancelPolicy(true);
        this.scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.workers = new ThreadPoolExecutor(0, Integer.MAX_VALUE,
                WORKER_KEEP_ALIVE_SECONDS, TimeUnit.SECONDS, new SynchronousQueue<>(),
                daemonThreads(threadNamePrefix + "-release"));
    }

    /**
     * Process-wide watchdog used by adapters that are not given one explicitly.
     */
    public static LeaseWatchdog shared() {
        return SHARED;
    }

    /**
     * Arms an expiry for {@code key} that runs {@code onExpiry} after {@code delayMs}.
     *
     * @return handle used to disarm the expiry
     * @throws RejectedExecutionException if this watchdog has been closed
     */
    public ScheduledFuture<?> arm(String key, long delayMs, Runnable onExpiry) {
        return scheduler.schedule(() -> dispatch(key, onExpiry), delayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Number of expiries currently armed.
     */
    public int pendingCount() {
        return scheduler.getQueue().size();
    }

    @Override
    public void close() {
        if (this == SHARED) {
            return;
        }
        scheduler.shutdownNow();
        workers.shutdownNow();
    }

    private void dispatch(String key, Runnable onExpiry) {
        try {
            workers.execute(() -> runExpiry(key, onExpiry));
        } catch (RejectedExecutionException e) {
            log.warn("Watchdog closed, expiry for {} dropped", key);
        }
    }

    private static void runExpiry(String key, Runnable onExpiry) {
        try (LogContext ignored = LogContext.forWatchdog(key)) {
            log.debug("Lease TTL elapsed, releasing: {}", key);
            onExpiry.run();
        } catch (Exception e) {
            log.warn("Watchdog release failed for {}: {}", key, e.getMessage(), e);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
