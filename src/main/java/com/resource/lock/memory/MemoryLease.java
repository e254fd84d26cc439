package com.resource.lock.memory;

import com.resource.lock.Lease;
import com.resource.lock.validation.TimeValidation;
import com.resource.lock.watchdog.LeaseWatchdog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Lease handed out by {@link MemoryLock}. Ownership is the identity of this object.
 */
final class MemoryLease implements Lease {
    private static final Logger log = LoggerFactory.getLogger(MemoryLease.class);

    private final String key;
    private final Consumer<MemoryLease> onRelease;
    private final LeaseWatchdog watchdog;
    private final AtomicBoolean released = new AtomicBoolean(false);

    // guarded by this
    private ScheduledFuture<?> ttlTimer;

    MemoryLease(String key, Consumer<MemoryLease> onRelease, LeaseWatchdog watchdog) {
        this.key = key;
        this.onRelease = onRelease;
        this.watchdog = watchdog;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }

        clearTtlTimer();
        try {
            onRelease.accept(this);
        } catch (RuntimeException e) {
            log.debug("In-memory release callback failed for {}: {}", key, e.getMessage());
        }
    }

    @Override
    public boolean extend(Duration ttl) {
        if (released.get()) {
            return false;
        }
        long ttlMs = TimeValidation.requirePositiveMillis(ttl, "ttl for lock " + key);

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

    @Override
    public String toString() {
        return "MemoryLease{key='" + key + "', released=" + released.get() + '}';
    }
}
