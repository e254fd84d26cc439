package com.resource.lock.memory;

import com.resource.lock.AbstractPollingLock;
import com.resource.lock.Lease;
import com.resource.lock.LockConfig;
import com.resource.lock.LockDependencies;
import com.resource.lock.watchdog.LeaseWatchdog;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process lock. Keys are scoped to this instance and vanish with it;
 * there is no cross-process guarantee.
 *
 * <p>The held-lock table is only mutated through atomic map operations:
 * {@code putIfAbsent} to claim and {@code remove(key, lease)} to release. The
 * second form compares by identity, so a late release of an expired lease
 * cannot evict a newer holder.</p>
 */
public class MemoryLock extends AbstractPollingLock {

    public static final String BACKEND = "memory";

    private final ConcurrentHashMap<String, MemoryLease> locks = new ConcurrentHashMap<>();
    private final LeaseWatchdog watchdog;

    public MemoryLock() {
        this(LockConfig.defaults());
    }

    public MemoryLock(LockConfig config) {
        this(config, LockDependencies.defaults(), LeaseWatchdog.shared());
    }

    public MemoryLock(LockConfig config, LockDependencies dependencies, LeaseWatchdog watchdog) {
        super(BACKEND, config, dependencies);
        this.watchdog = watchdog;
    }

    @Override
    protected Optional<Lease> claim(String key, long ttlMs) {
        MemoryLease lease = new MemoryLease(key, this::evict, watchdog);
        if (locks.putIfAbsent(key, lease) != null) {
            return Optional.empty();
        }
        try {
            lease.scheduleAutoRelease(ttlMs);
        } catch (RuntimeException e) {
            locks.remove(key, lease);
            throw e;
        }
        return Optional.of(lease);
    }

    /**
     * Snapshot of the keys currently held through this instance.
     */
    public Set<String> heldKeys() {
        return Set.copyOf(locks.keySet());
    }

    private void evict(MemoryLease lease) {
        if (locks.remove(lease.key(), lease)) {
            onLeaseReleased(lease);
        }
    }
}
