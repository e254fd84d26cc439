package com.resource.lock;

import com.resource.lock.logging.LogContext;
import com.resource.lock.polling.PollOptions;
import com.resource.lock.polling.PollResult;
import com.resource.lock.polling.PollUntil;
import com.resource.lock.time.CancellationSignal;
import com.resource.lock.time.Clock;
import com.resource.lock.validation.TimeValidation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class holding the acquisition algorithm shared by every backend.
 *
 * <p>Subclasses implement only {@link #claim(String, long)}, the backend's
 * atomic claim-if-free primitive. Argument validation happens here, before
 * {@code claim} is ever called, so invalid input never reaches the backend.</p>
 */
public abstract class AbstractPollingLock implements Lock {
    private static final Logger log = LoggerFactory.getLogger(AbstractPollingLock.class);

    private final String backend;
    private final LockConfig config;
    private final LockDependencies dependencies;

    protected AbstractPollingLock(String backend, LockConfig config, LockDependencies dependencies) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.config = Objects.requireNonNull(config, "config");
        this.dependencies = Objects.requireNonNull(dependencies, "dependencies");
    }

    @Override
    public final Optional<Lease> tryAcquire(String key, Duration ttl) {
        Objects.requireNonNull(key, "key");
        long ttlMs = TimeValidation.requirePositiveMillis(ttl, "ttl for lock " + key);

        Optional<Lease> lease = claim(key, ttlMs);
        dependencies.metrics().recordAttempt(backend, lease.isPresent());
        if (lease.isPresent()) {
            log.debug("Lock acquired: {} (backend={}, ttlMs={})", key, backend, ttlMs);
        }
        return lease;
    }

    @Override
    public final Optional<Lease> acquire(String key, AcquireOptions options) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(options, "options");

        CancellationSignal signal = options.signal();
        if (signal != null && signal.isCancelled()) {
            dependencies.metrics().recordAcquire(backend, AcquireOutcome.CANCELLED, Duration.ZERO);
            return Optional.empty();
        }

        Duration timeout = options.timeout() != null ? options.timeout() : config.defaultTimeout();
        long timeoutMs = TimeValidation.requireNonNegativeMillis(timeout, "acquire timeoutMs");

        if (timeoutMs == 0) {
            Optional<Lease> lease = tryAcquire(key, options.ttl());
            dependencies.metrics().recordAcquire(backend,
                    lease.isPresent() ? AcquireOutcome.ACQUIRED : AcquireOutcome.TIMED_OUT, Duration.ZERO);
            return lease;
        }

        Clock clock = dependencies.clock();
        long start = clock.nowMs();
        PollResult<Lease> result;
        try (LogContext ignored = LogContext.forAcquire(key, backend)) {
            log.debug("Waiting for lock: {} (timeoutMs={}, pollMs={})",
                    key, timeoutMs, config.pollInterval().toMillis());
            result = PollUntil.pollUntil(
                    () -> tryAcquire(key, options.ttl()).orElse(null),
                    clock,
                    dependencies.sleeper(),
                    new PollOptions(config.pollInterval(), timeout, signal));
        }

        AcquireOutcome outcome = toOutcome(result.outcome());
        dependencies.metrics().recordAcquire(backend, outcome, Duration.ofMillis(clock.nowMs() - start));
        if (outcome != AcquireOutcome.ACQUIRED) {
            log.debug("Lock not acquired: {} ({})", key, outcome);
        }
        return result.toOptional();
    }

    /**
     * Atomically claims {@code key} if nobody holds it.
     *
     * @param key   the lock key
     * @param ttlMs validated lease lifetime in milliseconds
     * @return the new lease, or empty if the key is held
     */
    protected abstract Optional<Lease> claim(String key, long ttlMs);

    /**
     * Called by leases of this lock when they leave the held state.
     */
    protected void onLeaseReleased(Lease lease) {
        dependencies.metrics().recordRelease(backend);
        log.debug("Lock released: {} (backend={})", lease.key(), backend);
    }

    public String backend() {
        return backend;
    }

    public LockConfig config() {
        return config;
    }

    protected LockDependencies dependencies() {
        return dependencies;
    }

    private static AcquireOutcome toOutcome(PollResult.Outcome outcome) {
        switch (outcome) {
            case SUCCESS:
                return AcquireOutcome.ACQUIRED;
            case ABORTED:
                return AcquireOutcome.CANCELLED;
            default:
                return AcquireOutcome.TIMED_OUT;
        }
    }
}
