package com.resource.lock.metrics;

import com.resource.lock.AcquireOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link LockMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code lock.attempts}: counter (tags: backend, result = acquired|contended)</li>
 *   <li>{@code lock.acquire.wait}: timer (tags: backend, outcome)</li>
 *   <li>{@code lock.released}: counter (tag: backend)</li>
 * </ul>
 */
public class MicrometerLockMetrics implements LockMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerLockMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordAttempt(String backend, boolean acquired) {
        String result = acquired ? "acquired" : "contended";
        Counter counter = counterCache.computeIfAbsent("attempt:" + backend + ":" + result, k ->
                Counter.builder("lock.attempts")
                        .description("Number of atomic lock claim attempts")
                        .tag("backend", backend)
                        .tag("result", result)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordAcquire(String backend, AcquireOutcome outcome, Duration waited) {
        Timer timer = timerCache.computeIfAbsent(backend + ":" + outcome.name(), k ->
                Timer.builder("lock.acquire.wait")
                        .description("Time spent in acquire before it returned")
                        .tag("backend", backend)
                        .tag("outcome", outcome.name())
                        .register(registry));
        timer.record(waited);
    }

    @Override
    public void recordRelease(String backend) {
        Counter counter = counterCache.computeIfAbsent("released:" + backend, k ->
                Counter.builder("lock.released")
                        .description("Number of leases released")
                        .tag("backend", backend)
                        .register(registry));
        counter.increment();
    }
}
