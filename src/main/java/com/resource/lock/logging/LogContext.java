package com.resource.lock.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forAcquire("orders:42", "redis")) {
 *     log.debug("lock.waiting timeoutMs={}", timeoutMs);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String LOCK_KEY = "lockKey";
    public static final String BACKEND = "lockBackend";
    public static final String OPERATION = "lockOperation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a blocking acquisition.
     */
    public static LogContext forAcquire(String key, String backend) {
        LogContext ctx = new LogContext();
        ctx.put(LOCK_KEY, key);
        ctx.put(BACKEND, backend);
        ctx.put(OPERATION, "acquire");
        return ctx;
    }

    /**
     * Creates a log context for a watchdog-driven release.
     */
    public static LogContext forWatchdog(String key) {
        LogContext ctx = new LogContext();
        ctx.put(LOCK_KEY, key);
        ctx.put(OPERATION, "watchdog");
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
