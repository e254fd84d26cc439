package com.resource.lock.time;

import java.time.Instant;

/**
 * Time source used by the lock adapters and the poll loop.
 * Injectable so that deadline arithmetic can be tested without real waiting.
 */
public interface Clock {

    /**
     * Current wall-clock time. Avoid for arithmetic; prefer {@link #nowMs()}.
     */
    Instant now();

    /**
     * Current time in milliseconds. Only differences between two readings are
     * meaningful; implementations should be monotonic.
     */
    long nowMs();
}
