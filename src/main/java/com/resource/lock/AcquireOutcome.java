package com.resource.lock;

/**
 * How a call to {@link Lock#acquire} ended.
 */
public enum AcquireOutcome {
    ACQUIRED,
    TIMED_OUT,
    CANCELLED
}
