package com.resource.lock.validation;

import java.time.Duration;

/**
 * Fail-fast checks for the durations accepted by the lock API.
 *
 * <p>A duration is <em>finite</em> when it can be expressed in milliseconds
 * below {@link Long#MAX_VALUE}. Anything larger, for example
 * {@code ChronoUnit.FOREVER.getDuration()}, is treated as unbounded and
 * rejected. All checks throw {@link IllegalArgumentException} and never clamp.</p>
 */
public final class TimeValidation {

    private TimeValidation() {
    }

    /**
     * Validates that {@code value} is finite and returns it in milliseconds.
     */
    public static long requireFiniteMillis(Duration value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must be a finite duration, got: null");
        }
        long millis;
        try {
            millis = value.toMillis();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(name + " must be a finite duration, got: " + value, e);
        }
        if (millis == Long.MAX_VALUE || millis == Long.MIN_VALUE) {
            throw new IllegalArgumentException(name + " must be a finite duration, got: " + value);
        }
        return millis;
    }

    /**
     * Validates that {@code value} is finite and {@code >= 0}; returns milliseconds.
     */
    public static long requireNonNegativeMillis(Duration value, String name) {
        long millis = requireFiniteMillis(value, name);
        if (millis < 0) {
            throw new IllegalArgumentException(name + " must be non-negative, got: " + value);
        }
        return millis;
    }

    /**
     * Validates that {@code value} is finite and {@code > 0}; returns milliseconds.
     */
    public static long requirePositiveMillis(Duration value, String name) {
        long millis = requireFiniteMillis(value, name);
        if (millis <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, got: " + value);
        }
        return millis;
    }
}
