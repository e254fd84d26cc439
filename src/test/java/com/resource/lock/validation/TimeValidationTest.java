package com.resource.lock.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimeValidation Tests")
class TimeValidationTest {

    @Test
    @DisplayName("Finite durations convert to milliseconds")
    void finiteDurations() {
        assertEquals(0, TimeValidation.requireNonNegativeMillis(Duration.ZERO, "timeoutMs"));
        assertEquals(250, TimeValidation.requireNonNegativeMillis(Duration.ofMillis(250), "timeoutMs"));
        assertEquals(1, TimeValidation.requirePositiveMillis(Duration.ofMillis(1), "ttl"));
    }

    @Test
    @DisplayName("Unbounded durations are rejected")
    void unboundedRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> TimeValidation.requireNonNegativeMillis(ChronoUnit.FOREVER.getDuration(), "timeoutMs"));
        assertTrue(ex.getMessage().contains("timeoutMs"));

        assertThrows(IllegalArgumentException.class,
                () -> TimeValidation.requireFiniteMillis(Duration.ofMillis(Long.MAX_VALUE), "timeoutMs"));
    }

    @Test
    @DisplayName("Negative durations are rejected")
    void negativeRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> TimeValidation.requireNonNegativeMillis(Duration.ofMillis(-1), "timeoutMs"));
        assertTrue(ex.getMessage().contains("non-negative"));
    }

    @Test
    @DisplayName("Zero is not a valid positive duration")
    void zeroNotPositive() {
        assertThrows(IllegalArgumentException.class,
                () -> TimeValidation.requirePositiveMillis(Duration.ZERO, "ttl"));
    }

    @Test
    @DisplayName("Sub-millisecond durations truncate to zero and are not positive")
    void subMillisecondNotPositive() {
        assertThrows(IllegalArgumentException.class,
                () -> TimeValidation.requirePositiveMillis(Duration.ofNanos(500), "ttl"));
    }

    @Test
    @DisplayName("Null is rejected with the parameter name")
    void nullRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> TimeValidation.requirePositiveMillis(null, "ttl"));
        assertTrue(ex.getMessage().startsWith("ttl"));
    }
}
