package com.resource.lock;

import com.resource.lock.validation.TimeValidation;

import java.time.Duration;

/**
 * Configuration shared by all lock implementations.
 *
 * @param defaultTimeout timeout used by {@code acquire} when none is given; {@code >= 0}
 * @param pollInterval   delay between acquisition attempts while waiting; {@code > 0}
 */
public record LockConfig(Duration defaultTimeout, Duration pollInterval) {

    public LockConfig {
        TimeValidation.requireNonNegativeMillis(defaultTimeout, "defaultTimeout");
        TimeValidation.requirePositiveMillis(pollInterval, "pollInterval");
    }

    /**
     * Default configuration: 5s timeout, 50ms poll interval.
     */
    public static LockConfig defaults() {
        return new LockConfig(Duration.ofSeconds(5), Duration.ofMillis(50));
    }
}
