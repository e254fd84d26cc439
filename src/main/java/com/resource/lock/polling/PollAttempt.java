package com.resource.lock.polling;

/**
 * A single attempt driven by {@link PollUntil}.
 *
 * @param <T> the value produced on success
 */
@FunctionalInterface
public interface PollAttempt<T> {

    /**
     * @return the value, or {@code null} when there is nothing yet and the loop should retry
     */
    T attempt();
}
