package com.resource.lock.polling;

import java.util.Optional;

/**
 * Outcome of a {@link PollUntil} run.
 *
 * @param outcome how the loop ended
 * @param value   the produced value; only non-null for {@link Outcome#SUCCESS}
 */
public record PollResult<T>(Outcome outcome, T value) {

    public enum Outcome { SUCCESS, TIMED_OUT, ABORTED }

    public static <T> PollResult<T> success(T value) {
        return new PollResult<>(Outcome.SUCCESS, value);
    }

    public static <T> PollResult<T> timedOut() {
        return new PollResult<>(Outcome.TIMED_OUT, null);
    }

    public static <T> PollResult<T> aborted() {
        return new PollResult<>(Outcome.ABORTED, null);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }
}
