package com.resource.lock.polling;

import com.resource.lock.time.CancellationSignal;
import com.resource.lock.time.Clock;
import com.resource.lock.time.Sleeper;
import com.resource.lock.validation.TimeValidation;

/**
 * Retries an attempt at a fixed interval until it yields a value, the deadline
 * passes, or the caller cancels.
 *
 * <p>The deadline is computed once on entry. Each iteration checks, in order:
 * cancellation, deadline, then runs the attempt. Exceptions thrown by the
 * attempt abort the loop and propagate unchanged.</p>
 *
 * <p>If the sleeping thread is interrupted the interrupt status is restored and
 * the loop reports {@link PollResult.Outcome#ABORTED}.</p>
 */
public final class PollUntil {

    private PollUntil() {
    }

    public static <T> PollResult<T> pollUntil(PollAttempt<T> attempt, Clock clock, Sleeper sleeper,
                                              PollOptions options) {
        long timeoutMs = TimeValidation.requireNonNegativeMillis(options.timeout(), "timeoutMs");
        long pollMs = TimeValidation.requirePositiveMillis(options.pollInterval(), "pollMs");
        CancellationSignal signal = options.signal();

        long deadline;
        try {
            deadline = Math.addExact(clock.nowMs(), timeoutMs);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("timeoutMs must be a finite duration, got: " + options.timeout(), e);
        }

        while (true) {
            if (signal != null && signal.isCancelled()) {
                return PollResult.aborted();
            }
            if (clock.nowMs() >= deadline) {
                return PollResult.timedOut();
            }

            T value = attempt.attempt();
            if (value != null) {
                return PollResult.success(value);
            }

            try {
                sleeper.sleep(pollMs, signal);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return PollResult.aborted();
            }
        }
    }
}
