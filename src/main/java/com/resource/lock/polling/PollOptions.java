package com.resource.lock.polling;

import com.resource.lock.time.CancellationSignal;

import java.time.Duration;

/**
 * Options for {@link PollUntil#pollUntil}.
 *
 * @param pollInterval delay between attempts, must be finite and {@code > 0}
 * @param timeout      total budget, must be finite and {@code >= 0}
 * @param signal       optional cancellation signal, may be {@code null}
 */
public record PollOptions(Duration pollInterval, Duration timeout, CancellationSignal signal) {

    public PollOptions(Duration pollInterval, Duration timeout) {
        this(pollInterval, timeout, null);
    }
}
