package com.resource.lock.time;

import java.util.concurrent.TimeUnit;

/**
 * Default {@link Sleeper}: parks on the signal when one is given, otherwise
 * falls back to {@link Thread#sleep(long)}.
 */
public final class SystemSleeper implements Sleeper {

    private static final SystemSleeper INSTANCE = new SystemSleeper();

    public static SystemSleeper instance() {
        return INSTANCE;
    }

    @Override
    public void sleep(long millis, CancellationSignal signal) throws InterruptedException {
        if (millis <= 0) {
            return;
        }
        if (signal == null) {
            Thread.sleep(millis);
            return;
        }
        if (signal.isCancelled()) {
            return;
        }
        signal.await(millis, TimeUnit.MILLISECONDS);
    }
}
