package com.resource.lock.time;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * {@link Clock} backed by the JVM. {@link #nowMs()} is derived from
 * {@link System#nanoTime()} and therefore never jumps backwards.
 */
public final class SystemClock implements Clock {

    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public Instant now() {
        return Instant.now();
    }

    @Override
    public long nowMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }
}
