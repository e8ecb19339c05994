package com.questrail.conformance.internal.time;

/**
 * The clock every {@code DefaultTestManager} uses unless a test injects its own.
 *
 * <p>Reads {@link System#nanoTime()}, so expectation timeouts are unaffected by
 * the host adjusting its calendar time while a test case waits.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
