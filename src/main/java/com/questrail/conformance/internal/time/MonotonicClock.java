package com.questrail.conformance.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Tick source for {@code expectEvent} and {@code expectReturn} deadlines.
 *
 * <h2>Deadlines</h2>
 * The observation queue derives each wait's deadline from this clock and also
 * bounds the wait by the timeout measured in real time. A test may therefore
 * inject a clock that stands still or is stepped by hand; it can shorten a wait
 * but never lengthen it.
 */
@FunctionalInterface
public interface MonotonicClock
{
    /**
     * Current tick in nanoseconds. Only differences between two readings mean
     * anything.
     */
    long nowNanos();
}
