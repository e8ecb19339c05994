package com.questrail.conformance.internal.time;

import java.time.Instant;

/**
 * Stamps each {@code AvailableEvent} and {@code AvailableReturn} with the moment
 * the adapter reported it, and dates observability events.
 *
 * <p>Observation deadlines never read this clock.</p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
