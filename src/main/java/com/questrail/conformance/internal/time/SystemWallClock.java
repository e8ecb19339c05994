package com.questrail.conformance.internal.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * {@link WallClock} over {@link Instant#now()}.
 *
 * <p>Its readings travel with each observation into the
 * {@code ObservationEvent}s the oracle publishes, where they let a reader line
 * up queued observations with the adapter's own log.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
