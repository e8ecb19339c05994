package com.questrail.conformance.model;

import java.time.Instant;

/**
 * An event that fired on the system under test.
 */
public final class AvailableEvent extends Observation.Base implements Observation
{
    public AvailableEvent(MemberDescriptor event, Object target, Object[] arguments, Instant timestamp) {
        super(event, target, arguments, timestamp);
        if (event.kind() != MemberDescriptor.Kind.EVENT) {
            throw new IllegalArgumentException(event + " is not an event");
        }
    }

    @Override
    public String toString() {
        return describe("event");
    }
}
