package com.questrail.conformance.model;

import java.time.Instant;

/**
 * A method or constructor of the system under test that returned. The
 * arguments are its output parameters followed by its return value.
 */
public final class AvailableReturn extends Observation.Base implements Observation
{
    public AvailableReturn(MemberDescriptor method, Object target, Object[] arguments, Instant timestamp) {
        super(method, target, arguments, timestamp);
        if (method.kind() == MemberDescriptor.Kind.EVENT) {
            throw new IllegalArgumentException(method + " is an event, not a method");
        }
    }

    @Override
    public String toString() {
        return describe("return");
    }
}
