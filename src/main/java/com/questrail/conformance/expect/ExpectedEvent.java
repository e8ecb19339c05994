package com.questrail.conformance.expect;

import com.questrail.conformance.model.AvailableEvent;
import com.questrail.conformance.model.Checker;
import com.questrail.conformance.model.MemberDescriptor;

/**
 * Pattern for an event expected to fire.
 */
public final class ExpectedEvent extends ExpectedObservation<AvailableEvent>
{
    public ExpectedEvent(MemberDescriptor event, Object target, Checker checker) {
        super(event, target, checker);
        if (event.kind() != MemberDescriptor.Kind.EVENT) {
            throw new IllegalArgumentException(event + " is not an event");
        }
    }

    public static ExpectedEvent of(MemberDescriptor event) {
        return new ExpectedEvent(event, null, null);
    }

    public static ExpectedEvent of(MemberDescriptor event, Checker checker) {
        return new ExpectedEvent(event, null, checker);
    }

    public static ExpectedEvent on(MemberDescriptor event, Object target, Checker checker) {
        return new ExpectedEvent(event, target, checker);
    }

    @Override
    public String toString() {
        return describe("event");
    }
}
