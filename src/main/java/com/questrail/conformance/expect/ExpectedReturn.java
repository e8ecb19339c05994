package com.questrail.conformance.expect;

import com.questrail.conformance.model.AvailableReturn;
import com.questrail.conformance.model.Checker;
import com.questrail.conformance.model.MemberDescriptor;

/**
 * Pattern for a method or constructor expected to return.
 */
public final class ExpectedReturn extends ExpectedObservation<AvailableReturn>
{
    public ExpectedReturn(MemberDescriptor method, Object target, Checker checker) {
        super(method, target, checker);
        if (method.kind() == MemberDescriptor.Kind.EVENT) {
            throw new IllegalArgumentException(method + " is an event, not a method");
        }
    }

    public static ExpectedReturn of(MemberDescriptor method) {
        return new ExpectedReturn(method, null, null);
    }

    public static ExpectedReturn of(MemberDescriptor method, Checker checker) {
        return new ExpectedReturn(method, null, checker);
    }

    public static ExpectedReturn on(MemberDescriptor method, Object target, Checker checker) {
        return new ExpectedReturn(method, target, checker);
    }

    @Override
    public String toString() {
        return describe("return");
    }
}
