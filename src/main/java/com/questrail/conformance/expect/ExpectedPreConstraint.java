package com.questrail.conformance.expect;

import java.util.Objects;

/**
 * A standalone condition with no observation attached. Its checker runs with no
 * arguments inside its own transaction and rejects the constraint by failing an
 * assertion or assumption.
 */
public final class ExpectedPreConstraint
{
    private final String description;
    private final Runnable checker;

    public ExpectedPreConstraint(String description, Runnable checker) {
        this.description = Objects.requireNonNull(description, "description");
        this.checker = Objects.requireNonNull(checker, "checker");
    }

    public static ExpectedPreConstraint of(String description, Runnable checker) {
        return new ExpectedPreConstraint(description, checker);
    }

    public String description() {
        return description;
    }

    public Runnable checker() {
        return checker;
    }

    @Override
    public String toString() {
        return "pre-constraint " + description;
    }
}
