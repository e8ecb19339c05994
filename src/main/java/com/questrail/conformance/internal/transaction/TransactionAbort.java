package com.questrail.conformance.internal.transaction;

/**
 * Signals that the current matching attempt failed a check and must be rolled
 * back.
 *
 * <p>This is control flow, not a test failure: it unwinds a checker body back
 * to the attempt boundary, where it is converted into a rejected attempt. It
 * never escapes the expectation matcher and carries no stack trace.</p>
 */
public final class TransactionAbort extends RuntimeException
{
    public TransactionAbort(String description) {
        super(description, null, false, false);
    }
}
