package com.questrail.conformance.api;

/**
 * Indicates that a test assertion failed while the test manager was configured
 * to raise failures instead of leaving them to the {@link ReportingSink}.
 *
 * This typically reflects:
 * <ul>
 *   <li>A failed {@code assertTrue} outside of any transaction</li>
 *   <li>An expected observation that did not arrive in time</li>
 *   <li>An observation that none of the expected patterns accepted</li>
 * </ul>
 *
 * The message carries the rendered diagnosis.
 */
public final class TestFailureException extends RuntimeException
{
    public TestFailureException(String message) {
        super(message);
    }

    public TestFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
