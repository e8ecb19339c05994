package com.questrail.conformance.api;

/**
 * ReportingSink
 * -----------------------------------------------------------------------------
 * The destination for test verdicts and log entries of a running test case.
 *
 * <p>The oracle never decides how a failure is surfaced to the test framework;
 * it only forwards assertions, assumptions, checkpoints and comments here, either
 * immediately or, for calls made while a transaction is active, when the
 * transaction is committed.</p>
 *
 * <h2>Local evaluation</h2>
 * {@link #isTrue(boolean, String)} is consulted while a transaction is active to
 * decide whether an assertion holds, without producing a report. Sinks that
 * interpret conditions differently (for example, treating some failures as
 * warnings) may override it.
 */
public interface ReportingSink
{
    void assertTrue(boolean condition, String description);

    void assume(boolean condition, String description);

    void checkpoint(String description);

    void comment(String description);

    void beginTest(String name);

    void endTest();

    /**
     * Evaluates a condition locally, producing no report.
     *
     * @return {@code true} if the assertion described holds
     */
    default boolean isTrue(boolean condition, String description) {
        return condition;
    }
}
