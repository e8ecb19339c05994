package com.questrail.conformance.api;

import com.questrail.conformance.expect.ExpectedEvent;
import com.questrail.conformance.expect.ExpectedPreConstraint;
import com.questrail.conformance.expect.ExpectedReturn;
import com.questrail.conformance.model.AvailableEvent;
import com.questrail.conformance.model.AvailableReturn;
import com.questrail.conformance.model.MemberDescriptor;

import java.time.Duration;
import java.util.List;

/**
 * TestManager
 * =============================================================================
 * The entry point a generated test case talks to while it runs.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Collect observations of events and method returns from adapter-side
 *       producers, on any thread</li>
 *   <li>Match them, in arrival order, against expected patterns on the test
 *       thread</li>
 *   <li>Buffer the assertions and bindings a checker makes until the match is
 *       confirmed, and discard them otherwise</li>
 *   <li>Forward verdicts to the {@link ReportingSink}</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * {@link #addEvent} and {@link #addReturn} are safe from any thread. Every other
 * operation belongs to the single test-execution thread.
 *
 * <h2>Return values of expectations</h2>
 * Expectation operations return the 0-based index of the accepting pattern, or
 * {@code -1} when none accepted and {@code failIfNone} is {@code false}. With
 * {@code failIfNone} set, an unmet expectation is reported as a failure and,
 * unless the manager throws {@link TestFailureException}, {@code -1} is
 * returned.
 */
public interface TestManager
{
    /**
     * @throws IllegalStateException if no adapter is registered for the type
     */
    <T> T getAdapter(Class<T> adapterType);

    /**
     * Routes occurrences of an event on the target into the event queue.
     * Subscribing again for the same event and target type rebinds the stored
     * handler instead of attaching a second one.
     *
     * @param target the instance raising the event, or {@code null} for static
     *               and adapter-scoped events
     */
    void subscribe(MemberDescriptor event, Object target, EventHookup hookup);

    /**
     * Queues an event occurrence.
     *
     * @return {@code false} if the event queue is full and the occurrence was dropped
     */
    boolean addEvent(MemberDescriptor event, Object target, Object... arguments);

    /**
     * Queues a method or constructor return; the arguments are the output
     * parameters followed by the return value, if any.
     *
     * @return {@code false} if the return queue is full and the occurrence was dropped
     */
    boolean addReturn(MemberDescriptor method, Object target, Object... arguments);

    int expectEvent(Duration timeout, boolean failIfNone, ExpectedEvent... expected);

    /**
     * Same as {@link #expectEvent(Duration, boolean, ExpectedEvent...)} with the
     * configured default timeout.
     */
    int expectEvent(boolean failIfNone, ExpectedEvent... expected);

    int expectReturn(Duration timeout, boolean failIfNone, ExpectedReturn... expected);

    int expectReturn(boolean failIfNone, ExpectedReturn... expected);

    /**
     * Handles an expectation that timed out. In an accepting state with no
     * pending events this only logs the expected events; otherwise it reports a
     * failure listing the expected events and the events still queued.
     */
    void checkObservationTimeout(boolean isAcceptingState, ExpectedEvent... expected);

    /**
     * Returns the index of the first pre-constraint whose checker completes, or
     * {@code -1}. The selected checker's transaction is committed.
     *
     * @param printDiagnosisIfFail whether to comment why every constraint failed
     */
    int selectSatisfiedPreConstraint(boolean printDiagnosisIfFail, ExpectedPreConstraint... expected);

    <T> Variable<T> createVariable(String name, Class<T> type);

    /**
     * Returns the default value of a type: zero for numbers, {@code false},
     * {@code '\0'}, the empty string, or {@code null}.
     */
    <T> T generateValue(Class<T> type);

    /**
     * @throws IllegalStateException if a transaction is already active
     */
    void beginTransaction();

    /**
     * @throws IllegalStateException if no transaction is active
     */
    void endTransaction(boolean commit);

    void assertTrue(boolean condition, String description);

    void assume(boolean condition, String description);

    void checkpoint(String description);

    void comment(String description);

    void beginTest(String name);

    void endTest();

    /**
     * Unconsumed events in arrival order.
     */
    List<AvailableEvent> pendingEvents();

    /**
     * Unconsumed returns in arrival order.
     */
    List<AvailableReturn> pendingReturns();
}
