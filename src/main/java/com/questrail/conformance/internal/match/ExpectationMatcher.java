package com.questrail.conformance.internal.match;

import com.questrail.conformance.api.ReportingSink;
import com.questrail.conformance.expect.ExpectedObservation;
import com.questrail.conformance.expect.ExpectedPreConstraint;
import com.questrail.conformance.internal.queue.ObservationQueue;
import com.questrail.conformance.internal.time.WallClock;
import com.questrail.conformance.internal.transaction.TransactionAbort;
import com.questrail.conformance.internal.transaction.TransactionLog;
import com.questrail.conformance.model.Observation;
import com.questrail.conformance.observability.ExpectationOutcomeEvent;
import com.questrail.conformance.observability.ObservationEvent;
import com.questrail.conformance.observability.OracleErrorEvent;
import com.questrail.conformance.observability.OracleObservabilitySink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ExpectationMatcher
 * =============================================================================
 * Matches the head of an observation queue against an ordered list of expected
 * patterns, running each candidate's checker inside its own transaction.
 *
 * <h2>Algorithm</h2>
 * <pre>
 *   WaitForObservation ──none──▶ timeout failure | -1
 *          │
 *          ▼
 *   TryEachPattern ──checker completes──▶ Commit, consume, return index
 *          │
 *          ▼ (every pattern rejected or ineligible)
 *   ExhaustedPatterns ──▶ diagnosis failure | -1   (nothing consumed)
 * </pre>
 *
 * <h2>Attempts</h2>
 * An attempt opens a transaction, runs the checker and commits. A
 * {@link TransactionAbort} raised by a failing assertion or assumption is
 * converted into {@link AttemptResult#rejected}; the rolled-back transaction is
 * kept for the diagnosis. Any other exception rolls the transaction back and
 * propagates to the caller.
 *
 * <h2>Threading</h2>
 * Runs on the test-execution thread only. The queue is the sole structure
 * shared with producers.
 */
public final class ExpectationMatcher
{
    /**
     * Reports an unmet expectation. Depending on configuration this either
     * forwards a failed assertion to the reporting sink or throws.
     */
    @FunctionalInterface
    public interface FailureReporter {
        void fail(String message);
    }

    private final TransactionLog log;
    private final ReportingSink sink;
    private final FailureReporter failures;
    private final OracleObservabilitySink observability;
    private final WallClock wallClock;

    public ExpectationMatcher(TransactionLog log,
                              ReportingSink sink,
                              FailureReporter failures,
                              OracleObservabilitySink observability,
                              WallClock wallClock) {
        this.log = Objects.requireNonNull(log, "log");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.failures = Objects.requireNonNull(failures, "failures");
        this.observability = Objects.requireNonNull(observability, "observability");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Waits for the head observation and selects the first pattern accepting it.
     *
     * @param operation      operation name published with the outcome
     * @param noun           {@code "event"} or {@code "return"}, used in the diagnosis
     * @param queue          the queue to match against
     * @param timeout        maximum wait for an observation
     * @param failIfNone     whether an unmet expectation is reported as a failure
     * @param expected       patterns in priority order
     * @param timeoutMessage failure text when no observation arrives in time
     * @return the 0-based index of the accepting pattern, or -1
     */
    public <O extends Observation> int expect(String operation,
                                              String noun,
                                              ObservationQueue<O> queue,
                                              Duration timeout,
                                              boolean failIfNone,
                                              List<? extends ExpectedObservation<O>> expected,
                                              String timeoutMessage) {
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(expected, "expected");

        Optional<O> head = queue.tryGet(timeout, false);
        if (head.isEmpty()) {
            publishOutcome(operation, -1, expected.size(), null, failIfNone);
            if (failIfNone) {
                failures.fail(timeoutMessage);
            }
            return -1;
        }

        O observation = head.get();
        List<PatternOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < expected.size(); i++) {
            ExpectedObservation<O> pattern = expected.get(i);
            if (!pattern.matchesIdentity(observation)) {
                outcomes.add(PatternOutcome.identityMismatch(i, pattern));
                continue;
            }
            AttemptResult result = attempt(operation, () -> pattern.check(observation));
            if (result instanceof AttemptResult.Rejected rejected) {
                outcomes.add(PatternOutcome.rejected(i, pattern, rejected.trace()));
                continue;
            }
            consume(queue);
            publishOutcome(operation, i, expected.size(), observation, false);
            return i;
        }

        publishOutcome(operation, -1, expected.size(), observation, failIfNone);
        if (failIfNone) {
            failures.fail(exhaustedDiagnosis(noun, observation, outcomes));
        }
        return -1;
    }

    /**
     * Selects the first pre-constraint whose checker completes.
     *
     * @return the 0-based index of the satisfied constraint, or -1
     */
    public int selectSatisfied(boolean printDiagnosisIfFail, List<ExpectedPreConstraint> constraints) {
        Objects.requireNonNull(constraints, "constraints");
        String operation = "selectSatisfiedPreConstraint";

        List<PatternOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < constraints.size(); i++) {
            ExpectedPreConstraint constraint = constraints.get(i);
            AttemptResult result = attempt(operation, constraint.checker());
            if (result instanceof AttemptResult.Rejected rejected) {
                outcomes.add(PatternOutcome.rejected(i, constraint, rejected.trace()));
                continue;
            }
            publishOutcome(operation, i, constraints.size(), null, false);
            return i;
        }

        String diagnosis = preConstraintDiagnosis(outcomes);
        publishOutcome(operation, -1, constraints.size(), null, printDiagnosisIfFail);
        if (printDiagnosisIfFail) {
            sink.comment(diagnosis);
        }
        return -1;
    }

    private AttemptResult attempt(String operation, Runnable checker) {
        log.begin();
        try {
            checker.run();
        } catch (TransactionAbort abort) {
            return AttemptResult.rejected(log.end(false));
        } catch (RuntimeException | Error e) {
            log.end(false);
            observability.onError(new OracleErrorEvent(wallClock.now(),
                    operation + ": checker threw " + e.getClass().getName(), e));
            throw e;
        }
        log.end(true);
        return AttemptResult.accepted();
    }

    private <O extends Observation> void consume(ObservationQueue<O> queue) {
        Optional<O> consumed = queue.tryGet(Duration.ZERO, true);
        consumed.ifPresent(o -> observability.onObservation(new ObservationEvent(
                wallClock.now(), ObservationEvent.Kind.CONSUMED, o, queue.size())));
    }

    private void publishOutcome(String operation, int index, int count, Observation observation, boolean failed) {
        observability.onExpectationOutcome(new ExpectationOutcomeEvent(
                wallClock.now(), operation, index, count, observation, failed));
    }

    static String exhaustedDiagnosis(String noun, Observation observation, List<PatternOutcome> outcomes) {
        StringBuilder sb = new StringBuilder();
        sb.append("expected matching ").append(noun)
          .append(", found '").append(observation).append("'. Diagnosis:")
          .append(System.lineSeparator());
        for (PatternOutcome outcome : outcomes) {
            outcome.describe(sb);
        }
        return sb.toString();
    }

    static String preConstraintDiagnosis(List<PatternOutcome> outcomes) {
        StringBuilder sb = new StringBuilder("None of the expected pre-constraints are matched.");
        sb.append(System.lineSeparator());
        for (PatternOutcome outcome : outcomes) {
            outcome.describe(sb);
        }
        return sb.toString();
    }
}
