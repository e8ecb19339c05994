package com.questrail.conformance.core;

import com.questrail.conformance.api.AdapterLookup;
import com.questrail.conformance.api.EventHookup;
import com.questrail.conformance.api.ReportingSink;
import com.questrail.conformance.api.TestFailureException;
import com.questrail.conformance.api.TestManager;
import com.questrail.conformance.api.Variable;
import com.questrail.conformance.config.TestManagerConfig;
import com.questrail.conformance.expect.ExpectedEvent;
import com.questrail.conformance.expect.ExpectedPreConstraint;
import com.questrail.conformance.expect.ExpectedReturn;
import com.questrail.conformance.internal.match.ExpectationMatcher;
import com.questrail.conformance.internal.queue.ObservationQueue;
import com.questrail.conformance.internal.subscription.SubscriptionRegistry;
import com.questrail.conformance.internal.time.MonotonicClock;
import com.questrail.conformance.internal.time.SystemMonotonicClock;
import com.questrail.conformance.internal.time.SystemWallClock;
import com.questrail.conformance.internal.time.WallClock;
import com.questrail.conformance.internal.transaction.TransactableVariable;
import com.questrail.conformance.internal.transaction.TransactionLog;
import com.questrail.conformance.model.AvailableEvent;
import com.questrail.conformance.model.AvailableReturn;
import com.questrail.conformance.model.MemberDescriptor;
import com.questrail.conformance.model.Observation;
import com.questrail.conformance.observability.NullObservabilitySink;
import com.questrail.conformance.observability.ObservationEvent;
import com.questrail.conformance.observability.OracleObservabilitySink;
import com.questrail.conformance.util.Values;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * DefaultTestManager
 * =============================================================================
 * Composition root and runtime of one test case's oracle.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   producers ──addEvent/addReturn──▶ ObservationQueue (events | returns)
 *                                            │ tryGet (test thread)
 *                                            ▼
 *   expectEvent/expectReturn ──────▶ ExpectationMatcher ──▶ TransactionLog ──▶ ReportingSink
 * </pre>
 *
 * <h2>Failure reporting</h2>
 * Failed assertions outside a transaction and unmet expectations are forwarded
 * to the {@link ReportingSink} as failed assertions, or raised as
 * {@link TestFailureException} when
 * {@link TestManagerConfig#throwTestFailureException()} is set.
 *
 * <h2>Lifecycle</h2>
 * {@link #close()} detaches every subscription. Queued observations are
 * discarded with the instance.
 */
public final class DefaultTestManager implements TestManager, AutoCloseable
{
    private final TestManagerConfig config;
    private final ReportingSink sink;
    private final AdapterLookup adapters;
    private final OracleObservabilitySink observability;
    private final WallClock wallClock;

    private final TransactionLog log;
    private final ExpectationMatcher matcher;
    private final ObservationQueue<AvailableEvent> events;
    private final ObservationQueue<AvailableReturn> returns;
    private final SubscriptionRegistry subscriptions;

    private DefaultTestManager(Builder b) {
        this.config = b.config;
        this.sink = b.reportingSink;
        this.adapters = b.adapterLookup;
        this.observability = b.observabilitySink;
        this.wallClock = b.wallClock;

        this.log = new TransactionLog(sink, observability, wallClock);
        this.matcher = new ExpectationMatcher(log, sink, this::reportFailure, observability, wallClock);
        this.events = new ObservationQueue<>(config.eventQueueCapacity(), b.monotonicClock);
        this.returns = new ObservationQueue<>(config.returnQueueCapacity(), b.monotonicClock);
        this.subscriptions = new SubscriptionRegistry(this::addEvent);
    }

    public static Builder builder() {
        return new Builder();
    }

    public TestManagerConfig config() {
        return config;
    }

    @Override
    public <T> T getAdapter(Class<T> adapterType) {
        Objects.requireNonNull(adapterType, "adapterType");
        return adapters.getAdapter(adapterType);
    }

    // ---------------------------------------------------------------------
    // Producer side
    // ---------------------------------------------------------------------

    @Override
    public void subscribe(MemberDescriptor event, Object target, EventHookup hookup) {
        subscriptions.subscribe(event, target, hookup);
    }

    @Override
    public boolean addEvent(MemberDescriptor event, Object target, Object... arguments) {
        Objects.requireNonNull(arguments, "arguments");
        return enqueue(events, new AvailableEvent(event, target, arguments, wallClock.now()));
    }

    @Override
    public boolean addReturn(MemberDescriptor method, Object target, Object... arguments) {
        Objects.requireNonNull(arguments, "arguments");
        return enqueue(returns, new AvailableReturn(method, target, arguments, wallClock.now()));
    }

    private <O extends Observation> boolean enqueue(ObservationQueue<O> queue, O observation) {
        boolean accepted = queue.add(observation);
        observability.onObservation(new ObservationEvent(
                observation.timestamp(),
                accepted ? ObservationEvent.Kind.QUEUED : ObservationEvent.Kind.DROPPED,
                observation,
                queue.size()));
        return accepted;
    }

    // ---------------------------------------------------------------------
    // Expectations
    // ---------------------------------------------------------------------

    @Override
    public int expectEvent(Duration timeout, boolean failIfNone, ExpectedEvent... expected) {
        Objects.requireNonNull(expected, "expected");
        String timeoutMessage = "Event must occur within " + timeout.toMillis() + "ms"
                + System.lineSeparator() + "Expecting events:"
                + listed(Arrays.asList(expected));
        return matcher.expect("expectEvent", "event", events, timeout, failIfNone,
                List.of(expected), timeoutMessage);
    }

    @Override
    public int expectEvent(boolean failIfNone, ExpectedEvent... expected) {
        return expectEvent(config.defaultExpectationTimeout(), failIfNone, expected);
    }

    @Override
    public int expectReturn(Duration timeout, boolean failIfNone, ExpectedReturn... expected) {
        Objects.requireNonNull(expected, "expected");
        String timeoutMessage = "expecting return within " + timeout.toMillis() + "ms";
        return matcher.expect("expectReturn", "return", returns, timeout, failIfNone,
                List.of(expected), timeoutMessage);
    }

    @Override
    public int expectReturn(boolean failIfNone, ExpectedReturn... expected) {
        return expectReturn(config.defaultExpectationTimeout(), failIfNone, expected);
    }

    @Override
    public void checkObservationTimeout(boolean isAcceptingState, ExpectedEvent... expected) {
        Objects.requireNonNull(expected, "expected");
        List<AvailableEvent> pending = events.snapshot();
        if (isAcceptingState && pending.isEmpty()) {
            comment("Observation timeout while expecting events:" + listed(Arrays.asList(expected)));
            return;
        }
        reportFailure("Expected event didn't come within configured timeout."
                + System.lineSeparator() + "Expected events:" + listed(Arrays.asList(expected))
                + System.lineSeparator() + "Observed events:" + listed(pending));
    }

    @Override
    public int selectSatisfiedPreConstraint(boolean printDiagnosisIfFail, ExpectedPreConstraint... expected) {
        Objects.requireNonNull(expected, "expected");
        return matcher.selectSatisfied(printDiagnosisIfFail, List.of(expected));
    }

    // ---------------------------------------------------------------------
    // Variables and transactions
    // ---------------------------------------------------------------------

    @Override
    public <T> Variable<T> createVariable(String name, Class<T> type) {
        return new TransactableVariable<>(name, type, log);
    }

    @Override
    public <T> T generateValue(Class<T> type) {
        return Values.defaultValue(type);
    }

    @Override
    public void beginTransaction() {
        log.begin();
    }

    @Override
    public void endTransaction(boolean commit) {
        log.end(commit);
    }

    // ---------------------------------------------------------------------
    // Reporting
    // ---------------------------------------------------------------------

    @Override
    public void assertTrue(boolean condition, String description) {
        Objects.requireNonNull(description, "description");
        if (log.isActive()) {
            log.recordAssert(condition, description);
        } else if (!condition && config.throwTestFailureException()) {
            throw new TestFailureException(description);
        } else {
            sink.assertTrue(condition, description);
        }
    }

    @Override
    public void assume(boolean condition, String description) {
        Objects.requireNonNull(description, "description");
        if (log.isActive()) {
            log.recordAssume(condition, description);
        } else {
            sink.assume(condition, description);
        }
    }

    @Override
    public void checkpoint(String description) {
        Objects.requireNonNull(description, "description");
        if (log.isActive()) {
            log.recordCheckpoint(description);
        } else {
            sink.checkpoint(description);
        }
    }

    @Override
    public void comment(String description) {
        Objects.requireNonNull(description, "description");
        if (log.isActive()) {
            log.recordComment(description);
        } else {
            sink.comment(description);
        }
    }

    @Override
    public void beginTest(String name) {
        Objects.requireNonNull(name, "name");
        if (log.isActive()) {
            log.recordCheckpoint("Begin Test: " + name);
        } else {
            sink.beginTest(name);
        }
    }

    @Override
    public void endTest() {
        if (log.isActive()) {
            log.recordCheckpoint("End Test.");
        } else {
            sink.endTest();
        }
    }

    @Override
    public List<AvailableEvent> pendingEvents() {
        return events.snapshot();
    }

    @Override
    public List<AvailableReturn> pendingReturns() {
        return returns.snapshot();
    }

    @Override
    public void close() {
        subscriptions.clear();
    }

    private void reportFailure(String message) {
        if (config.throwTestFailureException()) {
            throw new TestFailureException(message);
        }
        sink.assertTrue(false, message);
    }

    private static String listed(List<?> items) {
        StringBuilder sb = new StringBuilder();
        for (Object item : items) {
            sb.append(System.lineSeparator()).append('\t').append(item);
        }
        return sb.toString();
    }

    public static final class Builder {
        private TestManagerConfig config = TestManagerConfig.defaults();
        private ReportingSink reportingSink;
        private AdapterLookup adapterLookup = SimpleAdapterLookup.empty();
        private OracleObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(TestManagerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withReportingSink(ReportingSink sink) {
            this.reportingSink = sink;
            return this;
        }

        public Builder withAdapterLookup(AdapterLookup lookup) {
            this.adapterLookup = lookup;
            return this;
        }

        public Builder withObservabilitySink(OracleObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = clock;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public DefaultTestManager build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(reportingSink, "reportingSink");
            Objects.requireNonNull(adapterLookup, "adapterLookup");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(monotonicClock, "monotonicClock");
            Objects.requireNonNull(wallClock, "wallClock");
            return new DefaultTestManager(this);
        }
    }
}
