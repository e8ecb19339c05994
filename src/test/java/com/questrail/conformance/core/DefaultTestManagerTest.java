package com.questrail.conformance.core;

import com.questrail.conformance.api.TestFailureException;
import com.questrail.conformance.api.Variable;
import com.questrail.conformance.config.TestManagerConfig;
import com.questrail.conformance.expect.ExpectedEvent;
import com.questrail.conformance.expect.ExpectedPreConstraint;
import com.questrail.conformance.expect.ExpectedReturn;
import com.questrail.conformance.model.AvailableEvent;
import com.questrail.conformance.model.Checker;
import com.questrail.conformance.model.MemberDescriptor;
import com.questrail.conformance.observability.ObservationEvent;
import com.questrail.conformance.observability.RecordingObservabilitySink;
import com.questrail.conformance.test.RecordedReport;
import com.questrail.conformance.test.RecordingReportingSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultTestManagerTest
 * -----------------------------------------------------------------------------
 * End-to-end behavior of the test manager over a recording reporting sink.
 */
class DefaultTestManagerTest {

    public static final class Foo {
        private final String name;

        Foo(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final MemberDescriptor FOO = MemberDescriptor.event(Foo.class, "foo")
            .withParameters(int.class)
            .build();

    private static final MemberDescriptor COMPUTE = MemberDescriptor.method(Foo.class, "compute")
            .withParameters(int.class)
            .withReturnType(String.class)
            .build();

    private final Foo t1 = new Foo("T1");

    private RecordingReportingSink sink;
    private RecordingObservabilitySink observability;
    private DefaultTestManager manager;

    @BeforeEach
    void setUp() {
        sink = new RecordingReportingSink();
        observability = new RecordingObservabilitySink();
        manager = DefaultTestManager.builder()
                .withReportingSink(sink)
                .withObservabilitySink(observability)
                .withWallClock(() -> Instant.EPOCH)
                .build();
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private ExpectedEvent fooEquals(int expected) {
        return ExpectedEvent.on(FOO, t1, Checker.of(int.class,
                arg -> manager.assertTrue(arg == expected, "arg == " + expected)));
    }

    @Test
    void secondPatternAcceptsAndConsumes() {
        manager.addEvent(FOO, t1, 5);

        int index = manager.expectEvent(Duration.ofMillis(100), true, fooEquals(4), fooEquals(5));

        assertEquals(1, index);
        assertTrue(manager.pendingEvents().isEmpty());
        assertTrue(sink.failures().isEmpty());
        assertEquals(List.of(RecordedReport.assertion(true, "arg == 5")), sink.reports());
    }

    @Test
    void noAcceptingPatternReportsFailureAndRetainsObservation() {
        Variable<Integer> bound = manager.createVariable("bound", Integer.class);
        ExpectedEvent binding = ExpectedEvent.on(FOO, t1, Checker.of(int.class, arg -> {
            bound.set(arg);
            manager.assertTrue(arg == 4, "arg == 4");
        }));
        manager.addEvent(FOO, t1, 5);

        int index = manager.expectEvent(Duration.ofMillis(100), true, binding, fooEquals(4));

        assertEquals(-1, index);
        assertEquals(1, manager.pendingEvents().size());
        assertFalse(bound.isBound());
        List<RecordedReport> failures = sink.failures();
        assertEquals(1, failures.size());
        assertTrue(failures.get(0).description()
                .startsWith("expected matching event, found 'event Foo.foo(5) on T1'. Diagnosis:"));
    }

    @Test
    void committedBindingsAreReportedAndDurable() {
        Variable<Integer> bound = manager.createVariable("bound", Integer.class);
        manager.addEvent(FOO, t1, 5);

        manager.expectEvent(Duration.ZERO, true, ExpectedEvent.on(FOO, t1, Checker.of(int.class, bound::set)));

        assertEquals(5, bound.get());
        assertEquals(List.of(RecordedReport.comment("bound variable bound to value: 5")), sink.reports());
    }

    @Test
    void eventTimeoutListsExpectedEvents() {
        ExpectedEvent expected = fooEquals(4);

        assertEquals(-1, manager.expectEvent(Duration.ofMillis(10), true, expected));

        String nl = System.lineSeparator();
        assertEquals(List.of(RecordedReport.assertion(false,
                "Event must occur within 10ms" + nl + "Expecting events:" + nl + "\t" + expected)),
                sink.reports());
    }

    @Test
    void expectationTimesOutWhenInjectedClockStandsStill() {
        DefaultTestManager frozen = DefaultTestManager.builder()
                .withReportingSink(sink)
                .withMonotonicClock(() -> 42L)
                .build();

        int index = assertTimeoutPreemptively(Duration.ofSeconds(2),
                () -> frozen.expectEvent(Duration.ofMillis(20), false, ExpectedEvent.of(FOO)));

        assertEquals(-1, index);
        frozen.close();
    }

    @Test
    void returnTimeoutAndMatch() {
        assertEquals(-1, manager.expectReturn(Duration.ofMillis(10), true, ExpectedReturn.of(COMPUTE)));
        assertEquals(List.of(RecordedReport.assertion(false, "expecting return within 10ms")), sink.reports());

        manager.addReturn(COMPUTE, t1, "42");
        int index = manager.expectReturn(Duration.ZERO, true, ExpectedReturn.on(COMPUTE, t1,
                Checker.of(Foo.class, String.class, (foo, result) -> manager.assertTrue(
                        foo == t1 && result.equals("42"), "result is 42"))));

        assertEquals(0, index);
        assertTrue(manager.pendingReturns().isEmpty());
    }

    @Test
    void defaultTimeoutComesFromConfig() {
        DefaultTestManager quick = DefaultTestManager.builder()
                .withReportingSink(sink)
                .withConfig(TestManagerConfig.builder()
                        .withDefaultExpectationTimeout(Duration.ofMillis(5))
                        .build())
                .build();

        assertEquals(-1, quick.expectEvent(false, ExpectedEvent.of(FOO)));
        assertEquals(-1, quick.expectReturn(false, ExpectedReturn.of(COMPUTE)));
        assertTrue(sink.reports().isEmpty());
    }

    @Test
    void eventFromProducerThreadWakesExpectation() throws Exception {
        ExecutorService producer = Executors.newSingleThreadExecutor();
        CountDownLatch started = new CountDownLatch(1);
        try {
            producer.submit(() -> {
                started.await(1, TimeUnit.SECONDS);
                Thread.sleep(20);
                manager.addEvent(FOO, t1, 5);
                return null;
            });
            started.countDown();

            assertEquals(0, manager.expectEvent(Duration.ofSeconds(5), true, fooEquals(5)));
        } finally {
            producer.shutdownNow();
        }
    }

    @Test
    void throwTestFailureExceptionRaisesInsteadOfReporting() {
        DefaultTestManager strict = DefaultTestManager.builder()
                .withReportingSink(sink)
                .withConfig(TestManagerConfig.builder().withThrowTestFailureException(true).build())
                .build();

        TestFailureException assertion = assertThrows(TestFailureException.class,
                () -> strict.assertTrue(false, "must hold"));
        assertEquals("must hold", assertion.getMessage());

        TestFailureException timeout = assertThrows(TestFailureException.class,
                () -> strict.expectEvent(Duration.ZERO, true, ExpectedEvent.of(FOO)));
        assertTrue(timeout.getMessage().startsWith("Event must occur within 0ms"));

        strict.assertTrue(true, "holds");
        assertEquals(List.of(RecordedReport.assertion(true, "holds")), sink.reports());
    }

    @Test
    void preConstraintSelectionLeavesNoTransactionActive() {
        int index = manager.selectSatisfiedPreConstraint(true,
                ExpectedPreConstraint.of("first", () -> manager.assertTrue(false, "first")),
                ExpectedPreConstraint.of("second", () -> manager.checkpoint("second")),
                ExpectedPreConstraint.of("third", () -> manager.assertTrue(false, "third")));

        assertEquals(1, index);
        assertEquals(List.of(RecordedReport.checkpoint("second")), sink.reports());
        manager.beginTransaction();
        manager.endTransaction(false);
    }

    @Test
    void observationTimeoutInAcceptingStateOnlyComments() {
        ExpectedEvent expected = ExpectedEvent.of(FOO);
        manager.checkObservationTimeout(true, expected);

        String nl = System.lineSeparator();
        assertEquals(List.of(RecordedReport.comment(
                "Observation timeout while expecting events:" + nl + "\t" + expected)), sink.reports());
    }

    @Test
    void observationTimeoutOtherwiseFailsWithQueuedEvents() {
        ExpectedEvent expected = fooEquals(4);
        manager.addEvent(FOO, t1, 5);

        manager.checkObservationTimeout(true, expected);

        String nl = System.lineSeparator();
        assertEquals(List.of(RecordedReport.assertion(false,
                "Expected event didn't come within configured timeout." + nl
                        + "Expected events:" + nl + "\t" + expected + nl
                        + "Observed events:" + nl + "\tevent Foo.foo(5) on T1")), sink.reports());
    }

    @Test
    void reportingOutsideTransactionIsImmediate() {
        manager.beginTest("smoke");
        manager.checkpoint("cp");
        manager.comment("note");
        manager.assume(true, "ready");
        manager.assertTrue(false, "broken");
        manager.endTest();

        assertEquals(List.of(
                RecordedReport.beginTest("smoke"),
                RecordedReport.checkpoint("cp"),
                RecordedReport.comment("note"),
                RecordedReport.assumption(true, "ready"),
                RecordedReport.assertion(false, "broken"),
                RecordedReport.endTest()
        ), sink.reports());
    }

    @Test
    void testBoundariesInsideTransactionBecomeCheckpoints() {
        manager.beginTransaction();
        manager.beginTest("inner");
        manager.endTest();
        assertTrue(sink.reports().isEmpty());
        manager.endTransaction(true);

        assertEquals(List.of(
                RecordedReport.checkpoint("Begin Test: inner"),
                RecordedReport.checkpoint("End Test.")
        ), sink.reports());
    }

    @Test
    void explicitTransactionLifecycle() {
        manager.beginTransaction();
        assertThrows(IllegalStateException.class, manager::beginTransaction);
        manager.endTransaction(false);
        assertThrows(IllegalStateException.class, () -> manager.endTransaction(true));
    }

    @Test
    void fullQueueDropsAndPublishes() {
        DefaultTestManager small = DefaultTestManager.builder()
                .withReportingSink(sink)
                .withObservabilitySink(observability)
                .withConfig(TestManagerConfig.builder().withEventQueueCapacity(1).build())
                .build();

        assertTrue(small.addEvent(FOO, t1, 1));
        assertFalse(small.addEvent(FOO, t1, 2));

        List<AvailableEvent> pending = small.pendingEvents();
        assertEquals(1, pending.size());
        assertEquals(List.of(1), pending.get(0).arguments());
        assertEquals(1, observability.getObservations(ObservationEvent.Kind.QUEUED).size());
        assertEquals(1, observability.getObservations(ObservationEvent.Kind.DROPPED).size());
    }

    @Test
    void malformedObservationsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> manager.addEvent(FOO, t1, "five"));
        assertThrows(IllegalArgumentException.class, () -> manager.addEvent(FOO, null, 5));
        assertThrows(IllegalArgumentException.class, () -> manager.addReturn(FOO, t1, 5));
    }

    @Test
    void generatesDefaultValues() {
        assertEquals(0, manager.generateValue(int.class));
        assertEquals(0L, manager.generateValue(Long.class));
        assertEquals(Boolean.FALSE, manager.generateValue(boolean.class));
        assertEquals('\0', manager.generateValue(char.class));
        assertEquals("", manager.generateValue(String.class));
        assertNull(manager.generateValue(Foo.class));
    }

    @Test
    void adapterLookupIsDelegated() {
        Foo adapter = new Foo("adapter");
        DefaultTestManager withAdapters = DefaultTestManager.builder()
                .withReportingSink(sink)
                .withAdapterLookup(SimpleAdapterLookup.builder().withAdapter(Foo.class, adapter).build())
                .build();

        assertSame(adapter, withAdapters.getAdapter(Foo.class));
        assertThrows(IllegalStateException.class, () -> manager.getAdapter(Foo.class));
    }

    @Test
    void builderRequiresReportingSink() {
        assertThrows(NullPointerException.class, () -> DefaultTestManager.builder().build());
    }
}
