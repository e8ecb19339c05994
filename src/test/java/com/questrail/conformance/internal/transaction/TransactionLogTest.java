package com.questrail.conformance.internal.transaction;

import com.questrail.conformance.api.ReportingSink;
import com.questrail.conformance.observability.RecordingObservabilitySink;
import com.questrail.conformance.observability.TransactionOutcomeEvent;
import com.questrail.conformance.test.RecordedReport;
import com.questrail.conformance.test.RecordingReportingSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransactionLogTest {

    private RecordingReportingSink sink;
    private RecordingObservabilitySink observability;
    private TransactionLog log;

    @BeforeEach
    void setUp() {
        sink = new RecordingReportingSink();
        observability = new RecordingObservabilitySink();
        log = new TransactionLog(sink, observability, () -> Instant.EPOCH);
    }

    @Test
    void nestedBeginFails() {
        log.begin();
        IllegalStateException e = assertThrows(IllegalStateException.class, log::begin);
        assertEquals("nested test manager transactions not allowed", e.getMessage());
        assertTrue(log.isActive());
    }

    @Test
    void endWithoutBeginFails() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> log.end(true));
        assertEquals("no test manager transaction active which can be ended", e.getMessage());
    }

    @Test
    void recordingOutsideTransactionFails() {
        assertThrows(IllegalStateException.class, () -> log.recordComment("x"));
    }

    @Test
    void commitReplaysEntriesInAppendOrder() {
        TransactableVariable<Integer> v = new TransactableVariable<>("v", Integer.class, log);

        log.begin();
        log.recordCheckpoint("first");
        log.recordAssert(true, "second");
        v.set(42);
        log.recordComment("third");
        log.recordAssume(true, "fourth");
        assertTrue(sink.reports().isEmpty(), "nothing reported before commit");

        Transaction committed = log.end(true);

        assertFalse(log.isActive());
        assertEquals(5, committed.entries().size());
        assertEquals(List.of(
                RecordedReport.checkpoint("first"),
                RecordedReport.assertion(true, "second"),
                RecordedReport.comment("bound variable v to value: 42"),
                RecordedReport.comment("third"),
                RecordedReport.assumption(true, "fourth")
        ), sink.reports());
        assertTrue(v.isBound());
        assertEquals(42, v.get());
    }

    @Test
    void rollbackReportsNothingAndUnbindsVariables() {
        TransactableVariable<String> a = new TransactableVariable<>("a", String.class, log);
        TransactableVariable<String> b = new TransactableVariable<>("b", String.class, log);

        log.begin();
        log.recordCheckpoint("cp");
        a.set("x");
        log.recordComment("c");
        b.set("y");
        assertEquals("x", a.get(), "binding visible for the rest of the attempt");

        log.end(false);

        assertTrue(sink.reports().isEmpty());
        assertFalse(a.isBound());
        assertFalse(b.isBound());
    }

    @Test
    void failingAssertAbortsAfterRecordingTheEntry() {
        log.begin();
        log.recordComment("before");

        TransactionAbort abort = assertThrows(TransactionAbort.class, () -> log.recordAssert(false, "x == 4"));
        assertEquals("x == 4", abort.getMessage());
        assertEquals(0, abort.getStackTrace().length);

        Transaction rolledBack = log.end(false);
        assertEquals(2, rolledBack.entries().size());
        assertEquals("assert failed: x == 4", rolledBack.entries().get(1).render());
        assertTrue(sink.reports().isEmpty());
    }

    @Test
    void failingAssumeAborts() {
        log.begin();
        assertThrows(TransactionAbort.class, () -> log.recordAssume(false, "ready"));
        log.end(false);
        assertTrue(sink.reports().isEmpty());
    }

    @Test
    void assertConsultsSinkLocalEvaluation() {
        RecordingReportingSink lenient = new RecordingReportingSink();
        TransactionLog lenientLog = new TransactionLog(new DelegatingLenientSink(lenient), observability,
                () -> Instant.EPOCH);

        lenientLog.begin();
        lenientLog.recordAssert(false, "tolerated");
        lenientLog.end(true);

        assertEquals(List.of(RecordedReport.assertion(false, "tolerated")), lenient.reports());
    }

    @Test
    void transactionDescriptionListsEntriesWithPrefix() {
        log.begin();
        log.recordCheckpoint("cp");
        log.recordAssert(true, "ok");
        Transaction t = log.end(false);

        StringBuilder sb = new StringBuilder();
        t.describe(sb, "  ");
        String nl = System.lineSeparator();
        assertEquals("  checkpoint: cp" + nl + "  assert succeeded: ok" + nl, sb.toString());
    }

    @Test
    void endPublishesOutcome() {
        log.begin();
        log.recordComment("c");
        log.end(true);
        log.begin();
        log.end(false);

        List<TransactionOutcomeEvent> outcomes = observability.getTransactions();
        assertEquals(2, outcomes.size());
        assertTrue(outcomes.get(0).committed());
        assertEquals(1, outcomes.get(0).entryCount());
        assertFalse(outcomes.get(1).committed());
        assertEquals(0, outcomes.get(1).entryCount());
    }

    /**
     * Sink that treats every assertion as holding during local evaluation.
     */
    private static final class DelegatingLenientSink implements ReportingSink {
        private final RecordingReportingSink delegate;

        DelegatingLenientSink(RecordingReportingSink delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean isTrue(boolean condition, String description) {
            return true;
        }

        @Override
        public void assertTrue(boolean condition, String description) {
            delegate.assertTrue(condition, description);
        }

        @Override
        public void assume(boolean condition, String description) {
            delegate.assume(condition, description);
        }

        @Override
        public void checkpoint(String description) {
            delegate.checkpoint(description);
        }

        @Override
        public void comment(String description) {
            delegate.comment(description);
        }

        @Override
        public void beginTest(String name) {
            delegate.beginTest(name);
        }

        @Override
        public void endTest() {
            delegate.endTest();
        }
    }
}
