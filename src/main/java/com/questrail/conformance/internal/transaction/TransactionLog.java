package com.questrail.conformance.internal.transaction;

import com.questrail.conformance.api.ReportingSink;
import com.questrail.conformance.internal.time.WallClock;
import com.questrail.conformance.observability.OracleObservabilitySink;
import com.questrail.conformance.observability.TransactionOutcomeEvent;

import java.util.Objects;

/**
 * TransactionLog
 * =============================================================================
 * Owns the single active transaction of a test manager.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   begin()            → opens an empty transaction; fails if one is active
 *   record*(...)       → appends entries while active
 *   end(true)          → replays every entry to the reporting sink, in order
 *   end(false)         → unbinds every variable bound during the transaction
 * </pre>
 *
 * <h2>Early abort</h2>
 * {@link #recordAssert} evaluates its condition through
 * {@link ReportingSink#isTrue} and {@link #recordAssume} through the condition
 * itself; a false result throws {@link TransactionAbort} after the entry is
 * recorded, so the rolled-back transaction still shows which check failed.
 *
 * <h2>Threading</h2>
 * Accessed only from the test-execution thread. Nesting is a programming error
 * and fails immediately.
 */
public final class TransactionLog
{
    private final ReportingSink sink;
    private final OracleObservabilitySink observability;
    private final WallClock wallClock;

    private Transaction active;

    public TransactionLog(ReportingSink sink, OracleObservabilitySink observability, WallClock wallClock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.observability = Objects.requireNonNull(observability, "observability");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public boolean isActive() {
        return active != null;
    }

    public void begin() {
        if (active != null) {
            throw new IllegalStateException("nested test manager transactions not allowed");
        }
        active = new Transaction();
    }

    /**
     * Ends the active transaction, committing or rolling it back.
     *
     * @return the ended transaction, for diagnostics
     */
    public Transaction end(boolean commit) {
        if (active == null) {
            throw new IllegalStateException("no test manager transaction active which can be ended");
        }
        Transaction ended = active;
        active = null;

        if (commit) {
            replay(ended);
        } else {
            rollback(ended);
        }

        observability.onTransactionEnded(new TransactionOutcomeEvent(
                wallClock.now(), commit, ended.entries().size()));
        return ended;
    }

    public void recordAssert(boolean condition, String description) {
        requireActive().append(TransactionEntry.assertion(condition, description));
        if (!sink.isTrue(condition, description)) {
            throw new TransactionAbort(description);
        }
    }

    public void recordAssume(boolean condition, String description) {
        requireActive().append(TransactionEntry.assumption(condition, description));
        if (!condition) {
            throw new TransactionAbort(description);
        }
    }

    public void recordCheckpoint(String description) {
        requireActive().append(TransactionEntry.checkpoint(description));
    }

    public void recordComment(String description) {
        requireActive().append(TransactionEntry.comment(description));
    }

    void recordBinding(TransactableVariable<?> variable, Object value) {
        requireActive().append(TransactionEntry.binding(variable, value));
    }

    private Transaction requireActive() {
        if (active == null) {
            throw new IllegalStateException("no test manager transaction active");
        }
        return active;
    }

    private void replay(Transaction transaction) {
        for (TransactionEntry entry : transaction.entries()) {
            switch (entry.kind()) {
                case ASSERT -> sink.assertTrue(entry.condition(), entry.description());
                case ASSUME -> sink.assume(entry.condition(), entry.description());
                case CHECKPOINT -> sink.checkpoint(entry.description());
                case COMMENT, VARIABLE_BOUND -> sink.comment(entry.description());
            }
        }
    }

    private static void rollback(Transaction transaction) {
        for (TransactionEntry entry : transaction.entries()) {
            if (entry.kind() == TransactionEntry.Kind.VARIABLE_BOUND) {
                entry.variable().unbind();
            }
        }
    }
}
