package com.questrail.conformance.internal.match;

import com.questrail.conformance.internal.transaction.Transaction;

import java.util.Objects;

/**
 * Outcome of one matching attempt: the checker ran to completion and its
 * transaction was committed, or it aborted and its transaction was rolled back.
 */
sealed interface AttemptResult permits AttemptResult.Accepted, AttemptResult.Rejected
{
    static AttemptResult accepted() {
        return Accepted.INSTANCE;
    }

    static AttemptResult rejected(Transaction trace) {
        return new Rejected(trace);
    }

    final class Accepted implements AttemptResult {
        private static final Accepted INSTANCE = new Accepted();

        private Accepted() {
        }
    }

    /**
     * @param trace the rolled-back transaction, showing which check failed
     */
    record Rejected(Transaction trace) implements AttemptResult {
        public Rejected {
            Objects.requireNonNull(trace, "trace");
        }
    }
}
