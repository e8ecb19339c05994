package com.questrail.conformance.observability;

import java.time.Instant;

/**
 * Record representing the end of a transaction.
 */
public record TransactionOutcomeEvent(
    Instant timestamp,
    boolean committed,
    int entryCount
) {
}
