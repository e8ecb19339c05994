package com.questrail.conformance.observability;

import java.time.Instant;

/**
 * Record representing an unexpected failure inside the oracle, such as a
 * checker throwing something other than an assertion failure.
 */
public record OracleErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
