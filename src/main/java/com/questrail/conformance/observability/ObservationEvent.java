package com.questrail.conformance.observability;

import com.questrail.conformance.model.Observation;

import java.time.Instant;

/**
 * Record representing a change in an observation queue.
 */
public record ObservationEvent(
    Instant timestamp,
    Kind kind,
    Observation observation,
    int queueSize
) {
    public enum Kind {
        QUEUED,
        CONSUMED,
        DROPPED
    }
}
