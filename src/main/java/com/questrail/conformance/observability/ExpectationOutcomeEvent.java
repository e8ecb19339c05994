package com.questrail.conformance.observability;

import com.questrail.conformance.model.Observation;

import java.time.Instant;
import java.util.Optional;

/**
 * Record representing the completion of an expectation.
 *
 * @param operation     {@code expectEvent}, {@code expectReturn} or {@code selectSatisfiedPreConstraint}
 * @param selectedIndex index of the accepted pattern, or -1
 * @param patternCount  number of patterns offered
 * @param observation   the observation examined, or {@code null} when none arrived
 *                      or the operation has no observation
 * @param failureReported whether a failure was reported for this outcome
 */
public record ExpectationOutcomeEvent(
    Instant timestamp,
    String operation,
    int selectedIndex,
    int patternCount,
    Observation observation,
    boolean failureReported
) {
    /**
     * Checks if a pattern was accepted.
     */
    public boolean isMatched() {
        return selectedIndex >= 0;
    }

    public Optional<Observation> examinedObservation() {
        return Optional.ofNullable(observation);
    }
}
