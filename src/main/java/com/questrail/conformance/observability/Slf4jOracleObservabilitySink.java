package com.questrail.conformance.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of OracleObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jOracleObservabilitySink implements OracleObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jOracleObservabilitySink.class);

    @Override
    public void onObservation(ObservationEvent event) {
        if (event.kind() == ObservationEvent.Kind.DROPPED) {
            log.warn("Observation queue full ({} entries), dropped {}",
                event.queueSize(),
                event.observation());
            return;
        }
        log.debug("Observation {}: {} (queue size {})",
            event.kind(),
            event.observation(),
            event.queueSize());
    }

    @Override
    public void onExpectationOutcome(ExpectationOutcomeEvent event) {
        if (event.isMatched()) {
            log.info("{}: pattern {} of {} accepted{}",
                event.operation(),
                event.selectedIndex() + 1,
                event.patternCount(),
                event.examinedObservation().map(o -> " for " + o).orElse(""));
        } else if (event.failureReported()) {
            log.warn("{}: none of {} pattern(s) accepted{}",
                event.operation(),
                event.patternCount(),
                event.examinedObservation().map(o -> " for " + o).orElse(""));
        } else {
            log.debug("{}: no match among {} pattern(s)",
                event.operation(),
                event.patternCount());
        }
    }

    @Override
    public void onTransactionEnded(TransactionOutcomeEvent event) {
        log.trace("Transaction {} with {} entries",
            event.committed() ? "committed" : "rolled back",
            event.entryCount());
    }

    @Override
    public void onError(OracleErrorEvent event) {
        log.error("Oracle Error: {}", event.message(), event.cause());
    }
}
