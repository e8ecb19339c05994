package com.questrail.conformance.observability;

/**
 * Receives what the oracle did with each observation while a test case runs:
 * which observations entered or left the queues, which pattern an expectation
 * selected, and how each checker transaction ended.
 *
 * <p>Calls arrive on the thread that caused them. Queue events come from
 * adapter threads, everything else from the test-execution thread.</p>
 */
public interface OracleObservabilitySink {
    /**
     * Called when an observation is queued, consumed, or dropped because its
     * queue is full.
     * @param event the observation event details
     */
    void onObservation(ObservationEvent event);

    /**
     * Called when an expectation or pre-constraint selection completes.
     * @param event the outcome, including the selected index or -1
     */
    void onExpectationOutcome(ExpectationOutcomeEvent event);

    /**
     * Called when a transaction is committed or rolled back.
     * @param event the transaction outcome
     */
    void onTransactionEnded(TransactionOutcomeEvent event);

    /**
     * Called when a checker fails with something other than a rejected assertion.
     * @param event the error event
     */
    void onError(OracleErrorEvent event);
}
