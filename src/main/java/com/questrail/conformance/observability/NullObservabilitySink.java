package com.questrail.conformance.observability;

/**
 * Discards every oracle event. Default sink of {@code DefaultTestManager.Builder}
 * when a test run only cares about the reported assertions.
 */
public final class NullObservabilitySink implements OracleObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onObservation(ObservationEvent event) {}

    @Override
    public void onExpectationOutcome(ExpectationOutcomeEvent event) {}

    @Override
    public void onTransactionEnded(TransactionOutcomeEvent event) {}

    @Override
    public void onError(OracleErrorEvent event) {}
}
