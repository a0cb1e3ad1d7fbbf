package com.questrail.wlan.observability;

/**
 * Main interface for receiving guardrail engine observability events.
 * Implementations can provide logging, metrics, or auditing.
 * <p>
 * Callbacks run on the submitting thread, after the per-access-point update
 * has completed. Implementations must not throw.
 */
public interface GuardrailObservabilitySink {
    /**
     * Called when an access point record is added or replaced.
     * @param event the registration details
     */
    void onAccessPointRegistered(AccessPointRegisteredEvent event);

    /**
     * Called once per submitted change request with its verdict.
     * @param event the evaluation details
     */
    void onChangeEvaluated(ChangeEvaluatedEvent event);

    /**
     * Called when an accepted request altered the channel and/or power.
     * @param event the old and new state
     */
    void onStateChange(AccessPointStateChangeEvent event);

    /**
     * Called when an operation referenced an unregistered access point.
     * @param event the failing id and operation
     */
    void onLookupFailure(LookupFailureEvent event);
}
