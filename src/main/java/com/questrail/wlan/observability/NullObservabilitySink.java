package com.questrail.wlan.observability;

/**
 * No-op implementation of GuardrailObservabilitySink.
 */
public final class NullObservabilitySink implements GuardrailObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onAccessPointRegistered(AccessPointRegisteredEvent event) {}

    @Override
    public void onChangeEvaluated(ChangeEvaluatedEvent event) {}

    @Override
    public void onStateChange(AccessPointStateChangeEvent event) {}

    @Override
    public void onLookupFailure(LookupFailureEvent event) {}
}
