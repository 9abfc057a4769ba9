package com.questrail.oob.observability;

/**
 * No-op implementation of OobObservabilitySink.
 */
public final class NullObservabilitySink implements OobObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(OobStateTransitionEvent event) {}

    @Override
    public void onFrameEvent(OobFrameEvent event) {}

    @Override
    public void onError(OobErrorEvent event) {}
}
