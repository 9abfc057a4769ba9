package com.questrail.oob.observability;

/**
 * Main interface for receiving OOB channel observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks are invoked from the channel worker and, for cancellation, from
 * the thread calling {@code stop()}. Implementations must be thread-safe and
 * must not block.</p>
 */
public interface OobObservabilitySink {
    /**
     * Called when the channel moves between states.
     * @param event the transition event details
     */
    void onStateTransition(OobStateTransitionEvent event);

    /**
     * Called when a framing step resolves, complete or not.
     * @param event the framing progress
     */
    void onFrameEvent(OobFrameEvent event);

    /**
     * Called when an activation fails or a resource misbehaves.
     * @param event the error event
     */
    void onError(OobErrorEvent event);
}
