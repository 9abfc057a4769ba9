package com.questrail.oob.observability;

import com.questrail.oob.channel.OobChannelState;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a state transition of an OOB channel.
 */
public record OobStateTransitionEvent(
    Instant timestamp,
    OobChannelState oldState,
    OobChannelState newState
) {
    public OobStateTransitionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(oldState, "oldState");
        Objects.requireNonNull(newState, "newState");
    }

    /**
     * Checks if this transition ends an activation.
     */
    public boolean isReturnToIdle() {
        return newState == OobChannelState.IDLE && oldState != OobChannelState.IDLE;
    }
}
