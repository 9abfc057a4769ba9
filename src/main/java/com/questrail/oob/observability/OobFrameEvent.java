package com.questrail.oob.observability;

import java.time.Instant;

/**
 * Record representing the completion of one framing step.
 *
 * @param part     which part of the frame was read
 * @param expected bytes the step required
 * @param received bytes actually accumulated before the step resolved
 */
public record OobFrameEvent(
    Instant timestamp,
    Part part,
    long expected,
    long received
) {
    public enum Part {
        LENGTH_PREFIX,
        PAYLOAD
    }

    public boolean isComplete() {
        return expected == received;
    }
}
