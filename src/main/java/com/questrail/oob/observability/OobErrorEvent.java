package com.questrail.oob.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a failure or anomaly inside an OOB channel activation.
 *
 * @param cause diagnostic classification
 * @param error underlying exception, if any; may be {@code null}
 */
public record OobErrorEvent(
    Instant timestamp,
    OobFailureCause cause,
    String message,
    Throwable error
) {
    public OobErrorEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(cause, "cause");
        Objects.requireNonNull(message, "message");
    }
}
