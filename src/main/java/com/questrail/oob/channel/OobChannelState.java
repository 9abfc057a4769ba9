package com.questrail.oob.channel;

/**
 * Lifecycle state of an OOB channel.
 *
 * <pre>
 *   IDLE → ACCEPTING → CONNECTED → READING_FRAME → DECODING → SUCCEEDED → IDLE
 *             │            │             │             │
 *             │            │             │             └──────→ FAILED → IDLE
 *             └────────────┴─────────────┴─→ CANCELLING → IDLE
 * </pre>
 *
 * <p>Any of {@code ACCEPTING}, {@code CONNECTED}, {@code READING_FRAME} and
 * {@code DECODING} may also move directly to {@code FAILED}.</p>
 */
public enum OobChannelState
{
    IDLE,
    ACCEPTING,
    CONNECTED,
    READING_FRAME,
    DECODING,
    SUCCEEDED,
    FAILED,
    CANCELLING;

    /**
     * Returns true while an activation is in flight and may still be cancelled.
     */
    public boolean isCancellable()
    {
        return this == ACCEPTING || this == CONNECTED || this == READING_FRAME || this == DECODING;
    }

    /**
     * Returns true once the outcome of an activation has been committed.
     */
    public boolean isTerminal()
    {
        return this == SUCCEEDED || this == FAILED;
    }
}
