package com.questrail.oob.observability;

/**
 * Diagnostic classification of a failed activation.
 *
 * <p>Causes are never visible through the channel callback, which only
 * distinguishes success from failure.</p>
 */
public enum OobFailureCause
{
    /** No bonded peer exists; nothing was opened. */
    NO_ELIGIBLE_PEER,

    /** The listening endpoint could not be opened. */
    LISTEN_FAILED,

    /** Accept timed out or the listening endpoint failed. */
    ACCEPT_FAILED,

    /** The peer closed the stream before a frame part was complete. */
    READ_END_OF_STREAM,

    /** The transport failed while a frame part was being read. */
    READ_IO_ERROR,

    /** The declared payload length exceeds the configured maximum. */
    FRAME_TOO_LARGE,

    /** The payload was received in full but is not a valid token. */
    DECODE_FAILED,

    /** The installed callback threw. */
    CALLBACK_FAILED,

    /** Releasing a transport resource failed. */
    CLEANUP_FAILED,

    /** An unexpected exception escaped the worker sequence. */
    WORKER_FAILED
}
