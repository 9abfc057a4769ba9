package com.questrail.oob.codec;

import com.questrail.oob.observability.NullObservabilitySink;
import com.questrail.oob.observability.OobErrorEvent;
import com.questrail.oob.observability.OobFailureCause;
import com.questrail.oob.observability.OobFrameEvent;
import com.questrail.oob.observability.OobObservabilitySink;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * LengthPrefixedFrameReader
 * -----------------------------------------------------------------------------
 * Reads exactly one OOB frame from a blocking stream.
 *
 * <p>This reader performs the following steps, in order:</p>
 * <ol>
 *   <li>Read exactly {@link OobFraming#LENGTH_PREFIX_BYTES} bytes and interpret
 *       them as the unsigned little-endian declared length</li>
 *   <li>Reject a declared length above the configured maximum, before any
 *       payload buffer is allocated</li>
 *   <li>Read exactly the declared number of payload bytes</li>
 * </ol>
 *
 * <p>Each step keeps reading into the remaining buffer space until the byte
 * count is satisfied. End of stream or an {@link IOException} before that point
 * fails the whole frame; a partial value is never returned. The two are
 * distinguished only in the {@link OobErrorEvent} handed to the sink.</p>
 *
 * <h2>Cancellation</h2>
 * <p>Reads are not interruptible. A caller cancels by closing the stream from
 * another thread, which surfaces here as an {@link IOException}. The
 * {@code cancelled} check is consulted after each step resolves; once it
 * reports {@code true} the reader returns empty and stays silent about the
 * I/O error the closure produced.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Instances hold no per-read state and may be shared.</p>
 */
public final class LengthPrefixedFrameReader
{
    private final int maxPayloadBytes;
    private final OobObservabilitySink observabilitySink;

    public LengthPrefixedFrameReader(int maxPayloadBytes, OobObservabilitySink observabilitySink)
    {
        if (maxPayloadBytes < 0) {
            throw new IllegalArgumentException("maxPayloadBytes must be non-negative");
        }
        this.maxPayloadBytes = maxPayloadBytes;
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public LengthPrefixedFrameReader()
    {
        this(OobFraming.DEFAULT_MAX_PAYLOAD_BYTES, NullObservabilitySink.INSTANCE);
    }

    /**
     * Read one frame without cancellation checkpoints.
     */
    public Optional<RawFrame> readFrame(InputStream in)
    {
        return readFrame(in, () -> false);
    }

    /**
     * Read one frame.
     *
     * @param in        the connection stream
     * @param cancelled consulted after each framing step resolves
     * @return the complete frame, or empty on any failure or cancellation
     */
    public Optional<RawFrame> readFrame(InputStream in, BooleanSupplier cancelled)
    {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(cancelled, "cancelled");

        // 1) Length prefix
        Optional<byte[]> prefix = readExactly(in, OobFraming.LENGTH_PREFIX_BYTES,
                OobFrameEvent.Part.LENGTH_PREFIX, cancelled);
        if (cancelled.getAsBoolean() || prefix.isEmpty()) {
            return Optional.empty();
        }

        // 2) Bound the allocation
        long declaredLength = OobFraming.declaredLength(prefix.get());
        if (declaredLength > maxPayloadBytes) {
            report(OobFailureCause.FRAME_TOO_LARGE,
                    "Declared payload length " + declaredLength + " exceeds maximum " + maxPayloadBytes,
                    null);
            return Optional.empty();
        }

        // 3) Payload
        Optional<byte[]> payload = readExactly(in, (int) declaredLength,
                OobFrameEvent.Part.PAYLOAD, cancelled);
        if (cancelled.getAsBoolean() || payload.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RawFrame(payload.get()));
    }

    private Optional<byte[]> readExactly(InputStream in,
                                         int size,
                                         OobFrameEvent.Part part,
                                         BooleanSupplier cancelled)
    {
        byte[] buffer = new byte[size];
        int bytesRead = 0;

        while (bytesRead < size) {
            final int read;
            try {
                read = in.read(buffer, bytesRead, size - bytesRead);
            } catch (IOException e) {
                progress(part, size, bytesRead);
                if (!cancelled.getAsBoolean()) {
                    report(OobFailureCause.READ_IO_ERROR, "Could not read " + describe(part) + " from stream", e);
                }
                return Optional.empty();
            }

            if (read == -1) {
                progress(part, size, bytesRead);
                if (!cancelled.getAsBoolean()) {
                    report(OobFailureCause.READ_END_OF_STREAM,
                            "Stream ended after " + bytesRead + " of " + size + " " + describe(part) + " bytes",
                            null);
                }
                return Optional.empty();
            }
            bytesRead += read;
        }

        progress(part, size, bytesRead);
        return Optional.of(buffer);
    }

    private void progress(OobFrameEvent.Part part, int expected, int received)
    {
        observabilitySink.onFrameEvent(new OobFrameEvent(Instant.now(), part, expected, received));
    }

    private void report(OobFailureCause cause, String message, Throwable error)
    {
        observabilitySink.onError(new OobErrorEvent(Instant.now(), cause, message, error));
    }

    private static String describe(OobFrameEvent.Part part)
    {
        return part == OobFrameEvent.Part.LENGTH_PREFIX ? "length prefix" : "payload";
    }

    public int maxPayloadBytes()
    {
        return maxPayloadBytes;
    }
}
