package com.questrail.oob.codec;

import java.nio.ByteOrder;

/**
 * OobFraming
 * -----------------------------------------------------------------------------
 * Wire constants of the out-of-band frame.
 *
 * <pre>
 *   byte[0..3]    declared payload length, unsigned 32-bit, little-endian
 *   byte[4..4+N)  payload, N = declared length
 * </pre>
 *
 * <p>These values are shared with every peer implementation and must be
 * reproduced bit-for-bit.</p>
 */
public final class OobFraming
{
    /** Size of the length prefix in bytes. */
    public static final int LENGTH_PREFIX_BYTES = 4;

    /** Byte order of the length prefix. */
    public static final ByteOrder LENGTH_PREFIX_ORDER = ByteOrder.LITTLE_ENDIAN;

    /** Default upper bound on the declared payload length. */
    public static final int DEFAULT_MAX_PAYLOAD_BYTES = 64 * 1024;

    private OobFraming() {}

    /**
     * Interpret a complete length prefix as an unsigned value.
     *
     * @param prefix exactly {@link #LENGTH_PREFIX_BYTES} bytes
     * @return the declared payload length, in {@code [0, 2^32)}
     */
    public static long declaredLength(byte[] prefix)
    {
        if (prefix.length != LENGTH_PREFIX_BYTES) {
            throw new IllegalArgumentException("Length prefix must be " + LENGTH_PREFIX_BYTES + " bytes");
        }
        return (prefix[0] & 0xFFL)
                | (prefix[1] & 0xFFL) << 8
                | (prefix[2] & 0xFFL) << 16
                | (prefix[3] & 0xFFL) << 24;
    }
}
