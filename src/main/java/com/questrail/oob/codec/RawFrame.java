package com.questrail.oob.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * Payload of one completely received OOB frame.
 *
 * <p>A {@code RawFrame} only exists once both the length prefix and every
 * declared payload byte have arrived. The payload is not yet interpreted.</p>
 */
public final class RawFrame
{
    private final byte[] payload;

    public RawFrame(byte[] payload)
    {
        this.payload = Objects.requireNonNull(payload, "payload").clone();
    }

    /** Returns a copy of the payload bytes. */
    public byte[] payload()
    {
        return payload.clone();
    }

    public int length()
    {
        return payload.length;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        return o instanceof RawFrame other && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(payload);
    }

    @Override
    public String toString()
    {
        return "RawFrame[length=" + payload.length + "]";
    }
}
