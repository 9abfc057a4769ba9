package com.questrail.oob.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * Token carried verbatim in the frame payload.
 */
public final class RawOobToken implements OobToken
{
    private final byte[] bytes;

    public RawOobToken(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length == 0) {
            throw new IllegalArgumentException("Raw token must not be empty");
        }
        this.bytes = bytes.clone();
    }

    /** Returns a copy of the token bytes. */
    public byte[] bytes()
    {
        return bytes.clone();
    }

    public int length()
    {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        return o instanceof RawOobToken other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(bytes);
    }

    // Token material is never printed.
    @Override
    public String toString()
    {
        return "RawOobToken[length=" + bytes.length + "]";
    }
}
