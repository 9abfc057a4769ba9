package com.questrail.oob.codec.token;

import com.questrail.oob.api.OobToken;
import com.questrail.oob.api.RawOobToken;

import java.util.Objects;

/**
 * {@link OobTokenCodec} for {@link OobWireFormat#RAW}: any non-empty payload is
 * a token.
 */
public final class RawOobTokenCodec implements OobTokenCodec
{
    @Override
    public RawOobToken decode(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        if (payload.length == 0) {
            throw new OobTokenDecodeException("Raw token payload is empty");
        }
        return new RawOobToken(payload);
    }

    @Override
    public byte[] encode(OobToken token)
    {
        Objects.requireNonNull(token, "token");
        if (!(token instanceof RawOobToken raw)) {
            throw new IllegalArgumentException("Raw wire format cannot carry " + token);
        }
        return raw.bytes();
    }
}
