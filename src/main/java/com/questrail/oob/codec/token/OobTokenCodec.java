package com.questrail.oob.codec.token;

import com.questrail.oob.api.OobToken;

/**
 * OobTokenCodec
 * -----------------------------------------------------------------------------
 * Translates between a complete frame payload and an {@link OobToken}.
 *
 * <p>Implementations are pure functions of their input and hold no state, so
 * a single instance may be shared between channels and threads.</p>
 */
public interface OobTokenCodec
{
    /**
     * Decode a complete frame payload.
     *
     * @param payload every byte the frame declared
     * @return the decoded token; never {@code null}
     * @throws OobTokenDecodeException if the payload is not a valid token in this format
     */
    OobToken decode(byte[] payload);

    /**
     * Encode a token into a frame payload.
     *
     * @throws IllegalArgumentException if this format cannot carry the token's shape
     */
    byte[] encode(OobToken token);
}
