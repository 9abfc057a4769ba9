package com.questrail.oob.codec.token;

/**
 * Interpretation applied to a frame payload.
 */
public enum OobWireFormat
{
    /** Payload is a serialized association envelope. */
    STRUCTURED(new AssociationTokenCodec()),

    /** Payload is the token, verbatim. */
    RAW(new RawOobTokenCodec());

    private final OobTokenCodec codec;

    OobWireFormat(OobTokenCodec codec)
    {
        this.codec = codec;
    }

    public OobTokenCodec codec()
    {
        return codec;
    }
}
