package com.questrail.oob.codec.token;

/**
 * Indicates that a fully received frame payload could not be translated into
 * a verification token.
 *
 * This typically reflects:
 * <ul>
 *   <li>An empty raw payload</li>
 *   <li>A structured envelope that does not parse</li>
 *   <li>A structured envelope missing required key material</li>
 * </ul>
 */
public final class OobTokenDecodeException extends RuntimeException
{
    public OobTokenDecodeException(String message) {
        super(message);
    }

    public OobTokenDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
