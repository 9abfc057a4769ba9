package com.questrail.oob.api;

/**
 * Canonical representation of a verification token received over the
 * out-of-band channel.
 *
 * <p>The channel itself treats tokens as opaque. The two shapes mirror the
 * two supported wire formats:</p>
 * <ul>
 *   <li>{@link RawOobToken}: the payload bytes, verbatim</li>
 *   <li>{@link AssociationOobToken}: key material unpacked from a structured
 *       association envelope</li>
 * </ul>
 */
public sealed interface OobToken
        permits RawOobToken, AssociationOobToken
{
}
