/**
 * OOB Framing
 * =============================================================================
 *
 * <p>This package implements the <strong>wire-level framing</strong> of the
 * out-of-band channel: a 4-byte unsigned little-endian length prefix followed
 * by exactly that many payload bytes (see {@link com.questrail.oob.codec.OobFraming}).</p>
 *
 * <h2>Architectural Placement</h2>
 *
 * <pre>
 *   InputStream (PeerConnection)
 *        → LengthPrefixedFrameReader   (framing rules applied here)
 *            → RawFrame                (complete, uninterpreted payload)
 *                → OobTokenCodec       (wire format applied here)
 *                    → OobToken
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>A short read of either frame part invalidates the whole exchange;
 *       partial payloads never leave this package.</li>
 *   <li>Payload interpretation belongs to {@code com.questrail.oob.codec.token}.</li>
 * </ul>
 */
package com.questrail.oob.codec;
