package com.questrail.oob.transport;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketAddress;
import java.time.Duration;

/**
 * PeerConnection
 * -----------------------------------------------------------------------------
 * A single accepted connection to the peer device.
 *
 * <p>As with {@link OobServiceEndpoint}, {@link #close()} may be invoked from a
 * thread other than the one reading; a read blocked on {@link #inputStream()}
 * must then fail with an {@link IOException}.</p>
 */
public interface PeerConnection extends Closeable
{
    /**
     * Returns the readable byte stream of this connection.
     *
     * @throws IOException if the stream is no longer available
     */
    InputStream inputStream() throws IOException;

    /**
     * Bound each subsequent blocking read. {@link Duration#ZERO} disables the bound.
     *
     * @throws IOException if the underlying transport rejects the setting
     */
    void setReadTimeout(Duration timeout) throws IOException;

    /** Remote address for diagnostics; may be {@code null} if unknown. */
    SocketAddress remoteAddress();

    /**
     * Close the stream and the connection. Idempotent.
     */
    @Override
    void close();
}
