package com.questrail.oob.transport;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;

/**
 * OobServiceEndpoint
 * -----------------------------------------------------------------------------
 * Listening side of the out-of-band transport.
 *
 * <p>An endpoint is opened for a single accept attempt and closed afterwards.
 * {@link #close()} may be called from any thread; an {@link #accept(Duration)}
 * blocked in another thread must then fail with an {@link IOException}. This
 * is the only cancellation mechanism the channel relies on.</p>
 */
public interface OobServiceEndpoint extends Closeable
{
    /**
     * Block until a peer connects or the timeout elapses.
     *
     * @param timeout upper bound on the wait; must be positive
     * @return the accepted connection
     * @throws IOException on timeout, transport failure, or concurrent closure
     */
    PeerConnection accept(Duration timeout) throws IOException;

    /**
     * Release the listening resource. Idempotent.
     */
    @Override
    void close();
}
