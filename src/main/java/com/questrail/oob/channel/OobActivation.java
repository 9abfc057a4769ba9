package com.questrail.oob.channel;

import com.questrail.oob.observability.OobErrorEvent;
import com.questrail.oob.observability.OobFailureCause;
import com.questrail.oob.observability.OobObservabilitySink;
import com.questrail.oob.transport.OobServiceEndpoint;
import com.questrail.oob.transport.PeerConnection;

import java.time.Instant;
import java.util.Objects;

/**
 * OobActivation
 * -----------------------------------------------------------------------------
 * Resources and cancellation flag of a single channel activation.
 *
 * <p>Every field is accessed under the owning channel's lock, so the worker
 * adopting a resource and a concurrent {@link #cancel()} can never interleave:
 * either the resource is adopted first and cancel closes it, or cancel runs
 * first and the adoption closes the resource itself and reports failure.</p>
 *
 * <p>The cancellation flag is never reset. A new activation gets a new
 * instance, so a worker left over from a cancelled activation keeps seeing
 * its own flag set.</p>
 */
final class OobActivation
{
    private final Object lock;
    private final OobObservabilitySink observabilitySink;

    private volatile boolean cancelled;

    // guarded by lock
    private OobServiceEndpoint endpoint;
    private PeerConnection connection;

    OobActivation(Object lock, OobObservabilitySink observabilitySink)
    {
        this.lock = Objects.requireNonNull(lock, "lock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    boolean isCancelled()
    {
        return cancelled;
    }

    /**
     * Take ownership of a freshly opened endpoint.
     *
     * @return false if the activation was cancelled; the endpoint is closed in that case
     */
    boolean adoptEndpoint(OobServiceEndpoint newEndpoint)
    {
        Objects.requireNonNull(newEndpoint, "newEndpoint");
        synchronized (lock) {
            if (cancelled) {
                closeReporting(newEndpoint);
                return false;
            }
            if (endpoint != null) {
                throw new IllegalStateException("Activation already owns a listening endpoint");
            }
            endpoint = newEndpoint;
            return true;
        }
    }

    /**
     * Take ownership of an accepted connection.
     *
     * @return false if the activation was cancelled; the connection is closed in that case
     */
    boolean adoptConnection(PeerConnection newConnection)
    {
        Objects.requireNonNull(newConnection, "newConnection");
        synchronized (lock) {
            if (cancelled) {
                closeReporting(newConnection);
                return false;
            }
            if (connection != null) {
                throw new IllegalStateException("Activation already owns a peer connection");
            }
            connection = newConnection;
            return true;
        }
    }

    void releaseEndpoint()
    {
        synchronized (lock) {
            OobServiceEndpoint e = endpoint;
            endpoint = null;
            if (e != null) {
                closeReporting(e);
            }
        }
    }

    /**
     * Close whatever is still held. Each resource is closed at most once.
     */
    void releaseAll()
    {
        synchronized (lock) {
            releaseEndpoint();
            PeerConnection c = connection;
            connection = null;
            if (c != null) {
                closeReporting(c);
            }
        }
    }

    /**
     * Set the cancellation flag and force-close held resources, unblocking a
     * pending accept or read.
     */
    void cancel()
    {
        synchronized (lock) {
            cancelled = true;
            releaseAll();
        }
    }

    boolean holdsEndpoint()
    {
        synchronized (lock) {
            return endpoint != null;
        }
    }

    boolean holdsConnection()
    {
        synchronized (lock) {
            return connection != null;
        }
    }

    // Close failures are reported, not propagated: cleanup must reach every resource.
    private void closeReporting(AutoCloseable resource)
    {
        try {
            resource.close();
        } catch (Exception e) {
            observabilitySink.onError(new OobErrorEvent(
                    Instant.now(),
                    OobFailureCause.CLEANUP_FAILED,
                    "Failed to close " + resource,
                    e));
        }
    }
}
