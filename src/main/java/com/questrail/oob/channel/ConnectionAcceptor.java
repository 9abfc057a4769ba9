package com.questrail.oob.channel;

import com.questrail.oob.observability.OobErrorEvent;
import com.questrail.oob.observability.OobFailureCause;
import com.questrail.oob.observability.OobObservabilitySink;
import com.questrail.oob.transport.BondedPeerRegistry;
import com.questrail.oob.transport.OobServiceEndpoint;
import com.questrail.oob.transport.OobServiceEndpointFactory;
import com.questrail.oob.transport.OobServiceRecord;
import com.questrail.oob.transport.PeerConnection;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * ConnectionAcceptor
 * -----------------------------------------------------------------------------
 * Produces at most one peer connection per activation.
 *
 * <ol>
 *   <li>No bonded peer: fail immediately, nothing is opened.</li>
 *   <li>Open a listening endpoint under the service record and hand it to the
 *       activation, so {@code stop()} can close it.</li>
 *   <li>Block in a single accept bounded by the timeout.</li>
 *   <li>Release the listening endpoint whatever the outcome.</li>
 *   <li>Hand the accepted connection to the activation. If the activation was
 *       cancelled meanwhile the connection is closed and nothing is returned.</li>
 * </ol>
 */
final class ConnectionAcceptor
{
    private final BondedPeerRegistry bondedPeers;
    private final OobServiceEndpointFactory endpointFactory;
    private final OobServiceRecord serviceRecord;
    private final OobObservabilitySink observabilitySink;

    ConnectionAcceptor(BondedPeerRegistry bondedPeers,
                       OobServiceEndpointFactory endpointFactory,
                       OobServiceRecord serviceRecord,
                       OobObservabilitySink observabilitySink)
    {
        this.bondedPeers = Objects.requireNonNull(bondedPeers, "bondedPeers");
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.serviceRecord = Objects.requireNonNull(serviceRecord, "serviceRecord");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Wait for the peer to connect.
     *
     * @return the connection, now owned by {@code activation}; empty on failure or cancellation
     */
    Optional<PeerConnection> accept(OobActivation activation, Duration timeout)
    {
        if (bondedPeers.bondedPeers().isEmpty()) {
            report(OobFailureCause.NO_ELIGIBLE_PEER,
                    "No peers are bonded, so no connection will be accepted", null);
            return Optional.empty();
        }

        final OobServiceEndpoint endpoint;
        try {
            endpoint = endpointFactory.listen(serviceRecord);
        } catch (IOException e) {
            report(OobFailureCause.LISTEN_FAILED,
                    "Could not listen under service " + serviceRecord.name(), e);
            return Optional.empty();
        }

        if (!activation.adoptEndpoint(endpoint)) {
            return Optional.empty();
        }

        final PeerConnection connection;
        try {
            connection = endpoint.accept(timeout);
        } catch (IOException e) {
            if (!activation.isCancelled()) {
                report(OobFailureCause.ACCEPT_FAILED,
                        "Accepting a connection was aborted or timed out after " + timeout, e);
            }
            activation.releaseEndpoint();
            return Optional.empty();
        }

        // One connection per activation: stop listening right away.
        activation.releaseEndpoint();

        if (!activation.adoptConnection(connection)) {
            return Optional.empty();
        }
        return Optional.of(connection);
    }

    private void report(OobFailureCause cause, String message, Throwable error)
    {
        observabilitySink.onError(new OobErrorEvent(Instant.now(), cause, message, error));
    }
}
