package com.questrail.oob.channel;

import com.questrail.oob.api.OobChannel;
import com.questrail.oob.api.OobChannelCallback;
import com.questrail.oob.api.OobToken;
import com.questrail.oob.codec.LengthPrefixedFrameReader;
import com.questrail.oob.codec.RawFrame;
import com.questrail.oob.codec.token.OobTokenCodec;
import com.questrail.oob.codec.token.OobTokenDecodeException;
import com.questrail.oob.config.OobChannelConfig;
import com.questrail.oob.observability.NullObservabilitySink;
import com.questrail.oob.observability.OobErrorEvent;
import com.questrail.oob.observability.OobFailureCause;
import com.questrail.oob.observability.OobObservabilitySink;
import com.questrail.oob.observability.OobStateTransitionEvent;
import com.questrail.oob.transport.BondedPeerRegistry;
import com.questrail.oob.transport.OobServiceEndpointFactory;
import com.questrail.oob.transport.PeerConnection;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * DefaultOobChannel
 * =============================================================================
 * Out-of-band verification channel over a blocking point-to-point transport.
 *
 * <h2>Worker sequence</h2>
 * Each activation runs strictly in order on the configured {@link Executor}:
 *
 * <pre>
 *   ConnectionAcceptor.accept        (bounded by acceptTimeout)
 *        → LengthPrefixedFrameReader (length prefix, then payload)
 *            → OobTokenCodec.decode  (per wireFormat)
 *                → OobChannelCallback (exactly once, unless cancelled)
 * </pre>
 *
 * <h2>Cancellation</h2>
 * {@link #stop()} sets the activation's cancellation flag and closes the
 * listening endpoint and the connection it holds. The blocked accept or read
 * then fails with an I/O error, and the worker observes the flag at its next
 * checkpoint and unwinds without invoking the callback.
 *
 * <h2>Exactly-once outcome</h2>
 * The outcome is committed under the channel lock by moving to
 * {@link OobChannelState#SUCCEEDED} or {@link OobChannelState#FAILED}. A
 * {@code stop()} that reaches the lock first suppresses the callback; one that
 * arrives after the commit has no effect. Resources are released, the callback
 * fires, and only then does the channel return to {@link OobChannelState#IDLE}.
 *
 * <h2>Error handling</h2>
 * Nothing thrown inside the worker escapes it. Every failure is reported to the
 * {@link OobObservabilitySink} and surfaces to the caller only as
 * {@link OobChannelCallback#onFailure()}. No failure is retried here.
 */
public final class DefaultOobChannel implements OobChannel
{
    private final OobChannelConfig config;
    private final Executor executor;
    private final OobObservabilitySink observabilitySink;

    private final ConnectionAcceptor acceptor;
    private final LengthPrefixedFrameReader frameReader;
    private final OobTokenCodec tokenCodec;

    private final Object lock = new Object();

    // guarded by lock
    private OobChannelState state = OobChannelState.IDLE;
    private OobActivation current;

    private volatile OobChannelCallback callback;

    /**
     * @param config            channel configuration
     * @param endpointFactory   opens the listening endpoint for each activation
     * @param bondedPeers       reports whether any peer is eligible to connect
     * @param executor          runs the blocking worker sequence; must not be the caller's thread
     * @param observabilitySink receives transitions and diagnostics; may be null
     */
    public DefaultOobChannel(OobChannelConfig config,
                             OobServiceEndpointFactory endpointFactory,
                             BondedPeerRegistry bondedPeers,
                             Executor executor,
                             OobObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.acceptor = new ConnectionAcceptor(
                bondedPeers,
                endpointFactory,
                config.serviceRecord(),
                this.observabilitySink);
        this.frameReader = new LengthPrefixedFrameReader(config.maxPayloadBytes(), this.observabilitySink);
        this.tokenCodec = config.wireFormat().codec();
    }

    @Override
    public void setCallback(OobChannelCallback callback)
    {
        this.callback = callback;
    }

    @Override
    public void start()
    {
        final OobActivation activation;
        synchronized (lock) {
            if (state != OobChannelState.IDLE) {
                throw new IllegalStateException("start() requires an idle channel; state is " + state);
            }
            activation = new OobActivation(lock, observabilitySink);
            current = activation;
            transition(OobChannelState.ACCEPTING);
        }

        try {
            executor.execute(() -> run(activation));
        } catch (RejectedExecutionException e) {
            synchronized (lock) {
                current = null;
                transition(OobChannelState.IDLE);
            }
            throw e;
        }
    }

    @Override
    public void stop()
    {
        synchronized (lock) {
            OobActivation activation = current;
            if (activation == null || !state.isCancellable()) {
                return;
            }
            transition(OobChannelState.CANCELLING);
            activation.cancel();
        }
    }

    public OobChannelState state()
    {
        synchronized (lock) {
            return state;
        }
    }

    public OobChannelConfig config()
    {
        return config;
    }

    // -------------------------------------------------------------------------
    // Worker
    // -------------------------------------------------------------------------

    private void run(OobActivation activation)
    {
        OobToken token = null;
        try {
            token = exchange(activation);
        } catch (RuntimeException e) {
            if (!activation.isCancelled()) {
                report(OobFailureCause.WORKER_FAILED, "Unexpected failure during OOB exchange", e);
            }
        } finally {
            finish(activation, token);
        }
    }

    /**
     * @return the decoded token, or null on failure or cancellation
     */
    private OobToken exchange(OobActivation activation)
    {
        Optional<PeerConnection> accepted = acceptor.accept(activation, config.acceptTimeout());
        if (accepted.isEmpty() || !advance(activation, OobChannelState.CONNECTED)) {
            return null;
        }
        PeerConnection connection = accepted.get();

        final InputStream in;
        try {
            if (!config.readTimeout().isZero()) {
                connection.setReadTimeout(config.readTimeout());
            }
            in = connection.inputStream();
        } catch (IOException e) {
            if (!activation.isCancelled()) {
                report(OobFailureCause.READ_IO_ERROR, "Could not open stream of " + connection, e);
            }
            return null;
        }

        if (!advance(activation, OobChannelState.READING_FRAME)) {
            return null;
        }
        Optional<RawFrame> frame = frameReader.readFrame(in, activation::isCancelled);
        if (frame.isEmpty() || !advance(activation, OobChannelState.DECODING)) {
            return null;
        }

        try {
            return tokenCodec.decode(frame.get().payload());
        } catch (OobTokenDecodeException e) {
            report(OobFailureCause.DECODE_FAILED,
                    "Received " + frame.get().length() + " bytes that are not a valid "
                            + config.wireFormat() + " token",
                    e);
            return null;
        }
    }

    private void finish(OobActivation activation, OobToken token)
    {
        final boolean deliver;
        synchronized (lock) {
            deliver = !activation.isCancelled();
            if (deliver) {
                transition(token != null ? OobChannelState.SUCCEEDED : OobChannelState.FAILED);
            }
        }

        activation.releaseAll();

        if (deliver) {
            deliver(token);
        }

        synchronized (lock) {
            if (current == activation) {
                current = null;
                transition(OobChannelState.IDLE);
            }
        }
    }

    private void deliver(OobToken token)
    {
        OobChannelCallback cb = callback;
        if (cb == null) {
            return;
        }
        try {
            if (token != null) {
                cb.onSuccess(token);
            } else {
                cb.onFailure();
            }
        } catch (RuntimeException e) {
            report(OobFailureCause.CALLBACK_FAILED, "OOB channel callback threw", e);
        }
    }

    /**
     * Checkpoint: move forward unless the activation has been cancelled.
     */
    private boolean advance(OobActivation activation, OobChannelState next)
    {
        synchronized (lock) {
            if (activation.isCancelled() || current != activation) {
                return false;
            }
            transition(next);
            return true;
        }
    }

    // requires lock
    private void transition(OobChannelState next)
    {
        OobChannelState previous = state;
        state = next;
        observabilitySink.onStateTransition(new OobStateTransitionEvent(Instant.now(), previous, next));
    }

    private void report(OobFailureCause cause, String message, Throwable error)
    {
        observabilitySink.onError(new OobErrorEvent(Instant.now(), cause, message, error));
    }
}
