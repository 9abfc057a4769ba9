package com.questrail.oob.runtime;

import com.questrail.oob.api.OobChannel;
import com.questrail.oob.api.OobChannelCallback;
import com.questrail.oob.channel.DefaultOobChannel;
import com.questrail.oob.channel.OobChannelState;
import com.questrail.oob.config.OobChannelConfig;
import com.questrail.oob.observability.NullObservabilitySink;
import com.questrail.oob.observability.OobObservabilitySink;
import com.questrail.oob.transport.BondedPeerRegistry;
import com.questrail.oob.transport.OobServiceEndpointFactory;
import com.questrail.oob.transport.tcp.TcpServiceEndpointFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * OobChannelRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a production OOB channel.
 *
 * <p>Wires the TCP transport, the bonded-peer registry, the channel and its
 * observability sink, and owns the dedicated worker thread the channel's
 * blocking calls run on. {@link #close()} cancels any activation in flight and
 * shuts the worker down.</p>
 *
 * <pre>
 *   OobChannelRuntime runtime = OobChannelRuntime.builder()
 *           .withBindAddress(new InetSocketAddress(7420))
 *           .withBondedPeers(registry)
 *           .withCallback(callback)
 *           .build();
 *   runtime.start();
 * </pre>
 */
public final class OobChannelRuntime implements OobChannel, AutoCloseable {

    static final String WORKER_THREAD_NAME = "oob-channel-worker";

    private final DefaultOobChannel channel;
    private final ExecutorService workerExecutor;

    private OobChannelRuntime(DefaultOobChannel channel, ExecutorService workerExecutor) {
        this.channel = channel;
        this.workerExecutor = workerExecutor;
    }

    @Override
    public void start() {
        channel.start();
    }

    @Override
    public void stop() {
        channel.stop();
    }

    @Override
    public void setCallback(OobChannelCallback callback) {
        channel.setCallback(callback);
    }

    public OobChannelState state() {
        return channel.state();
    }

    @Override
    public void close() {
        channel.stop();
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private OobChannelConfig config = OobChannelConfig.defaults();
        private InetSocketAddress bindAddress;
        private OobServiceEndpointFactory endpointFactory;
        private BondedPeerRegistry bondedPeers;
        private OobChannelCallback callback;
        private OobObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(OobChannelConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Listen over TCP on {@code address}. Ignored when an endpoint factory is set.
         */
        public Builder withBindAddress(InetSocketAddress address) {
            this.bindAddress = address;
            return this;
        }

        /**
         * Use a transport other than TCP.
         */
        public Builder withEndpointFactory(OobServiceEndpointFactory factory) {
            this.endpointFactory = factory;
            return this;
        }

        public Builder withBondedPeers(BondedPeerRegistry bondedPeers) {
            this.bondedPeers = bondedPeers;
            return this;
        }

        public Builder withCallback(OobChannelCallback callback) {
            this.callback = callback;
            return this;
        }

        public Builder withObservabilitySink(OobObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public OobChannelRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(bondedPeers, "bondedPeers");

            // 1. Transport
            OobServiceEndpointFactory factory = endpointFactory;
            if (factory == null) {
                Objects.requireNonNull(bindAddress, "bindAddress or endpointFactory");
                factory = new TcpServiceEndpointFactory(bindAddress);
            }

            // 2. Dedicated worker; the channel blocks for the accept timeout and beyond
            ExecutorService worker = Executors.newSingleThreadExecutor(runnable -> {
                Thread t = new Thread(runnable, WORKER_THREAD_NAME);
                t.setDaemon(true);
                return t;
            });

            // 3. Channel
            DefaultOobChannel channel = new DefaultOobChannel(
                config,
                factory,
                bondedPeers,
                worker,
                observabilitySink
            );
            channel.setCallback(callback);

            return new OobChannelRuntime(channel, worker);
        }
    }
}
