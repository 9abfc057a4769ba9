package com.questrail.oob.runtime;

import com.questrail.oob.api.AssociationOobToken;
import com.questrail.oob.api.OobChannelCallback;
import com.questrail.oob.api.OobToken;
import com.questrail.oob.api.RawOobToken;
import com.questrail.oob.api.RecordingCallback;
import com.questrail.oob.channel.OobChannelState;
import com.questrail.oob.codec.token.OobWireFormat;
import com.questrail.oob.config.OobChannelConfig;
import com.questrail.oob.observability.OobFailureCause;
import com.questrail.oob.observability.RecordingObservabilitySink;
import com.questrail.oob.transport.FakeOobServiceEndpointFactory;
import com.questrail.oob.transport.StaticBondedPeerRegistry;
import com.questrail.oob.transport.tcp.netty.NettyOobTokenSender;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests over loopback TCP: a real listening socket on the channel
 * side and a Netty sender or a plain socket on the peer side.
 */
class OobChannelRuntimeTest {

    private static InetSocketAddress freeLoopbackAddress() throws IOException {
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            return new InetSocketAddress(InetAddress.getLoopbackAddress(), probe.getLocalPort());
        }
    }

    private static OobChannelRuntime runtime(InetSocketAddress address,
                                             OobWireFormat wireFormat,
                                             OobChannelCallback callback,
                                             RecordingObservabilitySink sink) {
        return OobChannelRuntime.builder()
                .withConfig(OobChannelConfig.builder()
                        .withWireFormat(wireFormat)
                        .withAcceptTimeout(Duration.ofSeconds(10))
                        .withReadTimeout(Duration.ofSeconds(5))
                        .build())
                .withBindAddress(address)
                .withBondedPeers(StaticBondedPeerRegistry.of("peer-1"))
                .withCallback(callback)
                .withObservabilitySink(sink)
                .build();
    }

    /**
     * The channel binds on its worker thread, so the peer retries until the
     * listening socket exists.
     */
    private static void sendWhenListening(NettyOobTokenSender sender, InetSocketAddress address, OobToken token)
            throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (true) {
            try {
                sender.send(address, token).get(5, TimeUnit.SECONDS);
                return;
            } catch (ExecutionException e) {
                if (System.nanoTime() > deadline) {
                    throw e;
                }
                Thread.sleep(20);
            }
        }
    }

    private static Socket connectWhenListening(InetSocketAddress address) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (true) {
            try {
                return new Socket(address.getAddress(), address.getPort());
            } catch (ConnectException e) {
                if (System.nanoTime() > deadline) {
                    throw e;
                }
                Thread.sleep(20);
            }
        }
    }

    private static void awaitIdle(OobChannelRuntime runtime) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (runtime.state() != OobChannelState.IDLE) {
            if (System.nanoTime() > deadline) {
                fail("Channel stuck in " + runtime.state());
            }
            Thread.sleep(5);
        }
    }

    @Test
    void structuredTokenIsReceivedOverLoopback() throws Exception {
        InetSocketAddress address = freeLoopbackAddress();
        RecordingCallback callback = new RecordingCallback();
        AssociationOobToken sent = new AssociationOobToken(
                new byte[] {0x11, 0x22, 0x33, 0x44},
                new byte[] {0x01, 0x02, 0x03},
                new byte[] {0x0A, 0x0B, 0x0C});

        try (OobChannelRuntime runtime = runtime(address, OobWireFormat.STRUCTURED, callback,
                     new RecordingObservabilitySink());
             NettyOobTokenSender sender = new NettyOobTokenSender(OobWireFormat.STRUCTURED)) {
            runtime.start();
            sendWhenListening(sender, address, sent);

            assertTrue(callback.awaitOutcome(5, TimeUnit.SECONDS));
            awaitIdle(runtime);
        }

        assertEquals(List.of(sent), callback.successes());
        assertEquals(0, callback.failures());
    }

    @Test
    void rawTokenIsReceivedOverLoopback() throws Exception {
        InetSocketAddress address = freeLoopbackAddress();
        RecordingCallback callback = new RecordingCallback();
        RawOobToken sent = new RawOobToken("hello".getBytes(StandardCharsets.US_ASCII));

        try (OobChannelRuntime runtime = runtime(address, OobWireFormat.RAW, callback,
                     new RecordingObservabilitySink());
             NettyOobTokenSender sender = new NettyOobTokenSender(OobWireFormat.RAW)) {
            runtime.start();
            sendWhenListening(sender, address, sent);

            assertTrue(callback.awaitOutcome(5, TimeUnit.SECONDS));
        }

        assertEquals(List.of(sent), callback.successes());
    }

    @Test
    void truncatedPayloadFailsOverLoopback() throws Exception {
        InetSocketAddress address = freeLoopbackAddress();
        RecordingCallback callback = new RecordingCallback();
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        try (OobChannelRuntime runtime = runtime(address, OobWireFormat.RAW, callback, sink)) {
            runtime.start();

            try (Socket peer = connectWhenListening(address)) {
                OutputStream out = peer.getOutputStream();
                out.write(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(100).array());
                out.write(new byte[10]);
                out.flush();
            }

            assertTrue(callback.awaitOutcome(5, TimeUnit.SECONDS));
            awaitIdle(runtime);
        }

        assertEquals(1, callback.failures());
        assertTrue(callback.successes().isEmpty());
        assertEquals(List.of(OobFailureCause.READ_END_OF_STREAM), sink.getFailureCauses());
    }

    @Test
    void listeningSocketIsReleasedAfterAccept() throws Exception {
        InetSocketAddress address = freeLoopbackAddress();
        RecordingCallback callback = new RecordingCallback();

        try (OobChannelRuntime runtime = runtime(address, OobWireFormat.RAW, callback,
                     new RecordingObservabilitySink());
             NettyOobTokenSender sender = new NettyOobTokenSender(OobWireFormat.RAW)) {
            runtime.start();
            sendWhenListening(sender, address, new RawOobToken(new byte[] {1}));
            assertTrue(callback.awaitOutcome(5, TimeUnit.SECONDS));
            awaitIdle(runtime);

            try (ServerSocket rebound = new ServerSocket()) {
                rebound.setReuseAddress(true);
                assertDoesNotThrow(() -> rebound.bind(address));
            }
        }
    }

    @Test
    void stopWhileAcceptingSuppressesCallback() throws Exception {
        InetSocketAddress address = freeLoopbackAddress();
        RecordingCallback callback = new RecordingCallback();

        try (OobChannelRuntime runtime = runtime(address, OobWireFormat.RAW, callback,
                     new RecordingObservabilitySink())) {
            runtime.start();
            Thread.sleep(100);

            runtime.stop();
            awaitIdle(runtime);

            assertFalse(callback.awaitOutcome(200, TimeUnit.MILLISECONDS));
        }
        assertEquals(0, callback.invocations());
    }

    @Test
    void closeCancelsActivationInFlight() throws Exception {
        InetSocketAddress address = freeLoopbackAddress();
        RecordingCallback callback = new RecordingCallback();
        OobChannelRuntime runtime = runtime(address, OobWireFormat.RAW, callback, new RecordingObservabilitySink());

        runtime.start();
        Thread.sleep(100);
        runtime.close();

        assertEquals(OobChannelState.IDLE, runtime.state());
        assertEquals(0, callback.invocations());
    }

    @Test
    void callbackRunsOnDedicatedWorkerThread() throws Exception {
        FakeOobServiceEndpointFactory transport = new FakeOobServiceEndpointFactory();
        CompletableFuture<String> callbackThread = new CompletableFuture<>();

        try (OobChannelRuntime runtime = OobChannelRuntime.builder()
                .withEndpointFactory(transport)
                .withBondedPeers(StaticBondedPeerRegistry.empty())
                .withCallback(new OobChannelCallback() {
                    @Override
                    public void onSuccess(OobToken token) {
                        callbackThread.complete(Thread.currentThread().getName());
                    }

                    @Override
                    public void onFailure() {
                        callbackThread.complete(Thread.currentThread().getName());
                    }
                })
                .build()) {
            runtime.start();

            assertEquals(OobChannelRuntime.WORKER_THREAD_NAME, callbackThread.get(5, TimeUnit.SECONDS));
        }
        assertTrue(transport.opened().isEmpty());
    }

    @Test
    void builderRequiresBondedPeers() {
        assertThrows(NullPointerException.class, () -> OobChannelRuntime.builder()
                .withBindAddress(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0))
                .build());
    }

    @Test
    void builderRequiresTransport() {
        assertThrows(NullPointerException.class, () -> OobChannelRuntime.builder()
                .withBondedPeers(StaticBondedPeerRegistry.of("peer-1"))
                .build());
    }
}
