package com.questrail.oob.transport.tcp.netty;

import com.questrail.oob.api.AssociationOobToken;
import com.questrail.oob.api.RawOobToken;
import com.questrail.oob.codec.token.OobWireFormat;

import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class NettyOobTokenSenderTest {

    private static byte[] receiveAll(ServerSocket server) throws IOException {
        try (Socket socket = server.accept()) {
            socket.setSoTimeout(5_000);
            return socket.getInputStream().readAllBytes();
        }
    }

    @Test
    void rawTokenIsWrittenWithLittleEndianPrefix() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
             NettyOobTokenSender sender = new NettyOobTokenSender(OobWireFormat.RAW)) {
            server.setSoTimeout(5_000);
            InetSocketAddress target = (InetSocketAddress) server.getLocalSocketAddress();

            sender.send(target, new RawOobToken("hello".getBytes(StandardCharsets.US_ASCII)));
            byte[] received = receiveAll(server);

            assertArrayEquals(new byte[] {0x05, 0x00, 0x00, 0x00, 'h', 'e', 'l', 'l', 'o'}, received);
        }
    }

    @Test
    void structuredTokenIsWrittenAsSingleFrame() throws Exception {
        AssociationOobToken token = new AssociationOobToken(new byte[16], new byte[12], new byte[12]);
        byte[] expectedPayload = OobWireFormat.STRUCTURED.codec().encode(token);

        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
             NettyOobTokenSender sender = new NettyOobTokenSender(OobWireFormat.STRUCTURED)) {
            server.setSoTimeout(5_000);

            sender.send((InetSocketAddress) server.getLocalSocketAddress(), token);

            try (Socket socket = server.accept()) {
                socket.setSoTimeout(5_000);
                DataInputStream in = new DataInputStream(socket.getInputStream());
                int declared = Integer.reverseBytes(in.readInt());
                byte[] payload = new byte[declared];
                in.readFully(payload);

                assertEquals(expectedPayload.length, declared);
                assertArrayEquals(expectedPayload, payload);
                assertEquals(-1, in.read());
            }
        }
    }

    @Test
    void sendCompletesAfterFlush() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
             NettyOobTokenSender sender = new NettyOobTokenSender(OobWireFormat.RAW)) {
            server.setSoTimeout(5_000);

            CompletableFuture<Void> future = sender.send((InetSocketAddress) server.getLocalSocketAddress(), new RawOobToken(new byte[] {9}));
            receiveAll(server);

            assertNull(future.get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void connectionRefusedCompletesExceptionally() throws IOException {
        InetSocketAddress closed;
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closed = (InetSocketAddress) probe.getLocalSocketAddress();
        }

        try (NettyOobTokenSender sender = new NettyOobTokenSender(OobWireFormat.RAW)) {
            CompletableFuture<Void> future = sender.send(closed, new RawOobToken(new byte[] {1}));
            assertThrows(ExecutionException.class, () -> future.get(15, TimeUnit.SECONDS));
        }
    }

    @Test
    void tokenOutsideWireFormatIsRejectedBeforeConnecting() {
        try (NettyOobTokenSender sender = new NettyOobTokenSender(OobWireFormat.STRUCTURED)) {
            InetSocketAddress anywhere = new InetSocketAddress(InetAddress.getLoopbackAddress(), 1);
            assertThrows(IllegalArgumentException.class,
                    () -> sender.send(anywhere, new RawOobToken(new byte[] {1})));
        }
    }
}
