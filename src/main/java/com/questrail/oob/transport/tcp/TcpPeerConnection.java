package com.questrail.oob.transport.tcp;

import com.questrail.oob.transport.PeerConnection;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.Socket;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link PeerConnection} over an accepted TCP {@link Socket}.
 */
public final class TcpPeerConnection implements PeerConnection
{
    private final Socket socket;

    TcpPeerConnection(Socket socket)
    {
        this.socket = Objects.requireNonNull(socket, "socket");
    }

    @Override
    public InputStream inputStream() throws IOException
    {
        return socket.getInputStream();
    }

    @Override
    public void setReadTimeout(Duration timeout) throws IOException
    {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Read timeout must be non-negative");
        }
        socket.setSoTimeout(timeout.isZero() ? 0 : TcpServiceEndpoint.toTimeoutMillis(timeout));
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return socket.getRemoteSocketAddress();
    }

    @Override
    public void close()
    {
        // Closing the socket also closes its streams and unblocks a pending read.
        try {
            socket.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close peer socket", e);
        }
    }

    @Override
    public String toString()
    {
        return "TcpPeerConnection[" + socket.getRemoteSocketAddress() + "]";
    }
}
