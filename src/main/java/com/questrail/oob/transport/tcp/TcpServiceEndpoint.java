package com.questrail.oob.transport.tcp;

import com.questrail.oob.transport.OobServiceEndpoint;
import com.questrail.oob.transport.OobServiceRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link OobServiceEndpoint} over a bound {@link ServerSocket}.
 *
 * <p>{@link #close()} from another thread makes a pending {@link #accept(Duration)}
 * fail with a {@link java.net.SocketException}.</p>
 */
public final class TcpServiceEndpoint implements OobServiceEndpoint
{
    private final ServerSocket serverSocket;
    private final OobServiceRecord record;

    TcpServiceEndpoint(ServerSocket serverSocket, OobServiceRecord record)
    {
        this.serverSocket = Objects.requireNonNull(serverSocket, "serverSocket");
        this.record = Objects.requireNonNull(record, "record");
    }

    @Override
    public TcpPeerConnection accept(Duration timeout) throws IOException
    {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Accept timeout must be positive");
        }

        // SO_TIMEOUT of 0 means "wait forever"; clamp so a sub-millisecond timeout stays bounded.
        serverSocket.setSoTimeout(toTimeoutMillis(timeout));
        Socket socket = serverSocket.accept();
        return new TcpPeerConnection(socket);
    }

    public InetSocketAddress localAddress()
    {
        return (InetSocketAddress) serverSocket.getLocalSocketAddress();
    }

    public OobServiceRecord record()
    {
        return record;
    }

    @Override
    public void close()
    {
        try {
            serverSocket.close();
        } catch (IOException e) {
            // ServerSocket#close only fails if the descriptor is already gone.
            throw new UncheckedIOException("Failed to close listening socket", e);
        }
    }

    static int toTimeoutMillis(Duration timeout)
    {
        long millis = timeout.toMillis();
        if (millis < 1) {
            return 1;
        }
        return (int) Math.min(millis, Integer.MAX_VALUE);
    }

    @Override
    public String toString()
    {
        return "TcpServiceEndpoint[" + record.name() + "@" + serverSocket.getLocalSocketAddress() + "]";
    }
}
