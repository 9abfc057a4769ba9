package com.questrail.oob.transport.tcp;

import com.questrail.oob.transport.OobServiceEndpoint;
import com.questrail.oob.transport.OobServiceEndpointFactory;
import com.questrail.oob.transport.OobServiceRecord;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.Objects;

/**
 * TcpServiceEndpointFactory
 * =============================================================================
 * Opens blocking {@link ServerSocket}-backed endpoints on a fixed local address.
 *
 * <p>TCP has no service registry, so the {@link OobServiceRecord} is carried by
 * the endpoint for diagnostics only; peers are expected to know the address.
 * Binding to port {@code 0} picks an ephemeral port, which is then available
 * from {@link TcpServiceEndpoint#localAddress()}.</p>
 */
public final class TcpServiceEndpointFactory implements OobServiceEndpointFactory
{
    private final InetSocketAddress bindAddress;

    public TcpServiceEndpointFactory(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
    }

    @Override
    public TcpServiceEndpoint listen(OobServiceRecord record) throws IOException
    {
        Objects.requireNonNull(record, "record");

        ServerSocket serverSocket = new ServerSocket();
        try {
            serverSocket.setReuseAddress(true);
            // Backlog of one: a single connection is accepted per endpoint.
            serverSocket.bind(bindAddress, 1);
        } catch (IOException e) {
            serverSocket.close();
            throw e;
        }
        return new TcpServiceEndpoint(serverSocket, record);
    }

    public InetSocketAddress bindAddress()
    {
        return bindAddress;
    }
}
