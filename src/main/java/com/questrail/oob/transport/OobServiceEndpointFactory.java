package com.questrail.oob.transport;

import java.io.IOException;

/**
 * Opens listening endpoints registered under a service record.
 */
public interface OobServiceEndpointFactory
{
    /**
     * Open a new listening endpoint and register it under {@code record}.
     *
     * @throws IOException if the listening resource cannot be allocated
     */
    OobServiceEndpoint listen(OobServiceRecord record) throws IOException;
}
