package com.questrail.oob.transport;

import java.util.Set;

/**
 * Source of the peers this device has previously bonded with at the
 * platform level.
 *
 * <p>The channel only asks whether the set is empty: with no bonded peer no
 * connection can be established, so no listening endpoint is opened.</p>
 */
@FunctionalInterface
public interface BondedPeerRegistry
{
    /**
     * Returns the identifiers of the currently bonded peers; never {@code null}.
     */
    Set<String> bondedPeers();
}
