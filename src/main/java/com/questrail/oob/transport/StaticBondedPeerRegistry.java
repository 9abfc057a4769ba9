package com.questrail.oob.transport;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed {@link BondedPeerRegistry}, for deployments where the set of eligible
 * peers is provisioned rather than discovered.
 */
public final class StaticBondedPeerRegistry implements BondedPeerRegistry
{
    private final Set<String> peers;

    private StaticBondedPeerRegistry(Set<String> peers)
    {
        this.peers = Collections.unmodifiableSet(new LinkedHashSet<>(peers));
    }

    public static StaticBondedPeerRegistry of(String... peers)
    {
        Objects.requireNonNull(peers, "peers");
        Set<String> set = new LinkedHashSet<>();
        for (String peer : peers) {
            set.add(Objects.requireNonNull(peer, "peer"));
        }
        return new StaticBondedPeerRegistry(set);
    }

    public static StaticBondedPeerRegistry empty()
    {
        return new StaticBondedPeerRegistry(Set.of());
    }

    @Override
    public Set<String> bondedPeers()
    {
        return peers;
    }
}
