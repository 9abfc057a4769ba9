package com.questrail.oob.transport;

import java.util.Objects;
import java.util.UUID;

/**
 * Service record under which a listening endpoint is registered.
 *
 * <p>Both the name and the identifier are cross-implementation constants:
 * the connecting peer looks the service up by them. {@link #DEFAULT} carries
 * the values deployed peers expect.</p>
 *
 * @param name human-readable service name
 * @param id   service identifier
 */
public record OobServiceRecord(String name, UUID id)
{
    // TODO: switch to a per-session identifier once peers can discover it over the primary link.
    /**
     * The well-known record shared with deployed peers.
     *
     * <p>The identifier is fixed rather than generated per session.</p>
     */
    public static final OobServiceRecord DEFAULT = new OobServiceRecord(
            "batmobile_oob",
            UUID.fromString("00001101-0000-1000-8000-00805F9B34FB"));

    public OobServiceRecord
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(id, "id");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Service name must not be blank");
        }
    }
}
