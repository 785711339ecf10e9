package com.questrail.p2p.identity;

import com.questrail.p2p.api.Address;

import java.util.Objects;

/**
 * The two names one remote peer is known by: the ephemeral address its
 * packages arrived from, and the advertised address it listens on. Both share
 * the same host.
 */
public record PeerNyms(Address ephemeral, Address advertised)
{
    public PeerNyms {
        Objects.requireNonNull(ephemeral, "ephemeral");
        Objects.requireNonNull(advertised, "advertised");
        if (!ephemeral.host().equals(advertised.host())) {
            throw new IllegalArgumentException("Nyms must share a host: " + ephemeral + " / " + advertised);
        }
    }

    public boolean matches(Address address) {
        return ephemeral.equals(address) || advertised.equals(address);
    }
}
