package com.questrail.p2p.identity;

import com.questrail.p2p.api.Address;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PeerDirectory
 * =============================================================================
 * Resolves transport-level peers to logical {@link Address}es and remembers
 * which ephemeral address belongs to which advertised address.
 *
 * <h2>Why two addresses per peer</h2>
 * A peer that connects to us over TCP does so from an ephemeral source port,
 * but tells us (in {@code PackageMetadata.advertisedPort}) the port it listens
 * on. Handlers must only ever see the advertised address. The transport, on
 * the other hand, wants to reuse the already-open connection keyed by the
 * ephemeral address when it writes back to the advertised one.
 *
 * <h2>Lookup symmetry</h2>
 * Once a pair has been observed, lookup by either nym yields the same
 * {@link PeerNyms} record.
 *
 * <h2>Thread safety</h2>
 * Touched concurrently by receive loops and caller threads. A single monitor
 * guards the table.
 */
public final class PeerDirectory
{
    private final Object lock = new Object();

    // Both keys of every pair point at the same record.
    private final Map<Address, PeerNyms> byNym = new LinkedHashMap<>();

    /**
     * Resolves the logical sender of a package.
     *
     * @param transportPeer  the socket address the package physically arrived from
     * @param advertisedPort the port the sender claims to listen on
     * @return {@code transportPeer.host : advertisedPort}
     */
    public Address resolve(InetSocketAddress transportPeer, int advertisedPort) {
        Objects.requireNonNull(transportPeer, "transportPeer");

        Address ephemeral = Address.of(transportPeer);
        Address advertised = Address.of(transportPeer, advertisedPort);

        if (!ephemeral.equals(advertised)) {
            record(ephemeral, advertised);
        }
        return advertised;
    }

    /**
     * Records an {@code ephemeral ↔ advertised} pair, replacing any earlier
     * pair that shared either nym.
     */
    public void record(Address ephemeral, Address advertised) {
        PeerNyms nyms = new PeerNyms(ephemeral, advertised);
        if (ephemeral.equals(advertised)) {
            return;
        }
        synchronized (lock) {
            PeerNyms existing = byNym.get(ephemeral);
            if (nyms.equals(existing) && nyms.equals(byNym.get(advertised))) {
                return;
            }
            removeLocked(ephemeral);
            removeLocked(advertised);
            byNym.put(ephemeral, nyms);
            byNym.put(advertised, nyms);
        }
    }

    public Optional<PeerNyms> lookup(Address address) {
        Objects.requireNonNull(address, "address");
        synchronized (lock) {
            return Optional.ofNullable(byNym.get(address));
        }
    }

    /**
     * Returns the advertised nym for {@code address}, or {@code address} itself
     * when no pair has been observed.
     */
    public Address advertisedFor(Address address) {
        return lookup(address).map(PeerNyms::advertised).orElse(address);
    }

    /**
     * Returns the ephemeral nym paired with {@code address}, if any.
     */
    public Optional<Address> ephemeralFor(Address address) {
        return lookup(address).map(PeerNyms::ephemeral);
    }

    public boolean sameLogicalPeer(Address a, Address b) {
        return advertisedFor(a).equals(advertisedFor(b));
    }

    /**
     * Drops the pair containing {@code address}, typically when the connection
     * behind the ephemeral nym has closed.
     */
    public void forget(Address address) {
        Objects.requireNonNull(address, "address");
        synchronized (lock) {
            removeLocked(address);
        }
    }

    /**
     * Number of distinct pairs currently known.
     */
    public int size() {
        synchronized (lock) {
            return byNym.size() / 2;
        }
    }

    public List<PeerNyms> snapshot() {
        synchronized (lock) {
            List<PeerNyms> out = new ArrayList<>();
            for (PeerNyms nyms : byNym.values()) {
                if (!out.contains(nyms)) {
                    out.add(nyms);
                }
            }
            return out;
        }
    }

    private void removeLocked(Address address) {
        PeerNyms nyms = byNym.remove(address);
        if (nyms != null) {
            byNym.remove(nyms.ephemeral());
            byNym.remove(nyms.advertised());
        }
    }
}
