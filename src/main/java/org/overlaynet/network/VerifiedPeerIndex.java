package org.overlaynet.network;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * The set of verified peers, keyed by {@link IdentityKey}.
 * <p>
 * Provides lookups of a peer by identity, by public key, or by its current address.
 * <p>
 * Address lookups always read each peer's <b>current</b> address, so a peer
 * that moves is found at its new address without any re-indexing.
 * <p>
 * Not thread-safe: {@link PeerRegistry} serializes all access.
 */
public class VerifiedPeerIndex {

    private final Map<IdentityKey, VerifiedPeer> peersByIdentity = new LinkedHashMap<>();

    /**
     * Adds a peer unless one with the same identity is already present.
     *
     * @param peer the peer to add.
     * @return true if the peer was added, false if its identity was already known.
     */
    public boolean add(VerifiedPeer peer) {
        return this.peersByIdentity.putIfAbsent(peer.getIdentityKey(), peer) == null;
    }

    /**
     * Removes the peer with the given identity.
     *
     * @param identityKey identity of the peer to remove.
     * @return the removed peer, or null if not present.
     */
    public VerifiedPeer remove(IdentityKey identityKey) {
        return this.peersByIdentity.remove(identityKey);
    }

    /**
     * Returns the stored peer with the given identity.
     * <p>
     * This is the instance first registered, which may differ from
     * other instances carrying the same identity.
     *
     * @param identityKey the identity to search for.
     * @return the matching peer, or null if not found.
     */
    public VerifiedPeer get(IdentityKey identityKey) {
        return this.peersByIdentity.get(identityKey);
    }

    /**
     * Returns the peer whose current address matches.
     *
     * @param address the address to search for.
     * @return the matching peer, or null if not found.
     */
    public VerifiedPeer getByAddress(PeerAddress address) {
        if (address == null)
            return null;

        for (VerifiedPeer peer : this.peersByIdentity.values())
            if (address.equals(peer.getAddress()))
                return peer;

        return null;
    }

    /**
     * Returns the peer with the given serialized public key.
     *
     * @param publicKey the public key to search for.
     * @return the matching peer, or null if not found.
     */
    public VerifiedPeer getByPublicKey(byte[] publicKey) {
        if (publicKey == null)
            return null;

        VerifiedPeer peer = this.peersByIdentity.get(IdentityKey.fromPublicKey(publicKey));
        if (peer == null || !Arrays.equals(peer.getPublicKey(), publicKey))
            return null;

        return peer;
    }

    /**
     * Returns an immutable snapshot of the verified peers, in registration order.
     *
     * @return a read-only set.
     */
    public Set<VerifiedPeer> snapshot() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(this.peersByIdentity.values()));
    }

    public Stream<VerifiedPeer> stream() {
        return this.peersByIdentity.values().stream();
    }

    public int size() {
        return this.peersByIdentity.size();
    }
}
