package org.overlaynet.network;

import java.util.Objects;

/**
 * Remote peer whose identity has been established by a completed handshake.
 * <p>
 * Equality is by {@link IdentityKey} only. The address and protocol state may change
 * over the lifetime of the object without affecting identity.
 */
public class VerifiedPeer {

	private final byte[] publicKey;
	private final IdentityKey identityKey;

	private volatile PeerAddress address;

	/** Lamport clock of the last message received from this peer. */
	private long lamportTimestamp = 0L;

	/** Local time of the last response from this peer, in milliseconds. */
	private volatile long lastResponse;

	public VerifiedPeer(byte[] publicKey, PeerAddress address) {
		Objects.requireNonNull(publicKey, "publicKey");
		Objects.requireNonNull(address, "address");

		this.publicKey = publicKey.clone();
		this.identityKey = IdentityKey.fromPublicKey(this.publicKey);
		this.address = address;
		this.lastResponse = System.currentTimeMillis();
	}

	// Getters / setters

	public byte[] getPublicKey() {
		return this.publicKey.clone();
	}

	public IdentityKey getIdentityKey() {
		return this.identityKey;
	}

	public PeerAddress getAddress() {
		return this.address;
	}

	/**
	 * Changes this peer's address.
	 * <p>
	 * When the peer is registered, prefer {@link PeerRegistry#updateAddress(VerifiedPeer, PeerAddress)}
	 * so the registry can absorb any address-only entry for the new address.
	 */
	public void setAddress(PeerAddress address) {
		this.address = Objects.requireNonNull(address, "address");
	}

	public synchronized long getLamportTimestamp() {
		return this.lamportTimestamp;
	}

	/** Advances the Lamport clock to <tt>timestamp</tt> if it is ahead of ours. */
	public synchronized void updateClock(long timestamp) {
		this.lamportTimestamp = Math.max(this.lamportTimestamp, timestamp);
	}

	public long getLastResponse() {
		return this.lastResponse;
	}

	public void touch() {
		this.lastResponse = System.currentTimeMillis();
	}

	// Utilities

	@Override
	public boolean equals(Object other) {
		if (this == other)
			return true;

		if (!(other instanceof VerifiedPeer))
			return false;

		return this.identityKey.equals(((VerifiedPeer) other).identityKey);
	}

	@Override
	public int hashCode() {
		return this.identityKey.hashCode();
	}

	@Override
	public String toString() {
		return String.format("%s@%s", this.identityKey, this.address);
	}

}
