package org.overlaynet.network;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.Set;

/**
 * Addresses and identities that must never be registered.
 * <p>
 * Address entries stop introduced addresses and verified peers at those addresses.
 * Identity entries stop verified peers with matching identity keys, whatever their address.
 */
public class Blacklist {

	private static final Logger LOGGER = LogManager.getLogger(Blacklist.class);

	private final Set<PeerAddress> addresses = new HashSet<>();
	private final Set<IdentityKey> identities = new HashSet<>();

	public void add(PeerAddress address) {
		synchronized (this.addresses) {
			if (this.addresses.add(address))
				LOGGER.debug("Blacklisted address {}", address);
		}
	}

	public void add(IdentityKey identityKey) {
		synchronized (this.identities) {
			if (this.identities.add(identityKey))
				LOGGER.debug("Blacklisted identity {}", identityKey);
		}
	}

	public boolean isBlacklisted(PeerAddress address) {
		synchronized (this.addresses) {
			return this.addresses.contains(address);
		}
	}

	public boolean isBlacklisted(IdentityKey identityKey) {
		synchronized (this.identities) {
			return this.identities.contains(identityKey);
		}
	}

	public int addressCount() {
		synchronized (this.addresses) {
			return this.addresses.size();
		}
	}

	public int identityCount() {
		synchronized (this.identities) {
			return this.identities.size();
		}
	}

}
