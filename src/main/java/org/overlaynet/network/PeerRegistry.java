package org.overlaynet.network;

import com.google.common.io.BaseEncoding;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.overlaynet.api.model.RegistryStats;
import org.overlaynet.network.ProvenanceGraph.NodeKey;
import org.overlaynet.network.ProvenanceGraph.NodeType;
import org.overlaynet.settings.Settings;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Bookkeeping of the peers this node knows about.
 * <p>
 * Tracks verified peers, addresses heard about through introductions but not yet verified,
 * who introduced which address, and which services each identity advertises.
 * <p>
 * Inputs arrive straight from untrusted network traffic, so unknown, duplicate, stale or blacklisted
 * entities never cause exceptions: the corresponding call is simply a no-op.
 * <p>
 * All methods are thread-safe and guarded by a single lock.
 */
public class PeerRegistry {

	private static final Logger LOGGER = LogManager.getLogger(PeerRegistry.class);

	private final ReentrantLock registryLock = new ReentrantLock();

	private final ProvenanceGraph graph = new ProvenanceGraph();
	private final VerifiedPeerIndex verifiedPeers = new VerifiedPeerIndex();
	private final ServiceIndex services = new ServiceIndex();
	private final Blacklist blacklist;

	public PeerRegistry() {
		this(new Blacklist());
	}

	public PeerRegistry(Blacklist blacklist) {
		this.blacklist = Objects.requireNonNull(blacklist, "blacklist");
	}

	/** Builds a registry whose blacklist is pre-loaded from current {@link Settings}. */
	public static PeerRegistry fromSettings() {
		Settings settings = Settings.getInstance();
		Blacklist blacklist = new Blacklist();

		for (String addressString : settings.getBlacklist()) {
			try {
				blacklist.add(PeerAddress.fromString(addressString, settings.getDefaultPort()));
			} catch (IllegalArgumentException e) {
				LOGGER.warn("Ignoring invalid blacklisted address '{}': {}", addressString, e.getMessage());
			}
		}

		for (String publicKeyHex : settings.getBlacklistedPublicKeys()) {
			try {
				byte[] publicKey = BaseEncoding.base16().lowerCase().decode(publicKeyHex.toLowerCase());
				blacklist.add(IdentityKey.fromPublicKey(publicKey));
			} catch (IllegalArgumentException e) {
				LOGGER.warn("Ignoring invalid blacklisted public key '{}': {}", publicKeyHex, e.getMessage());
			}
		}

		LOGGER.debug("Loaded blacklist with {} addresses and {} identities", blacklist.addressCount(), blacklist.identityCount());

		return new PeerRegistry(blacklist);
	}

	public Blacklist getBlacklist() {
		return this.blacklist;
	}

	// Mutations

	/**
	 * Records that <tt>introducer</tt> told us about <tt>address</tt>.
	 * <p>
	 * The introducer is registered as verified. The address becomes walkable and its introducer is recorded,
	 * unless the address is blacklisted, already belongs to a verified peer, or already has a live introducer.
	 * An address whose introducer has been removed is adopted by the new introducer.
	 */
	public void discoverAddress(VerifiedPeer introducer, PeerAddress address) {
		this.registryLock.lock();
		try {
			if (this.blacklist.isBlacklisted(introducer.getIdentityKey())) {
				LOGGER.debug("Ignoring introduction of {} by blacklisted identity {}", address, introducer);
				return;
			}

			// Blacklisted introducer addresses don't stop registration, only introduced ones do
			this.registerPeer(introducer, false);

			if (this.blacklist.isBlacklisted(address)) {
				LOGGER.trace("Ignoring introduction of blacklisted address {} by {}", address, introducer);
				return;
			}

			if (this.verifiedPeers.getByAddress(address) != null) {
				LOGGER.trace("Ignoring introduction of {} by {}: already verified", address, introducer);
				return;
			}

			NodeKey addressKey = NodeKey.ofAddress(address);
			if (this.graph.hasParent(addressKey)) {
				LOGGER.trace("Ignoring introduction of {} by {}: already introduced by {}", address, introducer,
						this.graph.getParent(addressKey));
				return;
			}

			boolean isNew = this.graph.addNode(addressKey);
			this.graph.addEdge(NodeKey.ofPeer(introducer.getIdentityKey()), addressKey);

			if (isNew)
				LOGGER.debug("Peer {} introduced new address {}", introducer, address);
			else
				LOGGER.debug("Peer {} adopted orphaned address {}", introducer, address);
		} finally {
			this.registryLock.unlock();
		}
	}

	/**
	 * Merges <tt>services</tt> into the set advertised by <tt>peer</tt>'s identity,
	 * whether or not that peer is verified.
	 */
	public void discoverServices(VerifiedPeer peer, Collection<ServiceId> services) {
		this.registryLock.lock();
		try {
			if (this.blacklist.isBlacklisted(peer.getIdentityKey())) {
				LOGGER.debug("Ignoring services announced by blacklisted identity {}", peer);
				return;
			}

			int added = this.services.merge(peer.getIdentityKey(), services);
			if (added > 0)
				LOGGER.trace("Peer {} advertises {} new service(s)", peer, added);
		} finally {
			this.registryLock.unlock();
		}
	}

	/**
	 * Registers <tt>peer</tt> as verified.
	 * <p>
	 * If its address was only known through an introduction, that entry is promoted in place,
	 * keeping its introducer. Re-adding an already verified identity changes nothing.
	 * Peers at blacklisted addresses, or with blacklisted identities, are ignored.
	 */
	public void addVerifiedPeer(VerifiedPeer peer) {
		this.registryLock.lock();
		try {
			this.registerPeer(peer, true);
		} finally {
			this.registryLock.unlock();
		}
	}

	/**
	 * Moves a verified peer to a new address.
	 * <p>
	 * Any address-only entry for the new address is folded into the peer's entry.
	 * Moves to blacklisted addresses, or to the address of another verified peer, are ignored.
	 *
	 * @return true if the address was changed
	 */
	public boolean updateAddress(VerifiedPeer peer, PeerAddress newAddress) {
		this.registryLock.lock();
		try {
			VerifiedPeer stored = this.verifiedPeers.get(peer.getIdentityKey());
			if (stored == null) {
				LOGGER.trace("Not updating address of unverified peer {}", peer);
				return false;
			}

			if (this.blacklist.isBlacklisted(newAddress)) {
				LOGGER.debug("Ignoring move of peer {} to blacklisted address {}", stored, newAddress);
				return false;
			}

			VerifiedPeer occupant = this.verifiedPeers.getByAddress(newAddress);
			if (occupant != null && !occupant.equals(stored)) {
				LOGGER.debug("Ignoring move of peer {} to {}: address held by verified peer {}", stored, newAddress,
						occupant.getIdentityKey());
				return false;
			}

			PeerAddress oldAddress = stored.getAddress();
			stored.setAddress(newAddress);
			if (stored != peer)
				peer.setAddress(newAddress);

			LOGGER.debug("Peer {} moved from {}", stored, oldAddress);

			this.reconcileAddress(stored);
			return true;
		} finally {
			this.registryLock.unlock();
		}
	}

	/**
	 * Forgets <tt>peer</tt>, matched by identity or else by its address.
	 * <p>
	 * Addresses it introduced stay walkable, but without an introducer.
	 * Its recorded services are dropped.
	 */
	public void removePeer(VerifiedPeer peer) {
		this.registryLock.lock();
		try {
			IdentityKey identityKey = peer.getIdentityKey();

			if (this.graph.removeNode(NodeKey.ofPeer(identityKey)))
				LOGGER.debug("Removed verified peer {}", peer);
			else if (this.graph.removeNode(NodeKey.ofAddress(peer.getAddress())))
				LOGGER.debug("Removed address-only entry {}", peer.getAddress());
			else
				LOGGER.trace("Not removing unknown peer {}", peer);

			this.forgetIdentity(identityKey);
		} finally {
			this.registryLock.unlock();
		}
	}

	/**
	 * Forgets whatever is known at <tt>address</tt>: the verified peer currently there,
	 * and any address-only entry.
	 */
	public void removeByAddress(PeerAddress address) {
		this.registryLock.lock();
		try {
			boolean removed = this.graph.removeNode(NodeKey.ofAddress(address));

			VerifiedPeer peer = this.verifiedPeers.getByAddress(address);
			if (peer != null) {
				this.graph.removeNode(NodeKey.ofPeer(peer.getIdentityKey()));
				this.forgetIdentity(peer.getIdentityKey());
				removed = true;
			}

			if (removed && peer != null)
				LOGGER.debug("Removed {} (peer {})", address, peer.getIdentityKey());
			else if (removed)
				LOGGER.debug("Removed {}", address);
			else
				LOGGER.trace("Not removing unknown address {}", address);
		} finally {
			this.registryLock.unlock();
		}
	}

	// Queries

	/** Returns addresses that are known but not verified, in order of discovery. */
	public List<PeerAddress> getWalkableAddresses() {
		return this.getWalkableAddresses(null);
	}

	/**
	 * Returns addresses that are known but not verified, in order of discovery.
	 * <p>
	 * If <tt>service</tt> is not null, only addresses whose direct introducer advertises that service are returned.
	 */
	public List<PeerAddress> getWalkableAddresses(ServiceId service) {
		this.registryLock.lock();
		try {
			Set<PeerAddress> verifiedAddresses = this.verifiedPeers.stream()
					.map(VerifiedPeer::getAddress)
					.collect(Collectors.toSet());

			List<PeerAddress> walkable = new ArrayList<>();
			for (NodeKey key : this.graph.getNodes(NodeType.ADDRESS)) {
				PeerAddress address = key.getAddress();

				// Blacklist may have grown since discovery
				if (verifiedAddresses.contains(address) || this.blacklist.isBlacklisted(address))
					continue;

				if (service != null && !this.introducerProvides(key, service))
					continue;

				walkable.add(address);
			}

			return walkable;
		} finally {
			this.registryLock.unlock();
		}
	}

	/** Returns unverified addresses introduced by <tt>peer</tt>, in introduction order. */
	public List<PeerAddress> getIntroductionsFrom(VerifiedPeer peer) {
		this.registryLock.lock();
		try {
			List<PeerAddress> introductions = new ArrayList<>();
			for (NodeKey child : this.graph.getChildren(NodeKey.ofPeer(peer.getIdentityKey())))
				if (child.getType() == NodeType.ADDRESS)
					introductions.add(child.getAddress());

			return introductions;
		} finally {
			this.registryLock.unlock();
		}
	}

	/** Returns the verified peer that introduced <tt>address</tt>, or null if unknown or orphaned. */
	public VerifiedPeer getIntroducer(PeerAddress address) {
		this.registryLock.lock();
		try {
			NodeKey parent = this.graph.getParent(NodeKey.ofAddress(address));
			if (parent == null || parent.getType() != NodeType.PEER)
				return null;

			return this.verifiedPeers.get(parent.getIdentityKey());
		} finally {
			this.registryLock.unlock();
		}
	}

	/** Returns services advertised by <tt>peer</tt>'s identity, verified or not. */
	public Set<ServiceId> getServicesForPeer(VerifiedPeer peer) {
		this.registryLock.lock();
		try {
			return this.services.get(peer.getIdentityKey());
		} finally {
			this.registryLock.unlock();
		}
	}

	/** Returns verified peers advertising <tt>service</tt>. */
	public Set<VerifiedPeer> getPeersForService(ServiceId service) {
		this.registryLock.lock();
		try {
			Set<VerifiedPeer> providers = new LinkedHashSet<>();
			for (VerifiedPeer peer : this.verifiedPeers.snapshot())
				if (this.services.provides(peer.getIdentityKey(), service))
					providers.add(peer);

			return Collections.unmodifiableSet(providers);
		} finally {
			this.registryLock.unlock();
		}
	}

	public VerifiedPeer getVerifiedByAddress(PeerAddress address) {
		this.registryLock.lock();
		try {
			return this.verifiedPeers.getByAddress(address);
		} finally {
			this.registryLock.unlock();
		}
	}

	public VerifiedPeer getVerifiedByPublicKey(byte[] publicKey) {
		this.registryLock.lock();
		try {
			return this.verifiedPeers.getByPublicKey(publicKey);
		} finally {
			this.registryLock.unlock();
		}
	}

	/** Returns read-only snapshot of verified peers, in order of verification. */
	public Set<VerifiedPeer> getVerifiedPeers() {
		this.registryLock.lock();
		try {
			return this.verifiedPeers.snapshot();
		} finally {
			this.registryLock.unlock();
		}
	}

	public RegistryStats getStats() {
		this.registryLock.lock();
		try {
			return new RegistryStats(this.verifiedPeers.size(), this.getWalkableAddresses().size(), this.graph.edgeCount(),
					this.services.size(), this.blacklist.addressCount(), this.blacklist.identityCount());
		} finally {
			this.registryLock.unlock();
		}
	}

	// Internals, must hold registryLock

	private boolean registerPeer(VerifiedPeer peer, boolean checkAddress) {
		if (this.blacklist.isBlacklisted(peer.getIdentityKey())) {
			LOGGER.debug("Not registering blacklisted identity {}", peer);
			return false;
		}

		if (checkAddress && this.blacklist.isBlacklisted(peer.getAddress())) {
			LOGGER.debug("Not registering peer {} at blacklisted address", peer);
			return false;
		}

		NodeKey peerKey = NodeKey.ofPeer(peer.getIdentityKey());
		if (this.graph.hasNode(peerKey)) {
			// Stored instance may have moved since it was registered
			this.reconcileAddress(this.verifiedPeers.get(peer.getIdentityKey()));
			return false;
		}

		if (this.graph.replaceNode(NodeKey.ofAddress(peer.getAddress()), peerKey))
			LOGGER.debug("Promoted address {} to verified peer {}", peer.getAddress(), peer.getIdentityKey());
		else
			this.graph.addNode(peerKey);

		this.verifiedPeers.add(peer);
		LOGGER.debug("Added verified peer {}", peer);

		return true;
	}

	/** Folds any address-only entry at <tt>peer</tt>'s current address into its peer entry. */
	private void reconcileAddress(VerifiedPeer peer) {
		NodeKey addressKey = NodeKey.ofAddress(peer.getAddress());
		if (this.graph.mergeInto(addressKey, NodeKey.ofPeer(peer.getIdentityKey())))
			LOGGER.debug("Absorbed address-only entry {} into verified peer {}", peer.getAddress(), peer.getIdentityKey());
	}

	private void forgetIdentity(IdentityKey identityKey) {
		this.verifiedPeers.remove(identityKey);
		this.services.remove(identityKey);
	}

	private boolean introducerProvides(NodeKey addressKey, ServiceId service) {
		NodeKey parent = this.graph.getParent(addressKey);
		return parent != null && parent.getType() == NodeType.PEER && this.services.provides(parent.getIdentityKey(), service);
	}

}
