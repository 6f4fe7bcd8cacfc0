package org.overlaynet.api.model;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

/**
 * Point-in-time counts describing the contents of a peer registry.
 */
@XmlAccessorType(XmlAccessType.FIELD)
public class RegistryStats {

	/** Peers whose identity has been verified. */
	public int verifiedPeers;

	/** Address-only entries that are candidates for walking. */
	public int walkableAddresses;

	/** Recorded "introduced by" edges. */
	public int introductions;

	/** Identities with at least one advertised service, verified or not. */
	public int peersWithServices;

	public int blacklistedAddresses;

	public int blacklistedIdentities;

	// For JAXB
	public RegistryStats() {
	}

	public RegistryStats(int verifiedPeers, int walkableAddresses, int introductions, int peersWithServices,
			int blacklistedAddresses, int blacklistedIdentities) {
		this.verifiedPeers = verifiedPeers;
		this.walkableAddresses = walkableAddresses;
		this.introductions = introductions;
		this.peersWithServices = peersWithServices;
		this.blacklistedAddresses = blacklistedAddresses;
		this.blacklistedIdentities = blacklistedIdentities;
	}

	@Override
	public String toString() {
		return String.format("verified: %d, walkable: %d, introductions: %d, with services: %d, blacklisted: %d addresses / %d identities",
				this.verifiedPeers, this.walkableAddresses, this.introductions, this.peersWithServices,
				this.blacklistedAddresses, this.blacklistedIdentities);
	}

}
