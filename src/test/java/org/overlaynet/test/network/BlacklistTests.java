package org.overlaynet.test.network;

import org.junit.Before;
import org.junit.Test;
import org.overlaynet.network.Blacklist;
import org.overlaynet.network.PeerAddress;
import org.overlaynet.network.PeerRegistry;
import org.overlaynet.network.ServiceId;
import org.overlaynet.network.VerifiedPeer;
import org.overlaynet.test.common.Common;
import org.overlaynet.test.common.PeerUtils;

import java.util.List;

import static org.junit.Assert.*;

public class BlacklistTests extends Common {

	private static final ServiceId SERVICE = ServiceId.fromString("00000000000000000000");

	private Blacklist blacklist;
	private PeerRegistry registry;
	private VerifiedPeer[] peers;

	@Before
	public void beforeTest() {
		Common.useDefaultSettings();

		this.blacklist = new Blacklist();
		this.registry = new PeerRegistry(this.blacklist);
		this.peers = PeerUtils.generatePeers(3);
	}

	@Test
	public void testAddressMembership() {
		PeerAddress address = PeerAddress.of("192.0.2.1", 12000);

		assertFalse(blacklist.isBlacklisted(address));
		blacklist.add(address);
		blacklist.add(PeerAddress.of("192.0.2.1", 12000));

		assertTrue(blacklist.isBlacklisted(address));
		assertFalse(blacklist.isBlacklisted(PeerAddress.of("192.0.2.1", 12001)));
		assertEquals(1, blacklist.addressCount());
	}

	@Test
	public void testBlacklistedAddressNeverWalkable() {
		blacklist.add(peers[1].getAddress());

		registry.discoverAddress(peers[0], peers[1].getAddress());
		registry.discoverAddress(peers[2], peers[1].getAddress());

		assertFalse(registry.getWalkableAddresses().contains(peers[1].getAddress()));
		assertNull(registry.getIntroducer(peers[1].getAddress()));
		assertTrue(registry.getIntroductionsFrom(peers[0]).isEmpty());
		assertTrue(registry.getIntroductionsFrom(peers[2]).isEmpty());
	}

	@Test
	public void testBlacklistedIdentityNotRegistered() {
		blacklist.add(peers[0].getIdentityKey());

		registry.addVerifiedPeer(peers[0]);

		assertTrue(registry.getVerifiedPeers().isEmpty());
		assertNull(registry.getVerifiedByPublicKey(peers[0].getPublicKey()));
	}

	@Test
	public void testBlacklistedIdentityIntroductionsIgnored() {
		blacklist.add(peers[0].getIdentityKey());

		registry.discoverAddress(peers[0], peers[1].getAddress());

		assertTrue(registry.getVerifiedPeers().isEmpty());
		assertTrue(registry.getWalkableAddresses().isEmpty());
	}

	@Test
	public void testBlacklistedIdentityServicesIgnored() {
		blacklist.add(peers[0].getIdentityKey());

		registry.discoverServices(peers[0], List.of(SERVICE));

		assertTrue(registry.getServicesForPeer(peers[0]).isEmpty());
	}

	@Test
	public void testBlacklistedIdentityAtAnyAddress() {
		blacklist.add(peers[0].getIdentityKey());

		VerifiedPeer elsewhere = new VerifiedPeer(peers[0].getPublicKey(), PeerUtils.nextAddress());
		registry.addVerifiedPeer(elsewhere);

		assertTrue(registry.getVerifiedPeers().isEmpty());
	}

}
