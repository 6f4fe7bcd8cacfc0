package org.overlaynet.test.network;

import org.junit.Before;
import org.junit.Test;
import org.overlaynet.network.PeerAddress;
import org.overlaynet.network.PeerRegistry;
import org.overlaynet.network.VerifiedPeer;
import org.overlaynet.test.common.Common;
import org.overlaynet.test.common.PeerUtils;

import java.util.List;

import static org.junit.Assert.*;

public class AddressChangeTests extends Common {

	private PeerRegistry registry;
	private VerifiedPeer[] peers;

	@Before
	public void beforeTest() {
		Common.useDefaultSettings();

		this.registry = new PeerRegistry();
		this.peers = PeerUtils.generatePeers(4);
	}

	@Test
	public void testLookupFollowsNewAddress() {
		registry.addVerifiedPeer(peers[0]);
		PeerAddress oldAddress = peers[0].getAddress();
		PeerAddress newAddress = PeerUtils.nextAddress();

		assertTrue(registry.updateAddress(peers[0], newAddress));

		assertEquals(newAddress, peers[0].getAddress());
		assertEquals(peers[0], registry.getVerifiedByAddress(newAddress));
		assertNull(registry.getVerifiedByAddress(oldAddress));
	}

	@Test
	public void testMoveOntoWalkableAddressAbsorbsIt() {
		registry.addVerifiedPeer(peers[0]);
		registry.discoverAddress(peers[1], peers[2].getAddress());
		registry.discoverAddress(peers[1], peers[3].getAddress());

		registry.updateAddress(peers[0], peers[2].getAddress());

		assertEquals(List.of(peers[3].getAddress()), registry.getWalkableAddresses());
		assertEquals(List.of(peers[3].getAddress()), registry.getIntroductionsFrom(peers[1]));
		assertEquals(peers[0], registry.getVerifiedByAddress(peers[2].getAddress()));

		// Introduction of the absorbed address is inherited by the moved peer
		assertEquals(2, registry.getStats().introductions);
		registry.removePeer(peers[1]);
		assertEquals(0, registry.getStats().introductions);
	}

	@Test
	public void testMoveToBlacklistedAddressIgnored() {
		registry.addVerifiedPeer(peers[0]);
		PeerAddress oldAddress = peers[0].getAddress();
		PeerAddress blacklisted = PeerUtils.nextAddress();
		registry.getBlacklist().add(blacklisted);

		assertFalse(registry.updateAddress(peers[0], blacklisted));

		assertEquals(oldAddress, peers[0].getAddress());
		assertEquals(peers[0], registry.getVerifiedByAddress(oldAddress));
	}

	@Test
	public void testMoveOfUnverifiedPeerIgnored() {
		PeerAddress oldAddress = peers[0].getAddress();

		assertFalse(registry.updateAddress(peers[0], PeerUtils.nextAddress()));

		assertEquals(oldAddress, peers[0].getAddress());
		assertTrue(registry.getVerifiedPeers().isEmpty());
	}

	@Test
	public void testMoveOntoOtherVerifiedPeerRefused() {
		registry.addVerifiedPeer(peers[0]);
		registry.addVerifiedPeer(peers[1]);
		PeerAddress occupied = peers[0].getAddress();
		PeerAddress oldAddress = peers[1].getAddress();

		assertFalse(registry.updateAddress(peers[1], occupied));

		assertEquals(oldAddress, peers[1].getAddress());
		assertEquals(peers[0], registry.getVerifiedByAddress(occupied));
		assertEquals(peers[1], registry.getVerifiedByAddress(oldAddress));

		// Removing by the occupied address only drops its holder
		registry.removeByAddress(occupied);
		assertNull(registry.getVerifiedByAddress(occupied));
		assertEquals(peers[1], registry.getVerifiedByAddress(oldAddress));
		assertEquals(1, registry.getVerifiedPeers().size());
	}

	@Test
	public void testMoveViaOtherInstanceUpdatesStoredPeer() {
		registry.addVerifiedPeer(peers[0]);
		VerifiedPeer copy = PeerUtils.copyOf(peers[0]);
		PeerAddress newAddress = PeerUtils.nextAddress();

		registry.updateAddress(copy, newAddress);

		assertEquals(newAddress, peers[0].getAddress());
		assertEquals(newAddress, copy.getAddress());
	}

	@Test
	public void testDirectMutationReconciledOnReAdd() {
		registry.addVerifiedPeer(peers[0]);
		registry.discoverAddress(peers[1], peers[2].getAddress());

		// Address changed behind the registry's back
		peers[0].setAddress(peers[2].getAddress());
		assertTrue(registry.getWalkableAddresses().isEmpty());

		registry.addVerifiedPeer(peers[0]);

		assertTrue(registry.getWalkableAddresses().isEmpty());
		assertTrue(registry.getIntroductionsFrom(peers[1]).isEmpty());
		assertEquals(1, registry.getStats().introductions);
	}

	@Test
	public void testIntroductionsSurviveMove() {
		registry.discoverAddress(peers[0], peers[1].getAddress());

		registry.updateAddress(peers[0], PeerUtils.nextAddress());

		assertEquals(List.of(peers[1].getAddress()), registry.getIntroductionsFrom(peers[0]));
		assertEquals(peers[0], registry.getIntroducer(peers[1].getAddress()));
	}

}
