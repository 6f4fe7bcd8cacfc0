package org.overlaynet.test.common;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.overlaynet.network.PeerAddress;
import org.overlaynet.network.VerifiedPeer;

import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicInteger;

public class PeerUtils {

	private static final SecureRandom RANDOM = new SecureRandom();

	// Keeps generated addresses unique across a test run
	private static final AtomicInteger addressCounter = new AtomicInteger(1);

	private PeerUtils() {
	}

	public static byte[] generatePublicKey() {
		Ed25519PrivateKeyParameters privateKey = new Ed25519PrivateKeyParameters(RANDOM);
		return privateKey.generatePublicKey().getEncoded();
	}

	public static PeerAddress nextAddress() {
		int n = addressCounter.getAndIncrement();
		return PeerAddress.of(String.format("10.%d.%d.%d", (n >> 16) & 0xff, (n >> 8) & 0xff, n & 0xff), 1024 + (n % 60000));
	}

	public static VerifiedPeer generatePeer() {
		return new VerifiedPeer(generatePublicKey(), nextAddress());
	}

	public static VerifiedPeer[] generatePeers(int count) {
		VerifiedPeer[] peers = new VerifiedPeer[count];
		for (int i = 0; i < count; ++i)
			peers[i] = generatePeer();

		return peers;
	}

	/** Returns a different object carrying the same public key and address. */
	public static VerifiedPeer copyOf(VerifiedPeer peer) {
		return new VerifiedPeer(peer.getPublicKey(), peer.getAddress());
	}

}
