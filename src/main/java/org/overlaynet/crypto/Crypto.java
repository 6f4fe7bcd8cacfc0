package org.overlaynet.crypto;

import org.bouncycastle.crypto.digests.SHA1Digest;

public abstract class Crypto {

	/** Length of a public key fingerprint, in bytes. */
	public static final int FINGERPRINT_LENGTH = 20;

	private Crypto() {
	}

	/** Returns SHA-1 digest of input. Used to fingerprint public keys. */
	public static byte[] sha1(byte[] input) {
		SHA1Digest digest = new SHA1Digest();
		digest.update(input, 0, input.length);

		byte[] output = new byte[digest.getDigestSize()];
		digest.doFinal(output, 0);

		return output;
	}

	/** Returns fingerprint of serialized public key, as used for node identities. */
	public static byte[] toFingerprint(byte[] publicKey) {
		return sha1(publicKey);
	}

}
