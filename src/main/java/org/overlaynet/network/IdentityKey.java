package org.overlaynet.network;

import com.google.common.io.BaseEncoding;
import com.google.common.primitives.UnsignedBytes;
import org.overlaynet.crypto.Crypto;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Stable identity of a verified peer, derived from the fingerprint of its public key.
 * <p>
 * Peers that share a public key map to equal keys regardless of any other state they carry.
 */
public final class IdentityKey implements Comparable<IdentityKey> {

	private static final Comparator<byte[]> BYTE_ORDER = UnsignedBytes.lexicographicalComparator();

	private final byte[] fingerprint;

	private IdentityKey(byte[] fingerprint) {
		this.fingerprint = fingerprint;
	}

	/** Derives identity key from serialized public key. */
	public static IdentityKey fromPublicKey(byte[] publicKey) {
		return new IdentityKey(Crypto.toFingerprint(publicKey));
	}

	/** Wraps an already-computed fingerprint. */
	public static IdentityKey fromFingerprint(byte[] fingerprint) {
		if (fingerprint.length != Crypto.FINGERPRINT_LENGTH)
			throw new IllegalArgumentException("Fingerprint must be " + Crypto.FINGERPRINT_LENGTH + " bytes, not " + fingerprint.length);

		return new IdentityKey(fingerprint.clone());
	}

	public byte[] getFingerprint() {
		return this.fingerprint.clone();
	}

	@Override
	public int compareTo(IdentityKey other) {
		return BYTE_ORDER.compare(this.fingerprint, other.fingerprint);
	}

	@Override
	public boolean equals(Object other) {
		if (this == other)
			return true;

		if (!(other instanceof IdentityKey))
			return false;

		return Arrays.equals(this.fingerprint, ((IdentityKey) other).fingerprint);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(this.fingerprint);
	}

	/** Base64 rendering of the fingerprint, used as the textual node id. */
	@Override
	public String toString() {
		return BaseEncoding.base64().encode(this.fingerprint);
	}

}
