package org.overlaynet.network;

import com.google.common.io.BaseEncoding;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Opaque capability identifier advertised by peers.
 * <p>
 * The registry never interprets the bytes, only compares them.
 */
public final class ServiceId {

	public static final int LENGTH = 20;

	private final byte[] bytes;

	private ServiceId(byte[] bytes) {
		this.bytes = bytes;
	}

	public static ServiceId fromBytes(byte[] bytes) {
		if (bytes.length != LENGTH)
			throw new IllegalArgumentException("Service ID must be " + LENGTH + " bytes, not " + bytes.length);

		return new ServiceId(bytes.clone());
	}

	/** Each character of the string maps to one byte (ISO-8859-1). */
	public static ServiceId fromString(String value) {
		return fromBytes(value.getBytes(StandardCharsets.ISO_8859_1));
	}

	public static ServiceId fromHex(String hex) {
		return fromBytes(BaseEncoding.base16().lowerCase().decode(hex.toLowerCase()));
	}

	public byte[] getBytes() {
		return this.bytes.clone();
	}

	@Override
	public boolean equals(Object other) {
		if (this == other)
			return true;

		if (!(other instanceof ServiceId))
			return false;

		return Arrays.equals(this.bytes, ((ServiceId) other).bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(this.bytes);
	}

	@Override
	public String toString() {
		return BaseEncoding.base16().lowerCase().encode(this.bytes);
	}

}
