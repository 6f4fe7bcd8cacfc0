package org.overlaynet.network;

import com.google.common.net.HostAndPort;
import com.google.common.net.InetAddresses;
import org.overlaynet.settings.Settings;

import java.net.InetSocketAddress;
import java.util.Locale;

/**
 * Immutable network endpoint of a peer, as reported in introductions or taken from a handshake.
 * <p>
 * Two addresses are equal when their ports match and their host parts match case-insensitively.
 * No DNS lookups are ever performed.
 */
public final class PeerAddress {

	// Properties
	private final String host;
	private final int port;

	/** Host part folded to lower case, used for equality and hashing. */
	private final String normalizedHost;

	// Constructors

	private PeerAddress(String host, int port) {
		this.host = host;
		this.port = port;
		this.normalizedHost = host.toLowerCase(Locale.ROOT);
	}

	/** Constructs new PeerAddress from hostname or literal IP address (IPv6 bracketed) and port. */
	public static PeerAddress of(String host, int port) {
		if (host == null || host.isEmpty())
			throw new IllegalArgumentException("Empty host part");

		if (port < 0 || port > 65535)
			throw new IllegalArgumentException("Port out of range: " + port);

		return new PeerAddress(host, port);
	}

	/** Constructs new PeerAddress using the remote end of an unresolved or resolved socket address. */
	public static PeerAddress fromSocketAddress(InetSocketAddress socketAddress) {
		if (socketAddress.isUnresolved())
			return of(socketAddress.getHostString(), socketAddress.getPort());

		String host = InetAddresses.toUriString(socketAddress.getAddress());
		return new PeerAddress(host, socketAddress.getPort());
	}

	/**
	 * Constructs new PeerAddress using hostname or literal IP address and optional port.<br>
	 * Literal IPv6 addresses must be enclosed within square brackets.
	 * Missing ports default to {@link Settings#getDefaultPort()}.
	 * <p>
	 * Examples:
	 * <ul>
	 * <li>peer.example.com
	 * <li>peer.example.com:12000
	 * <li>192.0.2.1
	 * <li>192.0.2.1:12000
	 * <li>[2001:db8::1]
	 * <li>[2001:db8::1]:12000
	 * </ul>
	 * <p>
	 * Not allowed:
	 * <ul>
	 * <li>2001:db8::1
	 * <li>2001:db8::1:12000
	 * </ul>
	 */
	public static PeerAddress fromString(String addressString) throws IllegalArgumentException {
		return fromString(addressString, Settings.getInstance().getDefaultPort());
	}

	public static PeerAddress fromString(String addressString, int defaultPort) throws IllegalArgumentException {
		boolean isBracketed = addressString.startsWith("[");

		// Attempt to parse string into host and port
		HostAndPort hostAndPort = HostAndPort.fromString(addressString).withDefaultPort(defaultPort).requireBracketsForIPv6();

		String host = hostAndPort.getHost();
		if (host.isEmpty())
			throw new IllegalArgumentException("Empty host part");

		// Validate IP literals by attempting to convert to InetAddress, without DNS lookups
		if (host.contains(":") || host.matches("[0-9.]+"))
			InetAddresses.forString(host);

		// Keep IPv6 literals bracketed
		if (isBracketed)
			host = "[" + host + "]";

		return new PeerAddress(host, hostAndPort.getPort());
	}

	// Getters

	/** Returns hostname or literal IP address, bracketed if IPv6 */
	public String getHost() {
		return this.host;
	}

	public int getPort() {
		return this.port;
	}

	// Utilities

	@Override
	public String toString() {
		return this.host + ":" + this.port;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other)
			return true;

		if (!(other instanceof PeerAddress))
			return false;

		PeerAddress otherAddress = (PeerAddress) other;

		// Ports must match
		if (this.port != otherAddress.port)
			return false;

		// Compare host parts but without DNS lookups
		return this.normalizedHost.equals(otherAddress.normalizedHost);
	}

	@Override
	public int hashCode() {
		return 31 * this.normalizedHost.hashCode() + this.port;
	}

}
