package io.github.hotbrkm.smtpguard.gateway.smtp.util;

import org.xbill.DNS.Address;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Utility class for IP address operations.
 * <p>
 * Address literals are parsed without touching DNS.
 */
public final class IpAddressUtil {

    private static final String IPV6_TAG = "ipv6:";

    private IpAddressUtil() {
        // Prevent instantiation
    }

    /**
     * Extracts the IP address of a peer.
     *
     * @param remote Remote socket address
     * @return IP address, or empty if the transport is not IP based
     */
    public static Optional<InetAddress> ipAddressOf(SocketAddress remote) {
        if (remote instanceof InetSocketAddress inet && inet.getAddress() != null) {
            return Optional.of(inet.getAddress());
        }
        return Optional.empty();
    }

    /**
     * Checks if an EHLO argument is an address literal such as {@code [192.0.2.1]}.
     *
     * @param hostname EHLO argument
     * @return true if enclosed in square brackets
     */
    public static boolean isAddressLiteral(String hostname) {
        return hostname != null
                && hostname.length() >= 2
                && hostname.startsWith("[")
                && hostname.endsWith("]");
    }

    /**
     * Parses the content of an address literal.
     * <p>
     * Accepts an IPv4 dotted quad, a plain IPv6 address, or the RFC 5321 {@code IPv6:} tagged form.
     *
     * @param literal EHLO argument including the brackets (e.g. "[192.0.2.1]")
     * @return Parsed address, or empty if malformed
     */
    public static Optional<InetAddress> parseAddressLiteral(String literal) {
        if (!isAddressLiteral(literal)) {
            return Optional.empty();
        }
        String value = literal.substring(1, literal.length() - 1).trim();
        if (value.toLowerCase(Locale.ROOT).startsWith(IPV6_TAG)) {
            value = value.substring(IPV6_TAG.length());
            if (Address.toByteArray(value, Address.IPv6) == null) {
                return Optional.empty();
            }
        }
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Address.getByAddress(value));
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }

    /**
     * Compares two addresses, treating an IPv4-mapped IPv6 address as its IPv4 form.
     *
     * @param first  First address
     * @param second Second address
     * @return true if both denote the same IP
     */
    public static boolean sameAddress(InetAddress first, InetAddress second) {
        if (first == null || second == null) {
            return false;
        }
        return Arrays.equals(normalize(first.getAddress()), normalize(second.getAddress()));
    }

    private static byte[] normalize(byte[] raw) {
        if (raw.length != 16) {
            return raw;
        }
        for (int i = 0; i < 10; i++) {
            if (raw[i] != 0) {
                return raw;
            }
        }
        if (raw[10] != (byte) 0xff || raw[11] != (byte) 0xff) {
            return raw;
        }
        return Arrays.copyOfRange(raw, 12, 16);
    }
}
