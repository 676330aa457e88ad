package io.github.hotbrkm.smtpguard.gateway.smtp.util;

import java.util.Locale;

/**
 * Utility class for email address operations.
 */
public final class EmailUtil {

    private static final String POSTMASTER = "postmaster";

    private EmailUtil() {
        // Prevent instantiation
    }

    /**
     * Splits an envelope address into local part and domain at the last {@code @}.
     * <p>
     * The bare {@code postmaster} mailbox (RFC 5321 section 4.5.1) has no domain and is returned
     * with an empty one.
     *
     * @param address Envelope address (e.g. user@example.com)
     * @return Local part and domain (domain lowercase)
     * @throws IllegalArgumentException if the address has no {@code @}, or an empty local part or domain
     */
    public static AddressParts split(String address) {
        if (address == null) {
            throw new IllegalArgumentException("address: missing");
        }
        if (POSTMASTER.equalsIgnoreCase(address)) {
            return new AddressParts(address, "");
        }

        int at = address.lastIndexOf('@');
        if (at < 0) {
            throw new IllegalArgumentException("address: missing at-sign: " + address);
        }
        String localPart = address.substring(0, at);
        String domain = address.substring(at + 1);
        if (localPart.isEmpty()) {
            throw new IllegalArgumentException("address: empty local-part: " + address);
        }
        if (domain.isEmpty()) {
            throw new IllegalArgumentException("address: empty domain: " + address);
        }
        return new AddressParts(localPart, domain.toLowerCase(Locale.ROOT));
    }

    /**
     * Removes one trailing dot from a DNS name.
     *
     * @param name Host name, possibly fully qualified (e.g. mail.example.com.)
     * @return Name without the trailing dot, empty for null
     */
    public static String stripTrailingDot(String name) {
        if (name == null) {
            return "";
        }
        return name.endsWith(".") ? name.substring(0, name.length() - 1) : name;
    }

    /**
     * Local part and domain of an envelope address.
     */
    public record AddressParts(String localPart, String domain) {
    }
}
