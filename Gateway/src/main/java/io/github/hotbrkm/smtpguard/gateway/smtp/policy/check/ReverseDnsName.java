package io.github.hotbrkm.smtpguard.gateway.smtp.policy.check;

import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.DnsResolver;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.LookupContext;

import java.net.InetAddress;
import java.util.List;

/**
 * Reverse DNS name of the connecting client.
 *
 * @param status whether a lookup was made and how it ended
 * @param name   PTR name when {@link Status#RESOLVED}
 * @param detail error text when {@link Status#FAILED}
 */
public record ReverseDnsName(Status status, String name, String detail) {

    private static final ReverseDnsName NOT_ATTEMPTED = new ReverseDnsName(Status.NOT_ATTEMPTED, null, null);

    public enum Status {
        /** rDNS lookups are disabled or the peer has no IP address. */
        NOT_ATTEMPTED,
        RESOLVED,
        FAILED
    }

    public static ReverseDnsName notAttempted() {
        return NOT_ATTEMPTED;
    }

    public static ReverseDnsName resolved(String name) {
        return new ReverseDnsName(Status.RESOLVED, name, null);
    }

    public static ReverseDnsName failed(String detail) {
        return new ReverseDnsName(Status.FAILED, null, detail);
    }

    /**
     * Looks up the PTR record of an address. The first PTR name wins.
     */
    public static ReverseDnsName lookup(DnsResolver resolver, InetAddress address, LookupContext context) {
        DnsResolver.QueryResult result = resolver.ptrLookup(address, context);
        List<String> names = result.ptrNames();
        if (result.status() == DnsResolver.QueryStatus.SUCCESS && !names.isEmpty()) {
            return resolved(names.get(0));
        }
        String detail = result.detail();
        if (detail == null || detail.isBlank()) {
            detail = "no PTR record for " + address.getHostAddress() + " (" + result.status() + ")";
        }
        return failed(detail);
    }
}
