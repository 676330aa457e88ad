package io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns;

import lombok.Getter;

/**
 * Failed DNS lookup, kept as the cause of the SMTP reason built from it.
 */
@Getter
public class DnsLookupException extends Exception {

    private final String query;
    private final DnsResolver.QueryStatus status;

    public DnsLookupException(String query, DnsResolver.QueryStatus status, String detail) {
        super("lookup " + query + ": " + (detail == null || detail.isBlank() ? status.name().toLowerCase() : detail));
        this.query = query;
        this.status = status;
    }

    public boolean isTemporary() {
        return status == DnsResolver.QueryStatus.TEMP_ERROR;
    }
}
