package io.github.hotbrkm.smtpguard.gateway.smtp.policy.check;

import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.DnsResolver;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.LookupContext;

/**
 * Input of an identity check.
 *
 * @param connection    client connection facts
 * @param mailFrom      envelope return-path, empty or null for bounces
 * @param resolver      DNS resolver
 * @param lookupContext deadline and cancellation for the check's lookups
 */
public record CheckContext(ConnectionMeta connection,
                           String mailFrom,
                           DnsResolver resolver,
                           LookupContext lookupContext) {
}
