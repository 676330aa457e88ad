package io.github.hotbrkm.smtpguard.gateway.smtp.policy.check;

import io.github.hotbrkm.smtpguard.gateway.smtp.error.EnhancedCode;
import io.github.hotbrkm.smtpguard.gateway.smtp.error.SmtpError;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.DnsResolver;
import io.github.hotbrkm.smtpguard.gateway.smtp.util.IpAddressUtil;
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.util.Optional;

/**
 * Requires the EHLO hostname to resolve to the client's IP, or an EHLO address literal to be
 * the client's IP.
 */
@Slf4j
public class MatchingEhloCheck implements IdentityCheck {

    public static final String NAME = "require_matching_ehlo";

    private static final EnhancedCode POLICY_VIOLATION = EnhancedCode.of(5, 7, 0);

    @Override
    public CheckResult check(CheckContext context) {
        ConnectionMeta connection = context.connection();
        Optional<InetAddress> clientIp = connection.ipAddress();
        if (clientIp.isEmpty()) {
            log.debug("{} skipped: non-TCP/IP source. remote={}", NAME, connection.remoteAddress());
            return CheckResult.pass();
        }

        String ehlo = connection.heloHostname();
        if (ehlo == null || ehlo.isBlank()) {
            return fail("No EHLO hostname");
        }

        if (IpAddressUtil.isAddressLiteral(ehlo)) {
            Optional<InetAddress> ehloIp = IpAddressUtil.parseAddressLiteral(ehlo);
            if (ehloIp.isEmpty()) {
                return fail("Malformed IP in EHLO");
            }
            if (!IpAddressUtil.sameAddress(ehloIp.get(), clientIp.get())) {
                return fail("IP in EHLO is not the same as actual client IP");
            }
            return CheckResult.pass();
        }

        String query = ehlo + " A/AAAA";
        DnsResolver.QueryResult result = context.resolver().addressLookup(ehlo, context.lookupContext());
        if (result.isFailure() || result.status() == DnsResolver.QueryStatus.NO_RECORDS) {
            return CheckResult.fail(DnsFailureReason.of(NAME, query, result));
        }

        for (InetAddress address : result.addresses()) {
            if (IpAddressUtil.sameAddress(address, clientIp.get())) {
                log.debug("A/AAAA record found for {} for {} domain", clientIp.get().getHostAddress(), ehlo);
                return CheckResult.pass();
            }
        }
        if (result.partialFailure() != null) {
            // the family that failed may hold the client's address
            return CheckResult.fail(DnsFailureReason.of(NAME, query, result.partialFailure()));
        }
        return fail("No matching A/AAAA records found for EHLO hostname");
    }

    private static CheckResult fail(String message) {
        return CheckResult.fail(SmtpError.builder()
                .code(550)
                .enhancedCode(POLICY_VIOLATION)
                .message(message)
                .checkName(NAME)
                .build());
    }
}
