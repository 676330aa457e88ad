package io.github.hotbrkm.smtpguard.gateway.smtp.policy.check;

import io.github.hotbrkm.smtpguard.gateway.smtp.error.EnhancedCode;
import io.github.hotbrkm.smtpguard.gateway.smtp.error.SmtpError;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.DnsResolver;
import io.github.hotbrkm.smtpguard.gateway.smtp.util.EmailUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Requires the domain of the envelope sender to publish at least one MX record.
 * <p>
 * The null reverse-path of bounces is always accepted.
 */
@Slf4j
public class MxRecordCheck implements IdentityCheck {

    public static final String NAME = "require_mx_record";

    @Override
    public CheckResult check(CheckContext context) {
        String mailFrom = context.mailFrom();
        if (mailFrom == null || mailFrom.isEmpty()) {
            return CheckResult.pass();
        }

        EmailUtil.AddressParts parts;
        try {
            parts = EmailUtil.split(mailFrom);
        } catch (IllegalArgumentException e) {
            return CheckResult.fail(SmtpError.builder()
                    .code(501)
                    .enhancedCode(EnhancedCode.of(5, 1, 7))
                    .message("Malformed sender address")
                    .checkName(NAME)
                    .cause(e)
                    .build());
        }

        String domain = parts.domain();
        if (domain.isEmpty()) {
            return CheckResult.fail(SmtpError.builder()
                    .code(501)
                    .enhancedCode(EnhancedCode.of(5, 1, 8))
                    .message("No domain part")
                    .checkName(NAME)
                    .build());
        }

        if (context.connection().ipAddress().isEmpty()) {
            log.debug("{} skipped: non-TCP/IP source. remote={}", NAME, context.connection().remoteAddress());
            return CheckResult.pass();
        }

        DnsResolver.QueryResult result = context.resolver().mxLookup(domain, context.lookupContext());
        if (result.isFailure()) {
            return CheckResult.fail(DnsFailureReason.of(NAME, domain + " MX", result));
        }

        List<String> mxHosts = result.mxHosts();
        if (mxHosts.isEmpty()) {
            return CheckResult.fail(SmtpError.builder()
                    .code(501)
                    .enhancedCode(EnhancedCode.of(5, 7, 27))
                    .message("Domain in MAIL FROM has no MX records")
                    .checkName(NAME)
                    .build());
        }

        log.debug("MX records found for {}: {}", domain, mxHosts);
        return CheckResult.pass();
    }
}
