package io.github.hotbrkm.smtpguard.gateway.smtp.policy.check;

import io.github.hotbrkm.smtpguard.gateway.smtp.error.EnhancedCode;
import io.github.hotbrkm.smtpguard.gateway.smtp.error.SmtpError;
import io.github.hotbrkm.smtpguard.gateway.smtp.util.EmailUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Requires the client's PTR name to equal the hostname it claimed in EHLO.
 */
@Slf4j
public class MatchingRdnsCheck implements IdentityCheck {

    public static final String NAME = "require_matching_rdns";

    @Override
    public CheckResult check(CheckContext context) {
        ConnectionMeta connection = context.connection();
        ReverseDnsName reverseDns = connection.reverseDns();

        if (reverseDns.status() == ReverseDnsName.Status.NOT_ATTEMPTED) {
            log.debug("{} skipped: rDNS lookup is disabled. remote={}", NAME, connection.remoteAddress());
            return CheckResult.pass();
        }

        if (reverseDns.status() == ReverseDnsName.Status.FAILED
                || reverseDns.name() == null || reverseDns.name().isBlank()) {
            // A missing PTR record and a resolver outage look the same here; defer rather than bounce.
            String detail = reverseDns.detail() == null ? "no usable rDNS name" : reverseDns.detail();
            return CheckResult.fail(SmtpError.builder()
                    .code(450)
                    .enhancedCode(EnhancedCode.of(4, 7, 25))
                    .message(DnsFailureReason.MESSAGE)
                    .checkName(NAME)
                    .fields(Map.of(DnsFailureReason.FIELD_REASON, detail))
                    .build());
        }

        String rdnsName = EmailUtil.stripTrailingDot(reverseDns.name());
        String srcHostname = EmailUtil.stripTrailingDot(connection.heloHostname());

        if (rdnsName.equalsIgnoreCase(srcHostname)) {
            log.debug("PTR record {} matches source hostname, OK", rdnsName);
            return CheckResult.pass();
        }

        return CheckResult.fail(SmtpError.builder()
                .code(550)
                .enhancedCode(EnhancedCode.of(5, 7, 25))
                .message("rDNS name does not match source hostname")
                .checkName(NAME)
                .fields(Map.of("rdns", rdnsName, "helo", srcHostname))
                .build());
    }
}
