package io.github.hotbrkm.smtpguard.gateway.smtp.policy.check;

import io.github.hotbrkm.smtpguard.gateway.smtp.error.EnhancedCode;
import io.github.hotbrkm.smtpguard.gateway.smtp.error.SmtpError;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.DnsLookupException;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.DnsResolver;

import java.util.Map;

/**
 * Reason reported when a check's own DNS lookup fails.
 */
final class DnsFailureReason {

    static final String MESSAGE = "DNS lookup failure during policy check";
    static final String FIELD_REASON = "reason";

    private static final EnhancedCode TEMPORARY = EnhancedCode.of(4, 7, 27);
    private static final EnhancedCode PERMANENT = EnhancedCode.of(5, 7, 27);

    private DnsFailureReason() {
    }

    /**
     * 420 4.7.27 for temporary failures, 501 5.7.27 otherwise.
     * <p>
     * Resolver errors carry no context of their own, so the raw text is also put into the
     * {@code reason} field for logging.
     */
    static SmtpError of(String checkName, String query, DnsResolver.QueryResult result) {
        DnsLookupException cause = result.toException(query);
        boolean temporary = result.isTemporary();
        return SmtpError.builder()
                .code(temporary ? 420 : 501)
                .enhancedCode(temporary ? TEMPORARY : PERMANENT)
                .message(MESSAGE)
                .checkName(checkName)
                .cause(cause)
                .fields(Map.of(FIELD_REASON, cause.getMessage()))
                .build();
    }
}
