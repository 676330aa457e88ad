package io.github.hotbrkm.smtpguard.gateway.smtp.policy.check;

import io.github.hotbrkm.smtpguard.gateway.smtp.error.SmtpError;

/**
 * Verdict of a single identity check for a single message.
 * <p>
 * A {@code null} reason means the check passed. The quarantine and reject flags are set by
 * {@link io.github.hotbrkm.smtpguard.gateway.smtp.policy.action.FailAction#apply(CheckResult)},
 * not by the check itself.
 * </p>
 *
 * @param reason     failure reason, or null when the check passed
 * @param quarantine whether the message should be quarantined
 * @param reject     whether the message should be rejected
 */
public record CheckResult(SmtpError reason, boolean quarantine, boolean reject) {

    private static final CheckResult PASS = new CheckResult(null, false, false);

    public static CheckResult pass() {
        return PASS;
    }

    public static CheckResult fail(SmtpError reason) {
        if (reason == null) {
            throw new IllegalArgumentException("reason must not be null");
        }
        return new CheckResult(reason, false, false);
    }

    public boolean isPassed() {
        return reason == null;
    }

    public CheckResult withReason(SmtpError value) {
        return new CheckResult(value, quarantine, reject);
    }

    public CheckResult withFlags(boolean quarantineValue, boolean rejectValue) {
        return new CheckResult(reason, quarantineValue, rejectValue);
    }
}
