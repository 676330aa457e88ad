package io.github.hotbrkm.smtpguard.gateway.smtp.policy.model;

import io.github.hotbrkm.smtpguard.gateway.smtp.error.SmtpError;
import org.subethamail.smtp.RejectException;

/**
 * Represents the outcome of a policy evaluation.
 * <p>
 * This record contains all information about how the SMTP server should
 * respond to a client after evaluating policy rules.
 * </p>
 *
 * @param decision  what to do with the message
 * @param smtpCode  reply code for failures, 0 otherwise
 * @param message   reply text for failures (enhanced code and message), null otherwise
 * @param reason    rule that produced the outcome
 * @param error     full failure reason for logs and quarantine headers, null when allowed
 * @author hotbrkm
 * @since 1.0.0
 */
public record PolicyOutcome(PolicyDecision decision,
                            int smtpCode,
                            String message,
                            PolicyReason reason,
                            SmtpError error) {

    private static final PolicyOutcome ALLOW = new PolicyOutcome(PolicyDecision.ALLOW, 0, null, PolicyReason.NONE, null);

    /**
     * Creates an allow outcome.
     * @return policy outcome that allows the operation
     */
    public static PolicyOutcome allow() {
        return ALLOW;
    }

    /**
     * Creates an outcome that accepts the message into quarantine.
     * @param reason the rule that asked for quarantine
     * @param error the failure that caused it
     * @return policy outcome for quarantine
     */
    public static PolicyOutcome quarantine(PolicyReason reason, SmtpError error) {
        return new PolicyOutcome(PolicyDecision.QUARANTINE, 0, null, reason, error);
    }

    /**
     * Creates a temporary failure outcome (4xx response).
     * @param code SMTP response code
     * @param message response message
     * @param reason the reason for failure
     * @param error the failure reason, may be null
     * @return policy outcome for temporary failure
     */
    public static PolicyOutcome tempFail(int code, String message, PolicyReason reason, SmtpError error) {
        return new PolicyOutcome(PolicyDecision.TEMP_FAIL, code, message, reason, error);
    }

    /**
     * Creates a permanent failure outcome (5xx response).
     * @param code SMTP response code
     * @param message response message
     * @param reason the reason for failure
     * @param error the failure reason, may be null
     * @return policy outcome for permanent failure
     */
    public static PolicyOutcome permFail(int code, String message, PolicyReason reason, SmtpError error) {
        return new PolicyOutcome(PolicyDecision.PERM_FAIL, code, message, reason, error);
    }

    /**
     * Creates a reject outcome from an SMTP error, temporary or permanent according to its code.
     * @param reason the rule that rejected
     * @param error the reply to send
     * @return policy outcome for the rejection
     */
    public static PolicyOutcome reject(PolicyReason reason, SmtpError error) {
        return error.isTemporary()
                ? tempFail(error.getCode(), error.toReplyText(), reason, error)
                : permFail(error.getCode(), error.toReplyText(), reason, error);
    }

    /**
     * Checks if this outcome is terminal (stops processing).
     * @return true if this is a terminal outcome
     */
    public boolean isTerminal() {
        return decision == PolicyDecision.TEMP_FAIL
                || decision == PolicyDecision.PERM_FAIL;
    }

    /**
     * Converts this outcome to a RejectException if applicable.
     * @return RejectException or null if not applicable
     */
    public RejectException toRejectException() {
        if (!isTerminal()) {
            return null;
        }
        return new RejectException(smtpCode, message);
    }
}
