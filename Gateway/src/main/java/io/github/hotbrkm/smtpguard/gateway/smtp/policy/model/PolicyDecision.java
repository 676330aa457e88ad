package io.github.hotbrkm.smtpguard.gateway.smtp.policy.model;

public enum PolicyDecision {
    ALLOW,
    /** Accept the message but store it in quarantine. */
    QUARANTINE,
    TEMP_FAIL,
    PERM_FAIL
}
