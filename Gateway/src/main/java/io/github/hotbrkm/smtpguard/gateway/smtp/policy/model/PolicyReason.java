package io.github.hotbrkm.smtpguard.gateway.smtp.policy.model;

public enum PolicyReason {
    MATCHING_RDNS,
    MX_RECORD,
    MATCHING_EHLO,
    NONE
}
