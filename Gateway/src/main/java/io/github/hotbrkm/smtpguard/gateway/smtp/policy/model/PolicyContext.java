package io.github.hotbrkm.smtpguard.gateway.smtp.policy.model;

import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.ConnectionMeta;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class PolicyContext {

    private final String sessionId;
    private final ConnectionMeta connection;
    private final String mailFrom;
    private final String currentRecipient;
    private final SmtpPhase phase;
}
