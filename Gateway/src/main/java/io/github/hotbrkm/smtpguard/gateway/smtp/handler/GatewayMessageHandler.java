package io.github.hotbrkm.smtpguard.gateway.smtp.handler;

import io.github.hotbrkm.smtpguard.gateway.smtp.error.SmtpError;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.PolicyOrchestrator;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.ConnectionMeta;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyContext;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyDecision;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyOutcome;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.SmtpPhase;
import io.github.hotbrkm.smtpguard.gateway.smtp.properties.GatewaySmtpProperties;
import io.github.hotbrkm.smtpguard.gateway.smtp.service.SmtpMessageStore;
import lombok.extern.slf4j.Slf4j;
import org.subethamail.smtp.MessageContext;
import org.subethamail.smtp.MessageHandler;
import org.subethamail.smtp.RejectException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Handles one SMTP mail transaction for the gateway.
 * <p>
 * Identity checks run after MAIL FROM, RCPT TO and DATA according to their configured
 * phases. Rejections are sent back as SMTP replies; quarantined messages are accepted and
 * written to the quarantine directory.
 * </p>
 *
 * @author hotbrkm
 * @since 1.0.0
 */
@Slf4j
public class GatewayMessageHandler implements MessageHandler {

    static final String QUARANTINE_HEADER = "X-Quarantine-Reason";

    private final MessageContext context;
    private final ConnectionMeta connection;
    private final GatewaySmtpProperties properties;
    private final SmtpMessageStore messageStore;
    private final PolicyOrchestrator policyOrchestrator;
    private final SmtpSessionState sessionState;

    public GatewayMessageHandler(MessageContext context,
                                 ConnectionMeta connection,
                                 GatewaySmtpProperties properties,
                                 SmtpMessageStore messageStore,
                                 PolicyOrchestrator policyOrchestrator) {
        this.context = context;
        this.connection = connection;
        this.properties = properties;
        this.messageStore = messageStore;
        this.policyOrchestrator = policyOrchestrator;
        this.sessionState = new SmtpSessionState();
    }

    @Override
    public void from(String from) throws RejectException {
        log.debug("SMTP transaction started - remote={}, helo={}, from={}",
                context.getRemoteAddress(), connection.heloHostname(), from);
        sessionState.setFrom(from);

        handlePolicyOutcome(evaluatePolicies(SmtpPhase.MAIL_PRE, null));
    }

    @Override
    public void recipient(String recipient) throws RejectException {
        log.debug("Processing SMTP recipient - from={}, recipient={}", sessionState.getFrom(), recipient);

        handlePolicyOutcome(evaluatePolicies(SmtpPhase.RCPT_PRE, recipient));

        sessionState.addRecipient(recipient);
    }

    @Override
    public String data(InputStream data) throws RejectException {
        log.debug("Processing SMTP DATA - from={}, recipients={}", sessionState.getFrom(), sessionState.getAcceptedRecipientCount());

        try {
            byte[] payload = data.readAllBytes();

            handlePolicyOutcome(evaluatePolicies(SmtpPhase.DATA_END, null));

            if (!properties.isStoreMessages() || !sessionState.hasAcceptedRecipients()) {
                return "OK";
            }

            boolean quarantined = sessionState.isQuarantined();
            byte[] payloadToStore = quarantined
                    ? prependQuarantineHeader(payload, sessionState.getQuarantineOutcome())
                    : payload;

            for (String recipient : sessionState.getAcceptedRecipients()) {
                try (InputStream payloadStream = new ByteArrayInputStream(payloadToStore)) {
                    messageStore.store(sessionState.getFrom(), recipient, payloadStream, quarantined);
                }
            }
            return "OK";
        } catch (IOException e) {
            throw new UncheckedIOException("I/O error occurred while processing SMTP data.", e);
        }
    }

    @Override
    public void done() {
        log.debug("SMTP transaction ended - from={}, recipients={}, quarantined={}",
                sessionState.getFrom(), sessionState.getAcceptedRecipientCount(), sessionState.isQuarantined());
    }

    SmtpSessionState getSessionState() {
        return sessionState;
    }

    private PolicyOutcome evaluatePolicies(SmtpPhase phase, String currentRecipient) {
        PolicyContext policyContext = PolicyContext.builder()
                .sessionId(context.getSessionId())
                .connection(connection)
                .mailFrom(sessionState.getFrom())
                .currentRecipient(currentRecipient)
                .phase(phase)
                .build();

        PolicyOutcome outcome = policyOrchestrator.evaluate(phase, policyContext);
        logDecision(phase, policyContext, outcome);
        return outcome;
    }

    private void handlePolicyOutcome(PolicyOutcome outcome) throws RejectException {
        if (outcome == null || outcome.decision() == PolicyDecision.ALLOW) {
            return;
        }

        if (outcome.decision() == PolicyDecision.QUARANTINE) {
            sessionState.markQuarantined(outcome);
            return;
        }

        RejectException exception = outcome.toRejectException();
        if (exception != null) {
            throw exception;
        }
    }

    private byte[] prependQuarantineHeader(byte[] payload, PolicyOutcome outcome) {
        SmtpError error = outcome.error();
        String reason = error == null ? outcome.reason().name() : error.toReplyText();
        String headerLine = QUARANTINE_HEADER + ": " + sanitizeHeaderValue(reason) + "\r\n";
        byte[] headerBytes = headerLine.getBytes(StandardCharsets.ISO_8859_1);
        byte[] result = new byte[headerBytes.length + payload.length];
        System.arraycopy(headerBytes, 0, result, 0, headerBytes.length);
        System.arraycopy(payload, 0, result, headerBytes.length, payload.length);
        return result;
    }

    private String sanitizeHeaderValue(String value) {
        return value.replace('\r', ' ').replace('\n', ' ');
    }

    private void logDecision(SmtpPhase phase, PolicyContext policyContext, PolicyOutcome outcome) {
        if (outcome == null || outcome.decision() == PolicyDecision.ALLOW) {
            return;
        }

        log.info("policy-decision sessionId={} phase={} reason={} decision={} code={} msg={} remote={} mailFrom={} rcpt={} error={}",
                context.getSessionId(),
                phase,
                outcome.reason(),
                outcome.decision(),
                outcome.smtpCode(),
                outcome.message(),
                context.getRemoteAddress(),
                policyContext.getMailFrom(),
                policyContext.getCurrentRecipient(),
                outcome.error() == null ? null : outcome.error().toLogString());
    }
}
