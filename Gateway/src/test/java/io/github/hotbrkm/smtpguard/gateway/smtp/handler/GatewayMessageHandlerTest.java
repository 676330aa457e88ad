package io.github.hotbrkm.smtpguard.gateway.smtp.handler;

import io.github.hotbrkm.smtpguard.gateway.smtp.error.EnhancedCode;
import io.github.hotbrkm.smtpguard.gateway.smtp.error.SmtpError;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.PolicyOrchestrator;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.action.FailAction;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.CheckResult;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.ConnectionMeta;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.IdentityCheck;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.IdentityCheckRegistry;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.ReverseDnsName;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.TestDnsResolver;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyReason;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.SmtpPhase;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.rule.IdentityCheckRule;
import io.github.hotbrkm.smtpguard.gateway.smtp.properties.GatewaySmtpProperties;
import io.github.hotbrkm.smtpguard.gateway.smtp.service.SmtpMessageStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.subethamail.smtp.MessageContext;
import org.subethamail.smtp.RejectException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("GatewayMessageHandler Test")
class GatewayMessageHandlerTest {

    @TempDir
    Path tempDir;

    private GatewaySmtpProperties properties;
    private SmtpMessageStore messageStore;
    private MessageContext messageContext;
    private ConnectionMeta connection;

    @BeforeEach
    void setUp() throws IOException {
        properties = new GatewaySmtpProperties();
        properties.setInboxDirectory(tempDir.resolve("inbox").toString());
        properties.setQuarantineDirectory(tempDir.resolve("quarantine").toString());
        Files.createDirectories(tempDir.resolve("inbox"));
        Files.createDirectories(tempDir.resolve("quarantine"));
        messageStore = new SmtpMessageStore(properties);

        InetSocketAddress remote = new InetSocketAddress(InetAddress.getByName("192.0.2.1"), 40000);
        messageContext = mock(MessageContext.class);
        when(messageContext.getSessionId()).thenReturn("session-1");
        when(messageContext.getRemoteAddress()).thenReturn(remote);
        connection = ConnectionMeta.of(remote, "mx.example.org", ReverseDnsName.notAttempted());
    }

    @Test
    @DisplayName("Rejects MAIL FROM with the check's reply when the action is reject")
    void shouldRejectMailFrom() {
        // given
        GatewayMessageHandler handler = handler(SmtpPhase.MAIL_PRE,
                context -> CheckResult.fail(mxError()), FailAction.REJECT);

        // when / then
        assertThatThrownBy(() -> handler.from("sender@example.org"))
                .isInstanceOf(RejectException.class)
                .satisfies(e -> {
                    RejectException reject = (RejectException) e;
                    assertThat(reject.getCode()).isEqualTo(501);
                    assertThat(reject.getMessage()).isEqualTo("5.7.27 Domain in MAIL FROM has no MX records");
                });
    }

    @Test
    @DisplayName("Stores a quarantined message with the quarantine reason header")
    void shouldQuarantineMessage() throws Exception {
        // given
        GatewayMessageHandler handler = handler(SmtpPhase.MAIL_PRE,
                context -> CheckResult.fail(mxError()), FailAction.QUARANTINE);

        // when
        handler.from("sender@example.org");
        handler.recipient("rcpt@example.com");
        String reply = handler.data(stream("Subject: hi\r\n\r\nbody"));
        handler.done();

        // then
        assertThat(reply).isEqualTo("OK");
        assertThat(handler.getSessionState().isQuarantined()).isTrue();
        List<Path> quarantined = list(tempDir.resolve("quarantine"));
        assertThat(quarantined).hasSize(1);
        assertThat(Files.readString(quarantined.get(0), StandardCharsets.ISO_8859_1))
                .startsWith("X-Quarantine-Reason: 5.7.27 Domain in MAIL FROM has no MX records\r\nSubject: hi");
        assertThat(list(tempDir.resolve("inbox"))).isEmpty();
    }

    @Test
    @DisplayName("Stores an accepted message in the inbox unchanged")
    void shouldDeliverAcceptedMessage() throws Exception {
        GatewayMessageHandler handler = handler(SmtpPhase.MAIL_PRE, context -> CheckResult.pass(), FailAction.REJECT);

        handler.from("sender@example.org");
        handler.recipient("rcpt1@example.com");
        handler.recipient("rcpt2@example.com");
        handler.data(stream("Subject: hi\r\n\r\nbody"));

        List<Path> inbox = list(tempDir.resolve("inbox"));
        assertThat(inbox).hasSize(2);
        assertThat(Files.readString(inbox.get(0))).isEqualTo("Subject: hi\r\n\r\nbody");
    }

    @Test
    @DisplayName("Ignored failures deliver normally")
    void shouldDeliverWhenFailureIsIgnored() throws Exception {
        GatewayMessageHandler handler = handler(SmtpPhase.MAIL_PRE,
                context -> CheckResult.fail(mxError()), FailAction.IGNORE);

        handler.from("sender@example.org");
        handler.recipient("rcpt@example.com");
        handler.data(stream("body"));

        assertThat(list(tempDir.resolve("inbox"))).hasSize(1);
        assertThat(list(tempDir.resolve("quarantine"))).isEmpty();
    }

    @Test
    @DisplayName("Rejects RCPT TO and does not accept the recipient")
    void shouldRejectRecipient() throws Exception {
        GatewayMessageHandler handler = handler(SmtpPhase.RCPT_PRE,
                context -> CheckResult.fail(mxError()), FailAction.REJECT);

        handler.from("sender@example.org");

        assertThatThrownBy(() -> handler.recipient("rcpt@example.com"))
                .isInstanceOf(RejectException.class);
        assertThat(handler.getSessionState().hasAcceptedRecipients()).isFalse();
    }

    @Test
    @DisplayName("Passes the sender and session to the checks")
    void shouldPassTransactionDataToChecks() throws Exception {
        StringBuilder seen = new StringBuilder();
        GatewayMessageHandler handler = handler(SmtpPhase.MAIL_PRE, context -> {
            seen.append(context.mailFrom()).append('|').append(context.connection().heloHostname());
            return CheckResult.pass();
        }, FailAction.REJECT);

        handler.from("sender@example.org");

        assertThat(seen.toString()).isEqualTo("sender@example.org|mx.example.org");
    }

    private GatewayMessageHandler handler(SmtpPhase phase, IdentityCheck check, FailAction action) {
        IdentityCheckRegistry.Entry entry = new IdentityCheckRegistry.Entry(
                "require_mx_record", PolicyReason.MX_RECORD, check, FailAction.QUARANTINE);
        PolicyOrchestrator orchestrator = new PolicyOrchestrator();
        orchestrator.register(phase, new IdentityCheckRule(entry, action, new TestDnsResolver(), Duration.ofSeconds(5)));
        return new GatewayMessageHandler(messageContext, connection, properties, messageStore, orchestrator);
    }

    private SmtpError mxError() {
        return SmtpError.builder()
                .code(501)
                .enhancedCode(EnhancedCode.of(5, 7, 27))
                .message("Domain in MAIL FROM has no MX records")
                .checkName("require_mx_record")
                .build();
    }

    private ByteArrayInputStream stream(String value) {
        return new ByteArrayInputStream(value.getBytes(StandardCharsets.US_ASCII));
    }

    private List<Path> list(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.toList();
        }
    }
}
