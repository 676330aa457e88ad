package io.github.hotbrkm.smtpguard.gateway.config;

import io.github.hotbrkm.smtpguard.gateway.smtp.policy.PolicyOrchestrator;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.IdentityCheckRegistry;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.TestDnsResolver;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.metrics.PolicyMetricsRecorder;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.SmtpPhase;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.rule.PolicyRule;
import io.github.hotbrkm.smtpguard.gateway.smtp.properties.GatewaySmtpProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SmtpServerConfig policy orchestrator test")
class SmtpServerConfigPolicyOrchestratorTest {

    @DisplayName("Should register all three identity checks on MAIL_PRE by default")
    @Test
    void testPolicyOrchestratorRegistersAllCheckTypes() {
        GatewaySmtpProperties properties = new GatewaySmtpProperties();
        properties.getIdentity().setChecks(List.of(
                check(GatewaySmtpProperties.CheckType.REQUIRE_MATCHING_EHLO, 300),
                check(GatewaySmtpProperties.CheckType.REQUIRE_MATCHING_RDNS, 100),
                check(GatewaySmtpProperties.CheckType.REQUIRE_MX_RECORD, 200)));

        SmtpServerConfig config = new SmtpServerConfig();
        PolicyOrchestrator orchestrator = config.policyOrchestrator(properties,
                config.identityCheckRegistry(), new TestDnsResolver(), new PolicyMetricsRecorder(null));

        assertThat(orchestrator.rulesFor(SmtpPhase.MAIL_PRE))
                .extracting(PolicyRule::name)
                .containsExactly("require_matching_rdns", "require_mx_record", "require_matching_ehlo");
    }

    @DisplayName("Should fail at startup on an invalid action directive")
    @Test
    void testPolicyOrchestratorFailsOnInvalidAction() {
        GatewaySmtpProperties properties = new GatewaySmtpProperties();
        GatewaySmtpProperties.Check check = check(GatewaySmtpProperties.CheckType.REQUIRE_MATCHING_EHLO, 100);
        check.setAction(List.of("ignore", "550"));
        properties.getIdentity().setChecks(List.of(check));

        SmtpServerConfig config = new SmtpServerConfig();

        assertThatThrownBy(() -> config.policyOrchestrator(properties,
                IdentityCheckRegistry.defaults(), new TestDnsResolver(), new PolicyMetricsRecorder(null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("require_matching_ehlo");
    }

    private GatewaySmtpProperties.Check check(GatewaySmtpProperties.CheckType type, int order) {
        GatewaySmtpProperties.Check check = new GatewaySmtpProperties.Check();
        check.setType(type);
        check.setOrder(order);
        return check;
    }
}
