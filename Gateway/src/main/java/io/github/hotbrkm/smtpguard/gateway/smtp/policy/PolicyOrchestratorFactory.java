package io.github.hotbrkm.smtpguard.gateway.smtp.policy;

import io.github.hotbrkm.smtpguard.gateway.smtp.error.DirectiveException;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.action.FailAction;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.IdentityCheckRegistry;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.DnsResolver;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.metrics.PolicyMetricsRecorder;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.SmtpPhase;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.rule.IdentityCheckRule;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.rule.PolicyRule;
import io.github.hotbrkm.smtpguard.gateway.smtp.properties.GatewaySmtpProperties;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class PolicyOrchestratorFactory {

    private PolicyOrchestratorFactory() {
    }

    public static PolicyOrchestrator build(GatewaySmtpProperties.Identity identity,
                                           IdentityCheckRegistry registry,
                                           DnsResolver dnsResolver,
                                           PolicyMetricsRecorder metricsRecorder) {
        PolicyOrchestrator orchestrator = metricsRecorder != null
                ? new PolicyOrchestrator(metricsRecorder)
                : new PolicyOrchestrator();

        if (identity == null || !identity.isEnabled()
                || identity.getChecks() == null || identity.getChecks().isEmpty()) {
            return orchestrator;
        }

        List<GatewaySmtpProperties.Check> enabledChecks = new ArrayList<>(identity.getChecks());
        enabledChecks.removeIf(check -> check == null || !check.isEnabled());
        enabledChecks.sort(Comparator.comparingInt(GatewaySmtpProperties.Check::getOrder));

        for (GatewaySmtpProperties.Check check : enabledChecks) {
            PolicyRule policyRule = createPolicyRule(check, identity, registry, dnsResolver, metricsRecorder);
            for (SmtpPhase phase : resolvePhases(check)) {
                orchestrator.register(phase, policyRule);
            }
        }

        return orchestrator;
    }

    static PolicyRule createPolicyRule(GatewaySmtpProperties.Check check,
                                       GatewaySmtpProperties.Identity identity,
                                       IdentityCheckRegistry registry,
                                       DnsResolver dnsResolver,
                                       PolicyMetricsRecorder metricsRecorder) {
        if (check.getType() == null) {
            throw new IllegalArgumentException("identity.checks.type is required.");
        }
        IdentityCheckRegistry.Entry entry = registry.get(check.getType().checkName());
        return new IdentityCheckRule(entry, resolveAction(check, entry), dnsResolver,
                identity.getLookupTimeout(), metricsRecorder);
    }

    static FailAction resolveAction(GatewaySmtpProperties.Check check, IdentityCheckRegistry.Entry entry) {
        List<String> words = check.getAction();
        if (words == null || words.isEmpty()) {
            return entry.defaultAction();
        }
        try {
            return FailAction.parse(words);
        } catch (DirectiveException e) {
            throw new IllegalStateException("Invalid action for identity check " + entry.name() + ": " + words, e);
        }
    }

    static Set<SmtpPhase> resolvePhases(GatewaySmtpProperties.Check check) {
        Set<SmtpPhase> phases = new LinkedHashSet<>();
        List<String> configuredPhases = check.getPhases();
        if (configuredPhases == null || configuredPhases.isEmpty()) {
            phases.add(SmtpPhase.MAIL_PRE);
            return phases;
        }

        for (String configuredPhase : configuredPhases) {
            try {
                SmtpPhase phase = SmtpPhase.fromConfig(configuredPhase);
                if (phase == null) {
                    throw new IllegalArgumentException("identity.checks.phases value is empty.");
                }
                phases.add(phase);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unsupported identity.checks.phases value: "
                        + configuredPhase + " (type=" + check.getType() + ")", e);
            }
        }
        return phases;
    }
}
