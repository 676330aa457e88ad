package io.github.hotbrkm.smtpguard.gateway.smtp.policy.metrics;

import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.CheckResult;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyDecision;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class PolicyMetricsRecorder {

    private final MeterRegistry registry;

    public PolicyMetricsRecorder(MeterRegistry registry) {
        this.registry = registry == null ? new SimpleMeterRegistry() : registry;
    }

    public void recordRuleFired(String phase, String ruleType, PolicyOutcome outcome) {
        if (outcome == null || outcome.decision() == PolicyDecision.ALLOW) {
            return;
        }

        registry.counter("gateway.smtp.policy.rule.fired",
                "phase", safe(phase),
                "rule", safe(ruleType),
                "decision", outcome.decision().name(),
                "reason", outcome.reason().name())
                .increment();
    }

    public void recordFinalOutcome(String phase, PolicyOutcome outcome) {
        if (outcome == null) {
            return;
        }

        registry.counter("gateway.smtp.policy.outcome.total",
                "phase", safe(phase),
                "decision", outcome.decision().name(),
                "reason", outcome.reason().name())
                .increment();

        if (outcome.smtpCode() >= 400) {
            String family = outcome.smtpCode() < 500 ? "4xx" : "5xx";
            registry.counter("gateway.smtp.policy.smtp.code",
                    "phase", safe(phase),
                    "family", family,
                    "code", Integer.toString(outcome.smtpCode()))
                    .increment();
        }
    }

    public void recordCheckResult(String check, String action, CheckResult result) {
        if (result == null) {
            return;
        }

        String family = "none";
        if (!result.isPassed()) {
            family = result.reason().isTemporary() ? "4xx" : "5xx";
        }
        registry.counter("gateway.smtp.identity.check.result",
                "check", safe(check),
                "action", safe(action),
                "result", result.isPassed() ? "pass" : "fail",
                "family", family)
                .increment();
    }

    private String safe(String value) {
        return value == null || value.isBlank() ? "none" : value;
    }
}
