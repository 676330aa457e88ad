package io.github.hotbrkm.smtpguard.gateway.smtp.policy;

import io.github.hotbrkm.smtpguard.gateway.smtp.policy.metrics.PolicyMetricsRecorder;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyContext;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyDecision;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyOutcome;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.SmtpPhase;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.rule.PolicyRule;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates policy evaluation for SMTP transactions.
 * <p>
 * The orchestrator manages a collection of policy rules and evaluates them
 * based on the current SMTP phase. Every rule of the phase is evaluated; the
 * first rejection wins, otherwise the first quarantine, otherwise the message
 * is allowed.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * PolicyOrchestrator orchestrator = new PolicyOrchestrator();
 * orchestrator.register(SmtpPhase.MAIL_PRE, mxRecordRule);
 * orchestrator.register(SmtpPhase.MAIL_PRE, matchingEhloRule);
 *
 * PolicyOutcome outcome = orchestrator.evaluate(SmtpPhase.MAIL_PRE, context);
 * }</pre>
 *
 * @author hotbrkm
 * @since 1.0.0
 */
public class PolicyOrchestrator {

    private final Map<SmtpPhase, List<PolicyRule>> rulesByPhase = new EnumMap<>(SmtpPhase.class);
    private final PolicyMetricsRecorder metricsRecorder;

    /**
     * Creates a new PolicyOrchestrator with default metrics recorder.
     */
    public PolicyOrchestrator() {
        this(new PolicyMetricsRecorder(null));
    }

    /**
     * Creates a new PolicyOrchestrator with a custom metrics recorder.
     * @param metricsRecorder the metrics recorder to use, or null for no metrics
     */
    public PolicyOrchestrator(PolicyMetricsRecorder metricsRecorder) {
        this.metricsRecorder = metricsRecorder == null ? new PolicyMetricsRecorder(null) : metricsRecorder;
    }

    /**
     * Registers a policy rule for a specific SMTP phase.
     * @param phase the SMTP phase to register for
     * @param rule the policy rule to register
     * @throws IllegalArgumentException if phase or rule is null, or rule doesn't support the phase
     */
    public void register(SmtpPhase phase, PolicyRule rule) {
        if (phase == null) {
            throw new IllegalArgumentException("phase must not be null");
        }
        if (rule == null) {
            throw new IllegalArgumentException("rule must not be null");
        }
        if (!rule.supports(phase)) {
            throw new IllegalArgumentException("rule " + rule.getClass().getSimpleName() + " does not support phase " + phase);
        }
        rulesByPhase.computeIfAbsent(phase, s -> new ArrayList<>()).add(rule);
    }

    /**
     * Returns the rules registered for a phase, in evaluation order.
     * @param phase the SMTP phase
     * @return registered rules, empty if none
     */
    public List<PolicyRule> rulesFor(SmtpPhase phase) {
        return List.copyOf(rulesByPhase.getOrDefault(phase, List.of()));
    }

    /**
     * Evaluates all registered rules for the given SMTP phase.
     * @param phase the current SMTP phase
     * @param context the policy context containing transaction information
     * @return the final policy outcome after evaluating all rules
     */
    public PolicyOutcome evaluate(SmtpPhase phase, PolicyContext context) {
        List<PolicyRule> rules = rulesByPhase.get(phase);
        if (rules == null || rules.isEmpty()) {
            return PolicyOutcome.allow();
        }

        PolicyOutcome terminalOutcome = null;
        PolicyOutcome quarantineOutcome = null;

        for (PolicyRule rule : rules) {
            PolicyOutcome outcome = rule.evaluate(context);
            if (outcome == null) {
                outcome = PolicyOutcome.allow();
            }
            metricsRecorder.recordRuleFired(phase.name(), rule.name(), outcome);

            if (terminalOutcome == null && outcome.isTerminal()) {
                terminalOutcome = outcome;
            }
            if (quarantineOutcome == null && outcome.decision() == PolicyDecision.QUARANTINE) {
                quarantineOutcome = outcome;
            }
        }

        PolicyOutcome finalOutcome = terminalOutcome != null
                ? terminalOutcome
                : (quarantineOutcome != null ? quarantineOutcome : PolicyOutcome.allow());

        metricsRecorder.recordFinalOutcome(phase.name(), finalOutcome);
        return finalOutcome;
    }
}
