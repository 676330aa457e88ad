package io.github.hotbrkm.smtpguard.gateway.smtp.policy.rule;

import io.github.hotbrkm.smtpguard.gateway.smtp.error.EnhancedCode;
import io.github.hotbrkm.smtpguard.gateway.smtp.error.SmtpError;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.action.FailAction;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.CheckContext;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.CheckResult;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.ConnectionMeta;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.IdentityCheckRegistry;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.ReverseDnsName;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.DnsResolver;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.LookupContext;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.metrics.PolicyMetricsRecorder;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyContext;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyOutcome;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.SmtpPhase;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs one identity check and applies its configured fail action.
 * <p>
 * The merged verdict maps to the pipeline as follows: reject becomes a 4xx or 5xx reply
 * depending on the reason's code, quarantine alone accepts the message into quarantine, and
 * neither only logs the failure. When both flags are set the message is rejected.
 * </p>
 */
@Slf4j
public class IdentityCheckRule implements PolicyRule {

    private final IdentityCheckRegistry.Entry entry;
    private final FailAction action;
    private final DnsResolver dnsResolver;
    private final Duration lookupTimeout;
    private final PolicyMetricsRecorder metricsRecorder;

    public IdentityCheckRule(IdentityCheckRegistry.Entry entry,
                             FailAction action,
                             DnsResolver dnsResolver,
                             Duration lookupTimeout) {
        this(entry, action, dnsResolver, lookupTimeout, new PolicyMetricsRecorder(null));
    }

    public IdentityCheckRule(IdentityCheckRegistry.Entry entry,
                             FailAction action,
                             DnsResolver dnsResolver,
                             Duration lookupTimeout,
                             PolicyMetricsRecorder metricsRecorder) {
        this.entry = Objects.requireNonNull(entry);
        this.action = action == null ? entry.defaultAction() : action;
        this.dnsResolver = Objects.requireNonNull(dnsResolver);
        this.lookupTimeout = Objects.requireNonNull(lookupTimeout);
        this.metricsRecorder = metricsRecorder == null ? new PolicyMetricsRecorder(null) : metricsRecorder;
    }

    @Override
    public String name() {
        return entry.name();
    }

    public FailAction getAction() {
        return action;
    }

    @Override
    public boolean supports(SmtpPhase phase) {
        return phase != null;
    }

    @Override
    public PolicyOutcome evaluate(PolicyContext context) {
        ConnectionMeta connection = context.getConnection() == null
                ? ConnectionMeta.of(null, null, ReverseDnsName.notAttempted())
                : context.getConnection();

        LookupContext lookupContext = LookupContext.withTimeout(lookupTimeout);
        CheckResult raw;
        try {
            raw = entry.check().check(new CheckContext(connection, context.getMailFrom(), dnsResolver, lookupContext));
        } catch (RuntimeException e) {
            log.warn("identity-check {} failed unexpectedly. sessionId={}", entry.name(), context.getSessionId(), e);
            raw = CheckResult.fail(SmtpError.builder()
                    .code(451)
                    .enhancedCode(EnhancedCode.of(4, 7, 1))
                    .message("Temporary failure during policy check")
                    .checkName(entry.name())
                    .cause(e)
                    .build());
        } finally {
            lookupContext.cancel();
        }

        CheckResult result = action.apply(raw);
        metricsRecorder.recordCheckResult(entry.name(), action.describe(), result);
        return toOutcome(context, result);
    }

    private PolicyOutcome toOutcome(PolicyContext context, CheckResult result) {
        if (result.isPassed()) {
            return PolicyOutcome.allow();
        }

        SmtpError reason = result.reason();
        if (result.reject()) {
            if (result.quarantine()) {
                log.info("identity-check {} asked for both reject and quarantine, rejecting. sessionId={}",
                        entry.name(), context.getSessionId());
            }
            return PolicyOutcome.reject(entry.reason(), reason);
        }

        if (result.quarantine()) {
            return PolicyOutcome.quarantine(entry.reason(), reason);
        }

        log.info("identity-check failed, logged only. sessionId={} phase={} error={}",
                context.getSessionId(), context.getPhase(), reason.toLogString());
        return PolicyOutcome.allow();
    }
}
