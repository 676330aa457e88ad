package io.github.hotbrkm.smtpguard.gateway.smtp.policy.rule;

import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyContext;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyOutcome;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.SmtpPhase;

/**
 * Interface for policy rules that evaluate SMTP transactions.
 * <p>
 * Policy rules are evaluated at various SMTP phases to determine
 * how to handle messages. Each rule can allow, quarantine or
 * reject based on its configuration.
 * </p>
 *
 * <h2>Implementation Example</h2>
 * <pre>{@code
 * public class MyRule implements PolicyRule {
 *     @Override
 *     public boolean supports(SmtpPhase phase) {
 *         return phase == SmtpPhase.MAIL_PRE;
 *     }
 *
 *     @Override
 *     public PolicyOutcome evaluate(PolicyContext context) {
 *         // Evaluate the policy
 *         return PolicyOutcome.allow();
 *     }
 * }
 * }</pre>
 *
 * @author hotbrkm
 * @since 1.0.0
 */
public interface PolicyRule {

    /**
     * Name used in logs and metrics tags.
     * @return rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Checks if this rule supports the given SMTP phase.
     * @param phase the SMTP phase to check
     * @return true if the rule supports this phase
     */
    default boolean supports(SmtpPhase phase) {
        return true;
    }

    /**
     * Evaluates this policy rule for the given context.
     * @param context the policy context containing transaction information
     * @return the policy outcome (allow, quarantine or reject)
     */
    PolicyOutcome evaluate(PolicyContext context);
}
