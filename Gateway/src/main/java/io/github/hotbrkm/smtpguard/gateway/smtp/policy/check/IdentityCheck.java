package io.github.hotbrkm.smtpguard.gateway.smtp.policy.check;

/**
 * A check of the client's network-level identity.
 * <p>
 * Implementations are stateless and may run concurrently. They report failures through the
 * returned {@link CheckResult} and never throw for DNS or input problems. The quarantine and
 * reject flags of the result stay unset; the configured
 * {@link io.github.hotbrkm.smtpguard.gateway.smtp.policy.action.FailAction} decides them.
 * </p>
 */
@FunctionalInterface
public interface IdentityCheck {

    /**
     * Runs the check.
     * @param context connection facts, sender and DNS access
     * @return pass, or a failure carrying the SMTP reason
     */
    CheckResult check(CheckContext context);
}
