package io.github.hotbrkm.smtpguard.gateway.smtp.policy.action;

import io.github.hotbrkm.smtpguard.gateway.smtp.error.DirectiveError;
import io.github.hotbrkm.smtpguard.gateway.smtp.error.DirectiveException;
import io.github.hotbrkm.smtpguard.gateway.smtp.error.SmtpError;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.CheckResult;

import java.util.List;

/**
 * What the pipeline should do with a message that failed a check.
 * <p>
 * Parsed once from the check's {@code action} directive when the configuration is loaded and
 * shared read-only by every evaluation of that check afterwards.
 * </p>
 *
 * <h2>Directive</h2>
 * <pre>
 * action: [ignore]
 * action: [quarantine]
 * action: [reject, "550", "5.7.1", "Sender identity could not be verified"]
 * </pre>
 *
 * @param quarantine     accept the message but route it to quarantine
 * @param reject         reject the message
 * @param reasonOverride reply sent instead of the check's own reason, or null
 */
public record FailAction(boolean quarantine, boolean reject, SmtpError reasonOverride) {

    public static final FailAction IGNORE = new FailAction(false, false, null);
    public static final FailAction QUARANTINE = new FailAction(true, false, null);
    public static final FailAction REJECT = new FailAction(false, true, null);

    public static final String ACTION_REJECT = "reject";
    public static final String ACTION_QUARANTINE = "quarantine";
    public static final String ACTION_IGNORE = "ignore";

    /**
     * Parses an action directive.
     *
     * @param args action keyword followed by optional reject directive arguments
     * @return parsed action
     * @throws DirectiveException if the directive is malformed
     */
    public static FailAction parse(List<String> args) {
        if (args == null || args.isEmpty()) {
            throw new DirectiveException(DirectiveError.NO_ARGUMENTS, "expected at least 1 argument");
        }

        String action = args.get(0) == null ? "" : args.get(0);
        List<String> rest = args.subList(1, args.size());

        return switch (action) {
            case ACTION_REJECT -> new FailAction(false, true, parseOverride(rest));
            case ACTION_QUARANTINE -> new FailAction(true, false, parseOverride(rest));
            case ACTION_IGNORE -> {
                if (!rest.isEmpty()) {
                    throw new DirectiveException(DirectiveError.ARG_COUNT,
                            "'ignore' takes no arguments, got " + rest.size());
                }
                yield IGNORE;
            }
            default -> throw new DirectiveException(DirectiveError.INVALID_ACTION, "invalid action: " + args.get(0));
        };
    }

    /**
     * Merges the result of a check with this action.
     * <p>
     * A passing result is returned as is. A failing result gets its reason wrapped by the
     * override, if any, and its flags OR-ed with this action's flags, so an action can only
     * make a verdict stricter. Call it exactly once per raw check result.
     * </p>
     *
     * @param original raw result of the check
     * @return merged result
     */
    public CheckResult apply(CheckResult original) {
        if (original == null || original.isPassed()) {
            return original;
        }

        CheckResult result = original;
        if (reasonOverride != null) {
            SmtpError wrapped = SmtpError.builder()
                    .code(reasonOverride.getCode())
                    .enhancedCode(reasonOverride.getEnhancedCode())
                    .message(reasonOverride.getMessage())
                    .reason(reasonOverride.getReason())
                    .checkName(original.reason().getCheckName())
                    .cause(original.reason())
                    .build();
            result = result.withReason(wrapped);
        }

        return result.withFlags(quarantine || result.quarantine(), reject || result.reject());
    }

    /**
     * Keyword this action was configured with.
     */
    public String describe() {
        if (reject) {
            return ACTION_REJECT;
        }
        return quarantine ? ACTION_QUARANTINE : ACTION_IGNORE;
    }

    private static SmtpError parseOverride(List<String> args) {
        if (args.isEmpty()) {
            return null;
        }
        return RejectDirective.parse(args);
    }
}
