package io.github.hotbrkm.smtpguard.gateway.smtp.policy.action;

import io.github.hotbrkm.smtpguard.gateway.smtp.error.DirectiveError;
import io.github.hotbrkm.smtpguard.gateway.smtp.error.DirectiveException;
import io.github.hotbrkm.smtpguard.gateway.smtp.error.EnhancedCode;
import io.github.hotbrkm.smtpguard.gateway.smtp.error.SmtpError;

import java.util.List;

/**
 * Builds the custom SMTP reply used by {@code reject} and {@code quarantine} actions.
 * <p>
 * Arguments are positional: {@code code [enhanced-code [message]]}. Each argument can only be
 * given together with all arguments before it, so a message alone is not accepted.
 * </p>
 */
public final class RejectDirective {

    public static final int DEFAULT_CODE = 554;
    public static final EnhancedCode DEFAULT_ENHANCED_CODE = EnhancedCode.of(5, 7, 0);
    public static final String DEFAULT_MESSAGE = "Message rejected due to a local policy";
    public static final String REASON = "reject directive used";

    private static final int MAX_ARGUMENTS = 3;

    private RejectDirective() {
    }

    /**
     * Parses the reject directive arguments.
     *
     * @param args zero to three arguments
     * @return reply to send instead of the check's own one
     * @throws DirectiveException if an argument is invalid or there are too many of them
     */
    public static SmtpError parse(List<String> args) {
        List<String> arguments = args == null ? List.of() : args;
        if (arguments.size() > MAX_ARGUMENTS) {
            throw new DirectiveException(DirectiveError.ARG_COUNT,
                    "expected at most " + MAX_ARGUMENTS + " arguments, got " + arguments.size());
        }

        int code = DEFAULT_CODE;
        EnhancedCode enhancedCode = DEFAULT_ENHANCED_CODE;
        String message = DEFAULT_MESSAGE;

        if (arguments.size() >= 1) {
            code = parseCode(arguments.get(0));
        }
        if (arguments.size() >= 2) {
            enhancedCode = parseEnhancedCode(arguments.get(1));
        }
        if (arguments.size() == 3) {
            message = parseMessage(arguments.get(2));
        }

        return SmtpError.builder()
                .code(code)
                .enhancedCode(enhancedCode)
                .message(message)
                .reason(REASON)
                .build();
    }

    private static int parseCode(String value) {
        int code;
        try {
            code = Integer.parseInt(value == null ? "" : value);
        } catch (NumberFormatException e) {
            throw new DirectiveException(DirectiveError.INVALID_CODE, "invalid error code integer: " + value, e);
        }
        int codeClass = code / 100;
        if (codeClass != 4 && codeClass != 5) {
            throw new DirectiveException(DirectiveError.INVALID_CODE,
                    "error code should start with either 4 or 5: " + value);
        }
        return code;
    }

    private static EnhancedCode parseEnhancedCode(String value) {
        EnhancedCode enhancedCode = EnhancedCode.parse(value);
        if (!enhancedCode.isTransient() && !enhancedCode.isPermanent()) {
            throw new DirectiveException(DirectiveError.INVALID_ENHANCED_CODE,
                    "enhanced code should use either 4 or 5 as a first number: " + value);
        }
        return enhancedCode;
    }

    private static String parseMessage(String value) {
        if (value == null || value.isEmpty()) {
            throw new DirectiveException(DirectiveError.EMPTY_MESSAGE, "message can't be empty");
        }
        return value;
    }
}
