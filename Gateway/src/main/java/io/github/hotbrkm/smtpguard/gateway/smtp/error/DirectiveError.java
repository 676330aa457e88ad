package io.github.hotbrkm.smtpguard.gateway.smtp.error;

/**
 * Kinds of configuration errors raised while parsing action and reject directives.
 */
public enum DirectiveError {
    /** Enhanced code is not three dot-separated non-negative integers. */
    FORMAT,
    /** Reply code is not an integer starting with 4 or 5. */
    INVALID_CODE,
    /** Enhanced code class is neither 4 nor 5. */
    INVALID_ENHANCED_CODE,
    /** Custom reply message is empty. */
    EMPTY_MESSAGE,
    /** Too many arguments for the directive. */
    ARG_COUNT,
    /** Unknown action keyword. */
    INVALID_ACTION,
    /** Action directive without arguments. */
    NO_ARGUMENTS
}
