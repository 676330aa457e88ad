package io.github.hotbrkm.smtpguard.gateway.smtp.error;

/**
 * Thrown when a fail action or reject directive is malformed.
 * <p>
 * These errors surface while the gateway configuration is loaded and stop the application
 * from starting. They never occur while a message is being processed.
 */
public class DirectiveException extends IllegalArgumentException {

    private final DirectiveError error;

    public DirectiveException(DirectiveError error, String message) {
        super(message);
        this.error = error;
    }

    public DirectiveException(DirectiveError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public DirectiveError getError() {
        return error;
    }
}
