package io.github.hotbrkm.smtpguard.gateway.smtp.error;

import lombok.Builder;
import lombok.Getter;
import org.subethamail.smtp.RejectException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Protocol-level reason for rejecting or deferring a message.
 * <p>
 * Only {@link #getCode() code}, {@link #getEnhancedCode() enhanced code} and the message are
 * ever sent to the remote peer. The check name, reason tag, diagnostic fields and the cause
 * chain are for operators and logs.
 * </p>
 * <p>
 * Instances are immutable and are passed around as values rather than thrown. Wrapping a
 * reason creates a new instance whose {@link #getCause() cause} is the wrapped one.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SmtpError error = SmtpError.builder()
 *         .code(550)
 *         .enhancedCode(EnhancedCode.of(5, 7, 25))
 *         .message("rDNS name does not match source hostname")
 *         .checkName("require_matching_rdns")
 *         .build();
 * throw error.toRejectException();
 * }</pre>
 */
@Getter
public class SmtpError extends Exception {

    private final int code;
    private final EnhancedCode enhancedCode;
    private final String checkName;
    private final String reason;
    private final Map<String, Object> fields;

    @Builder
    private SmtpError(int code,
                      EnhancedCode enhancedCode,
                      String message,
                      String checkName,
                      String reason,
                      Throwable cause,
                      Map<String, Object> fields) {
        super(message, cause, false, false);
        int codeClass = code / 100;
        if (codeClass != 4 && codeClass != 5) {
            throw new IllegalArgumentException("SMTP error code must be 4xx or 5xx: " + code);
        }
        this.code = code;
        this.enhancedCode = Objects.requireNonNull(enhancedCode, "enhancedCode");
        this.checkName = checkName;
        this.reason = reason;
        this.fields = fields == null || fields.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Whether the peer is invited to retry later (4xx).
     */
    public boolean isTemporary() {
        return code / 100 == 4;
    }

    /**
     * Reply text as sent after the numeric code, e.g. {@code 5.7.25 rDNS name does not match source hostname}.
     */
    public String toReplyText() {
        return enhancedCode + " " + getMessage();
    }

    public RejectException toRejectException() {
        return new RejectException(code, toReplyText());
    }

    /**
     * Walks the cause chain down to the innermost {@link SmtpError}.
     *
     * @return the first reason produced, or this instance if it wraps none
     */
    public SmtpError getOriginalReason() {
        SmtpError current = this;
        while (current.getCause() instanceof SmtpError inner) {
            current = inner;
        }
        return current;
    }

    /**
     * Single-line description for logs, including the operator-only parts.
     */
    public String toLogString() {
        StringBuilder builder = new StringBuilder();
        builder.append(code).append(' ').append(toReplyText());
        if (checkName != null) {
            builder.append(" check=").append(checkName);
        }
        if (reason != null) {
            builder.append(" reason=\"").append(reason).append('"');
        }
        fields.forEach((key, value) -> builder.append(' ').append(key).append("=\"").append(value).append('"'));

        Throwable cause = getCause();
        while (cause != null) {
            builder.append(" caused-by=[");
            if (cause instanceof SmtpError smtpError) {
                builder.append(smtpError.code).append(' ').append(smtpError.toReplyText());
                if (smtpError.checkName != null) {
                    builder.append(" check=").append(smtpError.checkName);
                }
            } else {
                builder.append(cause.getClass().getSimpleName()).append(": ").append(cause.getMessage());
            }
            builder.append(']');
            cause = cause.getCause();
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return "SmtpError{" + code + " " + toReplyText() + (checkName == null ? "" : ", check=" + checkName) + "}";
    }
}
