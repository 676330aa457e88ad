package io.github.hotbrkm.smtpguard.gateway.smtp.policy.model;

import java.util.Locale;

/**
 * Enumeration of SMTP protocol phases.
 * <p>
 * These phases represent the stages of a mail transaction where identity checks can be
 * evaluated. The client has already sent HELO/EHLO in all of them.
 * </p>
 *
 * @author hotbrkm
 * @since 1.0.0
 */
public enum SmtpPhase {
    /** After MAIL FROM, before the sender is accepted. */
    MAIL_PRE,
    /** After RCPT TO command, before the recipient is accepted. */
    RCPT_PRE,
    /** After message data (DATA command) is complete. */
    DATA_END;

    /**
     * Converts a configuration value to an SmtpPhase.
     * @param value the configuration value (e.g., "mail-pre" or "MAIL_PRE")
     * @return the corresponding SmtpPhase, or null if blank
     * @throws IllegalArgumentException if the value names no phase
     */
    public static SmtpPhase fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim()
                .replace('-', '_')
                .replace(' ', '_')
                .toUpperCase(Locale.ROOT);
        return SmtpPhase.valueOf(normalized);
    }
}
