package io.github.hotbrkm.smtpguard.gateway.smtp.handler;

import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyOutcome;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Manages the SMTP transaction state.
 * <p>
 * Encapsulates the per-message state of the message handler.
 */
public class SmtpSessionState {

    private final List<String> acceptedRecipients = new ArrayList<>();

    @Getter
    @Setter
    private String from;

    /**
     * First quarantine outcome seen in this transaction, null if none.
     */
    @Getter
    private PolicyOutcome quarantineOutcome;

    /**
     * Adds a recipient to the list of accepted recipients.
     *
     * @param recipient Recipient email address
     */
    public void addRecipient(String recipient) {
        acceptedRecipients.add(recipient);
    }

    /**
     * Returns the accepted recipient list (immutable).
     *
     * @return Recipient list
     */
    public List<String> getAcceptedRecipients() {
        return Collections.unmodifiableList(acceptedRecipients);
    }

    public int getAcceptedRecipientCount() {
        return acceptedRecipients.size();
    }

    public boolean hasAcceptedRecipients() {
        return !acceptedRecipients.isEmpty();
    }

    /**
     * Marks the message for quarantine. Only the first mark is kept.
     *
     * @param outcome quarantine outcome
     */
    public void markQuarantined(PolicyOutcome outcome) {
        if (quarantineOutcome == null) {
            quarantineOutcome = outcome;
        }
    }

    public boolean isQuarantined() {
        return quarantineOutcome != null;
    }
}
