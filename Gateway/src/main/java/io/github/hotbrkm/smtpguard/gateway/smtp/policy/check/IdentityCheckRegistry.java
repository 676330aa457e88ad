package io.github.hotbrkm.smtpguard.gateway.smtp.policy.check;

import io.github.hotbrkm.smtpguard.gateway.smtp.policy.action.FailAction;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.model.PolicyReason;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Table of the identity checks known to the gateway.
 * <p>
 * Built once at startup. Each entry pairs a check with the action used when the configuration
 * does not name one.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * IdentityCheckRegistry registry = IdentityCheckRegistry.defaults();
 * IdentityCheckRegistry.Entry entry = registry.get(MxRecordCheck.NAME);
 * CheckResult result = entry.defaultAction().apply(entry.check().check(context));
 * }</pre>
 */
public final class IdentityCheckRegistry {

    private final Map<String, Entry> entries;

    private IdentityCheckRegistry(Map<String, Entry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Registry with the three built-in checks, each quarantining on failure by default.
     */
    public static IdentityCheckRegistry defaults() {
        return builder()
                .register(MatchingRdnsCheck.NAME, PolicyReason.MATCHING_RDNS, new MatchingRdnsCheck(), FailAction.QUARANTINE)
                .register(MxRecordCheck.NAME, PolicyReason.MX_RECORD, new MxRecordCheck(), FailAction.QUARANTINE)
                .register(MatchingEhloCheck.NAME, PolicyReason.MATCHING_EHLO, new MatchingEhloCheck(), FailAction.QUARANTINE)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Entry> find(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    /**
     * @throws IllegalArgumentException if no check is registered under the name
     */
    public Entry get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown identity check: " + name));
    }

    public Collection<Entry> entries() {
        return entries.values();
    }

    /**
     * @param name          check name used in logs and configuration
     * @param reason        reason reported in policy outcomes
     * @param check         check implementation
     * @param defaultAction action applied when none is configured
     */
    public record Entry(String name, PolicyReason reason, IdentityCheck check, FailAction defaultAction) {

        public Entry {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(check, "check");
            Objects.requireNonNull(defaultAction, "defaultAction");
        }
    }

    public static final class Builder {

        private final Map<String, Entry> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String name, PolicyReason reason, IdentityCheck check, FailAction defaultAction) {
            Entry entry = new Entry(name, reason, check, defaultAction);
            if (entries.putIfAbsent(name, entry) != null) {
                throw new IllegalArgumentException("Identity check already registered: " + name);
            }
            return this;
        }

        public IdentityCheckRegistry build() {
            return new IdentityCheckRegistry(entries);
        }
    }
}
