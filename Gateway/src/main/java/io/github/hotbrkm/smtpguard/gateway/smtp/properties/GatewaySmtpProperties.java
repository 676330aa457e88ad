package io.github.hotbrkm.smtpguard.gateway.smtp.properties;

import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.MatchingEhloCheck;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.MatchingRdnsCheck;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.MxRecordCheck;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the SMTP gateway.
 * <p>
 * These properties are loaded from the {@code gateway.smtp} prefix in application.yml.
 * </p>
 *
 * <h2>Example Configuration</h2>
 * <pre>
 * gateway:
 *   smtp:
 *     port: 2525
 *     host-name: mx.example.com
 *     identity:
 *       lookup-timeout: 10s
 *       checks:
 *         - type: require-mx-record
 *           action: [reject, "550", "5.7.27", "Sender domain cannot receive mail"]
 *         - type: require-matching-ehlo
 *           action: [quarantine]
 * </pre>
 *
 * @author hotbrkm
 * @since 1.0.0
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "gateway.smtp")
public class GatewaySmtpProperties {

    /**
     * Whether the SMTP server is enabled.
     */
    private boolean enabled = true;

    /**
     * Port number for the SMTP server to listen on.
     */
    private int port = 2525;

    /**
     * Host name to use for the SMTP server.
     */
    private String hostName;

    /**
     * Address to bind the SMTP server to.
     */
    private String bindAddress;

    /**
     * Maximum number of concurrent connections allowed.
     */
    private Integer maxConnections;

    /**
     * Maximum message size in bytes.
     */
    private Integer maxMessageSize;

    /**
     * Directory path for storing accepted messages.
     */
    private String inboxDirectory;

    /**
     * Directory path for storing quarantined messages.
     */
    private String quarantineDirectory;

    /**
     * Whether to store received messages to disk.
     */
    private boolean storeMessages = true;

    /**
     * Sender identity checks.
     */
    @NestedConfigurationProperty
    private Identity identity = new Identity();

    /**
     * Sender identity verification settings.
     */
    @Getter
    @Setter
    public static class Identity {

        /**
         * Whether identity checks run at all.
         */
        private boolean enabled = true;

        /**
         * Whether the client's PTR record is looked up when a check asks for it.
         */
        private boolean reverseDnsLookup = true;

        /**
         * Upper bound for the DNS lookups of one check.
         */
        private Duration lookupTimeout = Duration.ofSeconds(10);

        /**
         * Checks to run, in {@code order}.
         */
        private List<Check> checks = new ArrayList<>();
    }

    /**
     * One configured identity check.
     */
    @Getter
    @Setter
    public static class Check {

        private boolean enabled = true;

        private CheckType type;

        /**
         * SMTP phases where this check runs. Defaults to {@code mail-pre}.
         */
        private List<String> phases = new ArrayList<>();

        /**
         * Execution order of this check (lower = earlier).
         */
        private int order = 100;

        /**
         * Fail action words, e.g. {@code [reject, "550", "5.7.1", "Go away"]}.
         * Empty means the check's default action.
         */
        private List<String> action = new ArrayList<>();
    }

    /**
     * Identity checks that can be configured.
     */
    public enum CheckType {
        /** Client's rDNS name must equal the EHLO hostname. */
        REQUIRE_MATCHING_RDNS(MatchingRdnsCheck.NAME),
        /** MAIL FROM domain must publish MX records. */
        REQUIRE_MX_RECORD(MxRecordCheck.NAME),
        /** EHLO hostname must resolve to the client IP. */
        REQUIRE_MATCHING_EHLO(MatchingEhloCheck.NAME);

        private final String checkName;

        CheckType(String checkName) {
            this.checkName = checkName;
        }

        public String checkName() {
            return checkName;
        }
    }
}
