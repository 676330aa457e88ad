package io.github.hotbrkm.smtpguard.gateway.smtp.policy.check;

import io.github.hotbrkm.smtpguard.gateway.smtp.error.EnhancedCode;
import io.github.hotbrkm.smtpguard.gateway.smtp.error.SmtpError;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.DnsLookupException;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.DnsResolver.QueryStatus;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.LookupContext;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.TestDnsResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnknownHostException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MxRecordCheck Test")
class MxRecordCheckTest {

    private final MxRecordCheck check = new MxRecordCheck();
    private TestDnsResolver resolver;
    private SocketAddress remote;

    @BeforeEach
    void setUp() throws UnknownHostException {
        resolver = new TestDnsResolver();
        remote = new InetSocketAddress(InetAddress.getByName("192.0.2.1"), 40000);
    }

    @Test
    @DisplayName("Passes the null reverse-path without any lookup")
    void shouldPassEmptyReturnPath() {
        CheckResult result = check.check(context(""));

        assertThat(result.isPassed()).isTrue();
        assertThat(resolver.getMxLookupCount()).isZero();
    }

    @Test
    @DisplayName("Passes when the sender domain has MX records")
    void shouldPassWithMxRecords() {
        // given
        resolver.setMx("example.org", QueryStatus.SUCCESS, List.of("mx1.example.org", "mx2.example.org"));

        // when
        CheckResult result = check.check(context("sender@Example.ORG"));

        // then
        assertThat(result.isPassed()).isTrue();
        assertThat(resolver.getMxLookupCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Fails with 501 5.7.27 when the domain has no MX records")
    void shouldFailWithoutMxRecords() {
        resolver.setMx("example.org", QueryStatus.NO_RECORDS, List.of());

        SmtpError reason = check.check(context("sender@example.org")).reason();

        assertThat(reason.getCode()).isEqualTo(501);
        assertThat(reason.getEnhancedCode()).isEqualTo(EnhancedCode.of(5, 7, 27));
        assertThat(reason.getMessage()).isEqualTo("Domain in MAIL FROM has no MX records");
        assertThat(reason.getCheckName()).isEqualTo(MxRecordCheck.NAME);
    }

    @Test
    @DisplayName("A temporary lookup failure becomes 420 4.7.27")
    void shouldDeferOnTemporaryFailure() {
        // given
        resolver.setMx("example.org", QueryStatus.TEMP_ERROR, List.of());

        // when
        SmtpError reason = check.check(context("sender@example.org")).reason();

        // then
        assertThat(reason.getCode()).isEqualTo(420);
        assertThat(reason.getEnhancedCode()).isEqualTo(EnhancedCode.of(4, 7, 27));
        assertThat(reason.getMessage()).isEqualTo("DNS lookup failure during policy check");
        assertThat(reason.getCause()).isInstanceOf(DnsLookupException.class);
        assertThat(reason.getFields()).containsKey("reason");
    }

    @Test
    @DisplayName("A permanent lookup failure becomes 501 5.7.27")
    void shouldFailOnPermanentFailure() {
        resolver.setMx("example.org", QueryStatus.PERM_ERROR, List.of());

        SmtpError reason = check.check(context("sender@example.org")).reason();

        assertThat(reason.getCode()).isEqualTo(501);
        assertThat(reason.getEnhancedCode()).isEqualTo(EnhancedCode.of(5, 7, 27));
        assertThat(reason.getMessage()).isEqualTo("DNS lookup failure during policy check");
    }

    @Test
    @DisplayName("A non-existent domain is a permanent failure")
    void shouldFailOnUnknownDomain() {
        SmtpError reason = check.check(context("sender@nowhere.example")).reason();

        assertThat(reason.getCode()).isEqualTo(501);
        assertThat(reason.isTemporary()).isFalse();
    }

    @Test
    @DisplayName("The bare postmaster address fails with 501 5.1.8")
    void shouldFailForAddressWithoutDomain() {
        SmtpError reason = check.check(context("postmaster")).reason();

        assertThat(reason.getCode()).isEqualTo(501);
        assertThat(reason.getEnhancedCode()).isEqualTo(EnhancedCode.of(5, 1, 8));
        assertThat(reason.getMessage()).isEqualTo("No domain part");
        assertThat(resolver.getMxLookupCount()).isZero();
    }

    @Test
    @DisplayName("An address without an at-sign fails with 501 5.1.7")
    void shouldFailForMalformedAddress() {
        SmtpError reason = check.check(context("not-an-address")).reason();

        assertThat(reason.getCode()).isEqualTo(501);
        assertThat(reason.getEnhancedCode()).isEqualTo(EnhancedCode.of(5, 1, 7));
        assertThat(reason.getCause()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Skips the lookup for non-IP transports")
    void shouldSkipForNonIpSource() {
        CheckContext context = new CheckContext(
                ConnectionMeta.of(null, "mx.example.org", ReverseDnsName.notAttempted()),
                "sender@example.org", resolver, LookupContext.background());

        assertThat(check.check(context).isPassed()).isTrue();
        assertThat(resolver.getMxLookupCount()).isZero();
    }

    private CheckContext context(String mailFrom) {
        return new CheckContext(ConnectionMeta.of(remote, "mx.example.org", ReverseDnsName.notAttempted()),
                mailFrom, resolver, LookupContext.background());
    }
}
