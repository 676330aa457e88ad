package io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns;

import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.DnsResolver.QueryResult;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.DnsResolver.QueryStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Name;

import java.net.InetAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DnsResolver Test")
class DnsResolverTest {

    private final AtomicInteger submitted = new AtomicInteger();

    /** Accepts lookups but never runs them. */
    private final Executor stalledExecutor = runnable -> submitted.incrementAndGet();

    @Test
    @DisplayName("A cancelled context fails temporarily without querying DNS")
    void shouldNotQueryWithCancelledContext() {
        // given
        DnsResolver resolver = new DnsResolver(stalledExecutor);
        LookupContext context = LookupContext.background();
        context.cancel();

        // when
        QueryResult result = resolver.mxLookup("example.org", context);

        // then
        assertThat(result.status()).isEqualTo(QueryStatus.TEMP_ERROR);
        assertThat(result.detail()).isEqualTo("lookup cancelled");
        assertThat(result.isTemporary()).isTrue();
        assertThat(submitted).hasValue(0);
    }

    @Test
    @DisplayName("An expired context fails temporarily without querying DNS")
    void shouldNotQueryWithExpiredContext() {
        DnsResolver resolver = new DnsResolver(stalledExecutor);

        QueryResult result = resolver.addressLookup("mx.example.org", LookupContext.withTimeout(Duration.ZERO));

        assertThat(result.status()).isEqualTo(QueryStatus.TEMP_ERROR);
        assertThat(submitted).hasValue(0);
    }

    @Test
    @DisplayName("A lookup that outlives the deadline fails temporarily")
    void shouldTimeOutSlowLookup() {
        DnsResolver resolver = new DnsResolver(stalledExecutor);

        QueryResult result = resolver.mxLookup("example.org", LookupContext.withTimeout(Duration.ofMillis(50)));

        assertThat(result.status()).isEqualTo(QueryStatus.TEMP_ERROR);
        assertThat(result.detail()).isEqualTo("lookup deadline exceeded");
        assertThat(submitted).hasValue(1);
    }

    @Test
    @DisplayName("Cancelling while waiting ends the lookup")
    void shouldStopWaitingWhenCancelled() {
        DnsResolver resolver = new DnsResolver(stalledExecutor);
        LookupContext context = LookupContext.background();
        ScheduledExecutorService canceller = Executors.newSingleThreadScheduledExecutor();
        try {
            canceller.schedule(context::cancel, 50, TimeUnit.MILLISECONDS);

            QueryResult result = resolver.mxLookup("example.org", context);

            assertThat(result.status()).isEqualTo(QueryStatus.TEMP_ERROR);
            assertThat(result.detail()).isEqualTo("lookup cancelled");
        } finally {
            canceller.shutdownNow();
        }
    }

    @Test
    @DisplayName("A name that cannot be parsed fails permanently")
    void shouldFailPermanentlyOnInvalidName() {
        DnsResolver resolver = new DnsResolver(stalledExecutor);

        QueryResult result = resolver.mxLookup("a".repeat(64) + ".example.org", LookupContext.background());

        assertThat(result.status()).isEqualTo(QueryStatus.PERM_ERROR);
        assertThat(result.isFailure()).isTrue();
        assertThat(submitted).hasValue(0);
    }

    @Test
    @DisplayName("Extracts MX hosts and addresses from records")
    void shouldExtractRecordData() throws Exception {
        Name owner = Name.fromConstantString("example.org.");
        QueryResult mx = QueryResult.success(List.of(
                new MXRecord(owner, DClass.IN, 300L, 10, Name.fromConstantString("mx1.example.org."))));
        QueryResult a = QueryResult.success(List.of(
                new ARecord(owner, DClass.IN, 300L, InetAddress.getByName("192.0.2.1"))));

        assertThat(mx.mxHosts()).containsExactly("mx1.example.org");
        assertThat(a.addresses()).containsExactly(InetAddress.getByName("192.0.2.1"));
        assertThat(a.mxHosts()).isEmpty();
    }

    @Test
    @DisplayName("An empty answer is not a failure")
    void shouldTreatEmptyAnswerAsNonFailure() {
        QueryResult empty = new QueryResult(QueryStatus.NO_RECORDS, List.of(), null);
        QueryResult notFound = QueryResult.failure(QueryStatus.NOT_FOUND, "host not found");

        assertThat(empty.isFailure()).isFalse();
        assertThat(notFound.isFailure()).isTrue();
        assertThat(notFound.isTemporary()).isFalse();
        assertThat(notFound.toException("example.org MX").getMessage())
                .isEqualTo("lookup example.org MX: host not found");
    }

    @Test
    @DisplayName("A timed-out AAAA query is kept beside a successful A answer")
    void shouldKeepTemporaryFailureOfOtherFamily() throws Exception {
        Name owner = Name.fromConstantString("mx.example.org.");
        QueryResult a = QueryResult.success(List.of(
                new ARecord(owner, DClass.IN, 300L, InetAddress.getByName("192.0.2.1"))));
        QueryResult aaaa = QueryResult.failure(QueryStatus.TEMP_ERROR, "timed out");

        QueryResult combined = DnsResolver.combineAddresses("mx.example.org", a, aaaa);

        assertThat(combined.status()).isEqualTo(QueryStatus.SUCCESS);
        assertThat(combined.addresses()).containsExactly(InetAddress.getByName("192.0.2.1"));
        assertThat(combined.partialFailure()).isNotNull();
        assertThat(combined.partialFailure().isTemporary()).isTrue();
        assertThat(combined.partialFailure().detail()).isEqualTo("timed out");
    }

    @Test
    @DisplayName("Only temporary failures of the other family are kept")
    void shouldDropPermanentFailureOfOtherFamily() throws Exception {
        Name owner = Name.fromConstantString("mx.example.org.");
        QueryResult a = QueryResult.success(List.of(
                new ARecord(owner, DClass.IN, 300L, InetAddress.getByName("192.0.2.1"))));

        QueryResult withEmpty = DnsResolver.combineAddresses("mx.example.org", a,
                new QueryResult(QueryStatus.NO_RECORDS, List.of(), null));
        QueryResult withPermanent = DnsResolver.combineAddresses("mx.example.org", a,
                QueryResult.failure(QueryStatus.PERM_ERROR, "refused"));

        assertThat(withEmpty.partialFailure()).isNull();
        assertThat(withPermanent.partialFailure()).isNull();
    }

    @Test
    @DisplayName("Two empty answers combine into an empty answer")
    void shouldCombineEmptyAnswers() {
        QueryResult empty = new QueryResult(QueryStatus.NO_RECORDS, List.of(), null);

        QueryResult combined = DnsResolver.combineAddresses("mx.example.org", empty, empty);

        assertThat(combined.status()).isEqualTo(QueryStatus.NO_RECORDS);
        assertThat(combined.detail()).isEqualTo("no A/AAAA records for mx.example.org");
    }
}
