package io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns;

import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.PTRRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.ReverseMap;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.net.InetAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * DNS queries used by the identity checks.
 * <p>
 * Every query is bound to a {@link LookupContext}. The query runs on the lookup executor while
 * the calling thread waits for whichever comes first: the answer, the context's cancellation or
 * its deadline. Cancellation, deadline and interruption are reported as {@link QueryStatus#TEMP_ERROR}.
 * </p>
 * <p>
 * Answers are never cached and failed queries are not retried.
 * </p>
 */
@Slf4j
public class DnsResolver {

    private final Executor executor;

    public DnsResolver(Executor executor) {
        this.executor = executor;
    }

    public QueryResult mxLookup(String domain, LookupContext context) {
        return lookup(domain, Type.MX, context);
    }

    /**
     * Looks up both A and AAAA records of a host.
     * <p>
     * Succeeds when either query returns addresses. A temporary failure of the other query is
     * kept as {@link QueryResult#partialFailure()}, since the missing family may hold the address
     * a caller is looking for. Otherwise a temporary failure of either query makes the whole
     * lookup temporary.
     * </p>
     */
    public QueryResult addressLookup(String host, LookupContext context) {
        QueryResult a = lookup(host, Type.A, context);
        QueryResult aaaa = lookup(host, Type.AAAA, context);
        return combineAddresses(host, a, aaaa);
    }

    static QueryResult combineAddresses(String host, QueryResult a, QueryResult aaaa) {
        List<Record> records = new ArrayList<>(a.records());
        records.addAll(aaaa.records());
        if (a.status() == QueryStatus.SUCCESS || aaaa.status() == QueryStatus.SUCCESS) {
            QueryResult other = a.status() == QueryStatus.SUCCESS ? aaaa : a;
            QueryResult partial = other.isTemporary() ? other : null;
            return new QueryResult(QueryStatus.SUCCESS, records, null, partial);
        }
        if (a.status() == QueryStatus.TEMP_ERROR || aaaa.status() == QueryStatus.TEMP_ERROR) {
            return QueryResult.failure(QueryStatus.TEMP_ERROR, firstDetail(a, aaaa, QueryStatus.TEMP_ERROR));
        }
        if (a.status() == QueryStatus.PERM_ERROR || aaaa.status() == QueryStatus.PERM_ERROR) {
            return QueryResult.failure(QueryStatus.PERM_ERROR, firstDetail(a, aaaa, QueryStatus.PERM_ERROR));
        }
        if (a.status() == QueryStatus.NOT_FOUND || aaaa.status() == QueryStatus.NOT_FOUND) {
            return QueryResult.failure(QueryStatus.NOT_FOUND, firstDetail(a, aaaa, QueryStatus.NOT_FOUND));
        }
        return QueryResult.failure(QueryStatus.NO_RECORDS, "no A/AAAA records for " + host);
    }

    public QueryResult ptrLookup(InetAddress address, LookupContext context) {
        return lookup(ReverseMap.fromAddress(address), Type.PTR, context);
    }

    private QueryResult lookup(String name, int type, LookupContext context) {
        Name parsed;
        try {
            parsed = Name.fromString(name, Name.root);
        } catch (TextParseException e) {
            log.debug("DNS lookup parse error: name={}, type={}, message={}", name, Type.string(type), e.getMessage());
            return QueryResult.failure(QueryStatus.PERM_ERROR, e.getMessage());
        }
        return lookup(parsed, type, context);
    }

    private QueryResult lookup(Name name, int type, LookupContext context) {
        if (context.isDone()) {
            return QueryResult.failure(QueryStatus.TEMP_ERROR, context.doneReason());
        }

        CompletableFuture<QueryResult> query = CompletableFuture.supplyAsync(() -> runLookup(name, type), executor);
        CompletableFuture<Object> first = CompletableFuture.anyOf(query, context.cancellation());
        try {
            Optional<Duration> remaining = context.remaining();
            Object value = remaining.isPresent()
                    ? first.get(remaining.get().toNanos(), TimeUnit.NANOSECONDS)
                    : first.get();
            if (value instanceof QueryResult result) {
                return result;
            }
            query.cancel(true);
            return QueryResult.failure(QueryStatus.TEMP_ERROR, context.doneReason());
        } catch (TimeoutException e) {
            query.cancel(true);
            log.debug("DNS lookup timed out: name={}, type={}", name, Type.string(type));
            return QueryResult.failure(QueryStatus.TEMP_ERROR, "lookup deadline exceeded");
        } catch (InterruptedException e) {
            query.cancel(true);
            Thread.currentThread().interrupt();
            return QueryResult.failure(QueryStatus.TEMP_ERROR, "lookup interrupted");
        } catch (ExecutionException | CancellationException e) {
            log.debug("DNS lookup failed: name={}, type={}, message={}", name, Type.string(type), e.getMessage());
            return QueryResult.failure(QueryStatus.TEMP_ERROR, e.getMessage());
        }
    }

    private QueryResult runLookup(Name name, int type) {
        try {
            Lookup lookup = new Lookup(name, type);
            lookup.setCache(null);
            Record[] records = lookup.run();
            QueryStatus status = mapStatus(lookup.getResult());
            if (records == null) {
                records = new Record[0];
            }
            return new QueryResult(status, List.of(records), lookup.getErrorString());
        } catch (RuntimeException e) {
            log.debug("DNS lookup runtime error: name={}, type={}, message={}", name, Type.string(type), e.getMessage());
            return QueryResult.failure(QueryStatus.TEMP_ERROR, e.getMessage());
        }
    }

    private QueryStatus mapStatus(int result) {
        return switch (result) {
            case Lookup.SUCCESSFUL -> QueryStatus.SUCCESS;
            case Lookup.HOST_NOT_FOUND -> QueryStatus.NOT_FOUND;
            case Lookup.TYPE_NOT_FOUND -> QueryStatus.NO_RECORDS;
            case Lookup.TRY_AGAIN -> QueryStatus.TEMP_ERROR;
            default -> QueryStatus.PERM_ERROR;
        };
    }

    private static String firstDetail(QueryResult a, QueryResult aaaa, QueryStatus status) {
        return a.status() == status ? a.detail() : aaaa.detail();
    }

    public enum QueryStatus {
        /** The name exists and has records of the queried type. */
        SUCCESS,
        /** The name exists but has no records of the queried type. */
        NO_RECORDS,
        /** The name does not exist. */
        NOT_FOUND,
        /** Timeout, cancellation or server failure; asking again later may succeed. */
        TEMP_ERROR,
        /** The query can't succeed, e.g. a malformed name. */
        PERM_ERROR
    }

    /**
     * @param partialFailure for a combined lookup that succeeded, the temporary failure of the
     *                       query that did not; {@code null} otherwise
     */
    public record QueryResult(QueryStatus status, List<Record> records, String detail, QueryResult partialFailure) {

        public QueryResult {
            records = records == null ? List.of() : List.copyOf(records);
        }

        public QueryResult(QueryStatus status, List<Record> records, String detail) {
            this(status, records, detail, null);
        }

        public static QueryResult success(List<Record> records) {
            return new QueryResult(QueryStatus.SUCCESS, records, null);
        }

        public static QueryResult failure(QueryStatus status, String detail) {
            return new QueryResult(status, List.of(), detail);
        }

        /**
         * Whether the lookup failed. An empty answer is not a failure.
         */
        public boolean isFailure() {
            return status == QueryStatus.NOT_FOUND
                    || status == QueryStatus.TEMP_ERROR
                    || status == QueryStatus.PERM_ERROR;
        }

        public boolean isTemporary() {
            return status == QueryStatus.TEMP_ERROR;
        }

        public List<String> mxHosts() {
            List<String> values = new ArrayList<>();
            for (Record record : records) {
                if (record instanceof MXRecord mx) {
                    values.add(mx.getTarget().toString(true));
                }
            }
            return values;
        }

        public List<InetAddress> addresses() {
            List<InetAddress> values = new ArrayList<>();
            for (Record record : records) {
                if (record instanceof ARecord a) {
                    values.add(a.getAddress());
                } else if (record instanceof AAAARecord aaaa) {
                    values.add(aaaa.getAddress());
                }
            }
            return Collections.unmodifiableList(values);
        }

        public List<String> ptrNames() {
            List<String> values = new ArrayList<>();
            for (Record record : records) {
                if (record instanceof PTRRecord ptr) {
                    values.add(ptr.getTarget().toString());
                }
            }
            return values;
        }

        public DnsLookupException toException(String query) {
            return new DnsLookupException(query, status, detail);
        }
    }
}
