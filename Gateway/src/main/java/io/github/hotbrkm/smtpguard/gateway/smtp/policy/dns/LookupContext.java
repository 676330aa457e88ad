package io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Deadline and cancellation signal for the DNS lookups of one policy evaluation.
 * <p>
 * The caller owns the timeout: the resolver never picks its own. A lookup that is cancelled or
 * runs past the deadline is reported as a temporary failure.
 * </p>
 */
public final class LookupContext {

    private final Instant deadline;
    private final Clock clock;
    private final CompletableFuture<Void> cancellation = new CompletableFuture<>();

    private LookupContext(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * Context without a deadline. It can still be cancelled.
     */
    public static LookupContext background() {
        return new LookupContext(null, Clock.systemUTC());
    }

    public static LookupContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static LookupContext withTimeout(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be zero or positive: " + timeout);
        }
        return new LookupContext(clock.instant().plus(timeout), clock);
    }

    public static LookupContext withDeadline(Instant deadline) {
        if (deadline == null) {
            throw new IllegalArgumentException("deadline must not be null");
        }
        return new LookupContext(deadline, Clock.systemUTC());
    }

    public void cancel() {
        cancellation.complete(null);
    }

    public boolean isCancelled() {
        return cancellation.isDone();
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public boolean isDone() {
        return isCancelled() || isExpired();
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left until the deadline, never negative. Empty when there is no deadline.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Why the context is done, for error details.
     */
    public String doneReason() {
        if (isCancelled()) {
            return "lookup cancelled";
        }
        return isExpired() ? "lookup deadline exceeded" : "lookup in progress";
    }

    CompletableFuture<Void> cancellation() {
        return cancellation;
    }
}
