/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import org.jboss.logging.Logger;

/**
 * Process-wide token bucket guarding the upstream provider's call budget.
 *
 * <p>
 * The bucket starts full. Tokens are replenished lazily on each {@link #tryAcquire()} in proportion to the time elapsed
 * since the last refill, so an empty bucket regains one token every {@code refillInterval / capacity}. There is no
 * background timer and the limiter never blocks: a denied caller receives the wait until the next token and decides
 * for itself whether to wait, give up, or serve stale data.
 *
 * <p>
 * <b>Thread Safety:</b> refill and decrement run under the instance monitor, so concurrent acquisitions never lose
 * updates and the token count never exceeds capacity.
 */
public class UpstreamRateLimiter {

    private static final Logger LOG = Logger.getLogger(UpstreamRateLimiter.class);

    private final int capacity;
    private final Duration refillInterval;
    private final Clock clock;

    private final long nanosPerWindow;

    // One token equals nanosPerWindow units of credit; elapsed time adds capacity units per nanosecond
    private long credit;
    private Instant lastRefill;

    /**
     * Outcome of an acquisition attempt.
     *
     * @param granted
     *            true if a token was consumed
     * @param retryAfter
     *            time until the next token becomes available, zero when granted
     */
    public record Permit(boolean granted, Duration retryAfter) {

        static Permit grant() {
            return new Permit(true, Duration.ZERO);
        }

        static Permit deny(Duration retryAfter) {
            return new Permit(false, retryAfter);
        }
    }

    public UpstreamRateLimiter(int capacity, Duration refillInterval, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
        }
        Objects.requireNonNull(refillInterval, "refillInterval is required");
        if (refillInterval.isZero() || refillInterval.isNegative()) {
            throw new IllegalArgumentException("refillInterval must be positive, got " + refillInterval);
        }
        this.capacity = capacity;
        this.refillInterval = refillInterval;
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.nanosPerWindow = refillInterval.toNanos();
        this.credit = capacity * nanosPerWindow;
        this.lastRefill = clock.instant();
    }

    /**
     * Attempts to take one token.
     *
     * @return granted permit, or a denial carrying the time until the next token
     */
    public synchronized Permit tryAcquire() {
        refill();

        if (credit >= nanosPerWindow) {
            credit -= nanosPerWindow;
            LOG.debugf("Upstream token granted (%d remaining)", credit / nanosPerWindow);
            return Permit.grant();
        }

        long missing = nanosPerWindow - credit;
        Duration retryAfter = Duration.ofNanos((missing + capacity - 1) / capacity);
        LOG.debugf("Upstream token denied, next token in %d ms", retryAfter.toMillis());
        return Permit.deny(retryAfter);
    }

    /**
     * @return whole tokens currently available, after applying any pending refill
     */
    public synchronized int availableTokens() {
        refill();
        return (int) (credit / nanosPerWindow);
    }

    public int getCapacity() {
        return capacity;
    }

    public Duration getRefillInterval() {
        return refillInterval;
    }

    private void refill() {
        Instant now = clock.instant();
        if (!now.isAfter(lastRefill)) {
            return;
        }
        // A full window refills the bucket, so longer gaps need not be measured exactly
        long elapsedNanos = Math.min(Duration.between(lastRefill, now).toNanos(), nanosPerWindow);
        credit = Math.min(capacity * nanosPerWindow, credit + elapsedNanos * capacity);
        lastRefill = now;
    }
}
