/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.jboss.logging.Logger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import villagecompute.quotes.api.types.QuoteType;
import villagecompute.quotes.exceptions.InvalidSymbolException;
import villagecompute.quotes.exceptions.QuoteErrorCode;
import villagecompute.quotes.exceptions.QuoteFetchException;
import villagecompute.quotes.integration.stocks.UpstreamQuoteClient;
import villagecompute.quotes.util.SymbolNormalizer;

/**
 * In-memory quote cache with TTL expiry, single-flight fetches and last-known-good fallback.
 *
 * <p>
 * <b>Lookup flow for {@link #get(String, UpstreamQuoteClient)}:</b>
 * <ol>
 * <li>Normalize the symbol. Invalid symbols yield an {@code INVALID_SYMBOL} quote without touching the cache or the
 * rate limiter.</li>
 * <li>A live entry is returned as-is (no limiter interaction).</li>
 * <li>Otherwise the caller either claims the in-flight slot for the symbol or joins the fetch already holding it.</li>
 * <li>The slot holder asks the {@link UpstreamRateLimiter} for a token. On denial it serves the stale entry annotated
 * with {@code RATE_LIMITED}, or a {@code RATE_LIMITED} quote when nothing is cached.</li>
 * <li>With a token it calls the fetcher. Success is stored with a fresh expiry. Failure serves the stale entry annotated
 * with the failure, or an uncached error quote so the next request retries.</li>
 * <li>The slot is released whatever the outcome.</li>
 * </ol>
 *
 * <p>
 * <b>Thread Safety:</b> entries live in a Caffeine cache bounded by size only; in-flight fetches are tracked in a
 * {@link ConcurrentHashMap} keyed by canonical symbol, so at most one upstream call per symbol is running at any time.
 * Unrelated symbols never contend.
 */
public class QuoteCache {

    private static final Logger LOG = Logger.getLogger(QuoteCache.class);

    private final Duration ttl;
    private final UpstreamRateLimiter rateLimiter;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Cache<String, QuoteCacheEntry> entries;
    private final ConcurrentMap<String, CompletableFuture<QuoteType>> inFlight = new ConcurrentHashMap<>();

    private final Counter hits;
    private final Counter misses;
    private final Counter joins;
    private final Counter staleServed;
    private final Counter rateLimited;

    public QuoteCache(Duration ttl, long maxEntries, UpstreamRateLimiter rateLimiter, Clock clock,
            MeterRegistry meterRegistry) {
        this.ttl = Objects.requireNonNull(ttl, "ttl is required");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
        this.entries = Caffeine.newBuilder().maximumSize(maxEntries).build();

        this.hits = Counter.builder("quotes.cache.hits").register(meterRegistry);
        this.misses = Counter.builder("quotes.cache.misses").register(meterRegistry);
        this.joins = Counter.builder("quotes.cache.joins").register(meterRegistry);
        this.staleServed = Counter.builder("quotes.cache.stale_served").register(meterRegistry);
        this.rateLimited = Counter.builder("quotes.rate_limit.denied").register(meterRegistry);
    }

    /**
     * Returns the quote for a symbol, fetching it through {@code fetcher} when no live entry exists.
     *
     * @param rawSymbol
     *            symbol as supplied by the caller
     * @param fetcher
     *            performs the real upstream call; may throw {@link QuoteFetchException}
     * @return quote, possibly error-bearing; never null
     */
    public QuoteType get(String rawSymbol, UpstreamQuoteClient fetcher) {
        String symbol;
        try {
            symbol = SymbolNormalizer.normalize(rawSymbol);
        } catch (InvalidSymbolException e) {
            LOG.debugf("Rejected invalid symbol '%s': %s", rawSymbol, e.getMessage());
            return invalidSymbol(e);
        }
        return getNormalized(symbol, fetcher);
    }

    /**
     * Same as {@link #get(String, UpstreamQuoteClient)} for a symbol already in canonical form.
     */
    QuoteType getNormalized(String symbol, UpstreamQuoteClient fetcher) {
        QuoteCacheEntry entry = entries.getIfPresent(symbol);
        if (entry != null && !entry.isExpired(clock.instant())) {
            hits.increment();
            LOG.debugf("Cache hit for symbol %s (fetched at %s)", symbol, entry.fetchedAt());
            return entry.quote();
        }

        misses.increment();

        CompletableFuture<QuoteType> slot = new CompletableFuture<>();
        CompletableFuture<QuoteType> running = inFlight.putIfAbsent(symbol, slot);
        if (running != null) {
            joins.increment();
            LOG.debugf("Joining in-flight fetch for symbol %s", symbol);
            return await(symbol, running);
        }

        try {
            QuoteType result = fetchAsLeader(symbol, fetcher);
            slot.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            slot.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(symbol, slot);
        }
    }

    /**
     * @return the cached entry for a canonical symbol, live or stale, or null
     */
    public QuoteCacheEntry peek(String symbol) {
        return entries.getIfPresent(symbol);
    }

    /**
     * @return number of cached entries, live and stale
     */
    public long size() {
        return entries.estimatedSize();
    }

    /**
     * Drops every cached entry. In-flight fetches are unaffected.
     */
    public void invalidateAll() {
        entries.invalidateAll();
        LOG.info("Quote cache cleared");
    }

    private QuoteType fetchAsLeader(String symbol, UpstreamQuoteClient fetcher) {
        Instant now = clock.instant();

        // A fetch may have finished between the miss above and claiming the slot
        QuoteCacheEntry previous = entries.getIfPresent(symbol);
        if (previous != null && !previous.isExpired(now)) {
            return previous.quote();
        }

        UpstreamRateLimiter.Permit permit = rateLimiter.tryAcquire();
        if (!permit.granted()) {
            rateLimited.increment();
            String message = "Upstream call budget exhausted, retry after " + permit.retryAfter().toSeconds() + "s";
            return fallback(symbol, previous, QuoteErrorCode.RATE_LIMITED, message, now);
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            QuoteType quote = fetcher.fetch(symbol);
            Instant fetchedAt = clock.instant();
            entries.put(symbol, new QuoteCacheEntry(quote, fetchedAt, fetchedAt.plus(ttl)));
            incrementFetch("success");
            LOG.debugf("Cached quote for %s (expires at %s)", symbol, fetchedAt.plus(ttl));
            return quote;
        } catch (QuoteFetchException e) {
            incrementFetch("error");
            return fallback(symbol, previous, e.getErrorCode(), e.getMessage(), clock.instant());
        } catch (RuntimeException e) {
            incrementFetch("error");
            LOG.errorf(e, "Unexpected failure fetching quote for symbol %s", symbol);
            return fallback(symbol, previous, QuoteErrorCode.UPSTREAM_UNAVAILABLE,
                    "Failed to fetch quote for " + symbol, clock.instant());
        } finally {
            sample.stop(Timer.builder("quotes.upstream.duration").register(meterRegistry));
        }
    }

    private QuoteType fallback(String symbol, QuoteCacheEntry previous, QuoteErrorCode code, String message,
            Instant attemptedAt) {
        if (previous != null) {
            staleServed.increment();
            LOG.warnf("Serving stale quote for %s (fetched at %s) after %s: %s", symbol, previous.fetchedAt(), code,
                    message);
            return previous.quote().asStaleFallback(code, message);
        }
        LOG.warnf("No cached quote for %s after %s: %s", symbol, code, message);
        return QuoteType.failure(symbol, code, message, attemptedAt);
    }

    private QuoteType await(String symbol, CompletableFuture<QuoteType> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            LOG.errorf(e.getCause(), "In-flight fetch for symbol %s failed", symbol);
            return QuoteType.failure(symbol, QuoteErrorCode.UPSTREAM_UNAVAILABLE,
                    "Failed to fetch quote for " + symbol, clock.instant());
        }
    }

    private QuoteType invalidSymbol(InvalidSymbolException e) {
        String raw = e.getRawSymbol() == null ? "" : e.getRawSymbol().trim();
        return QuoteType.failure(raw, e.getErrorCode(), e.getMessage(), clock.instant());
    }

    private void incrementFetch(String status) {
        Counter.builder("quotes.fetch.total").tag("status", status).register(meterRegistry).increment();
    }
}
