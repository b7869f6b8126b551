/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.quotes.api.types.QuoteType;
import villagecompute.quotes.exceptions.QuoteErrorCode;
import villagecompute.quotes.exceptions.QuoteFetchException;
import villagecompute.quotes.integration.stocks.UpstreamQuoteClient;
import villagecompute.quotes.testing.MutableClock;

/**
 * Unit tests for {@link QuoteCache}.
 *
 * <p>
 * Tests cache hits, TTL expiry, single-flight deduplication, rate limit denial, and stale fallback.
 */
class QuoteCacheTest {

    private static final Duration TTL = Duration.ofHours(1);

    private MutableClock clock;
    private MeterRegistry meterRegistry;
    private UpstreamRateLimiter rateLimiter;
    private QuoteCache cache;
    private AtomicInteger upstreamCalls;
    private UpstreamQuoteClient countingClient;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-09T15:00:00Z");
        meterRegistry = new SimpleMeterRegistry();
        rateLimiter = new UpstreamRateLimiter(5, Duration.ofSeconds(60), clock);
        cache = new QuoteCache(TTL, 1000, rateLimiter, clock, meterRegistry);
        upstreamCalls = new AtomicInteger();
        countingClient = symbol -> {
            upstreamCalls.incrementAndGet();
            return quote(symbol, "150.00");
        };
    }

    @Test
    void testGet_withinTtl_callsUpstreamOnce() {
        QuoteType first = cache.get("AAPL", countingClient);
        QuoteType second = cache.get("aapl", countingClient);

        assertEquals(1, upstreamCalls.get());
        assertSame(first, second);
        assertEquals(1.0, meterRegistry.counter("quotes.cache.hits").count());
    }

    @Test
    void testGet_cacheHit_doesNotConsumeToken() {
        cache.get("AAPL", countingClient);
        for (int i = 0; i < 10; i++) {
            cache.get("AAPL", countingClient);
        }

        assertEquals(4, rateLimiter.availableTokens());
    }

    @Test
    void testGet_afterTtl_refetchesExactlyOnce() {
        cache.get("AAPL", countingClient);

        clock.advance(TTL.plusSeconds(1));
        QuoteType refreshed = cache.get("AAPL", countingClient);
        cache.get("AAPL", countingClient);

        assertEquals(2, upstreamCalls.get());
        assertFalse(refreshed.stale());
        assertEquals(clock.instant().toString(), refreshed.lastUpdated());
    }

    @Test
    void testGet_concurrentMisses_singleUpstreamCall() throws Exception {
        int callers = 10;
        CountDownLatch upstreamEntered = new CountDownLatch(1);
        CountDownLatch releaseUpstream = new CountDownLatch(1);
        UpstreamQuoteClient slowClient = symbol -> {
            upstreamCalls.incrementAndGet();
            upstreamEntered.countDown();
            try {
                releaseUpstream.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return quote(symbol, "410.00");
        };

        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<QuoteType>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> cache.get("MSFT", slowClient)));
            }

            assertTrue(upstreamEntered.await(5, TimeUnit.SECONDS));
            // Give the remaining callers time to reach the in-flight slot
            Thread.sleep(200);
            releaseUpstream.countDown();

            QuoteType expected = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<QuoteType> result : results) {
                assertSame(expected, result.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, upstreamCalls.get());
            assertEquals(4, rateLimiter.availableTokens());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testGet_sixUncachedSymbols_atMostFiveUpstreamCalls() {
        List<QuoteType> results = new ArrayList<>();
        for (String symbol : List.of("AAPL", "MSFT", "GOOGL", "AMZN", "TSLA", "NVDA")) {
            results.add(cache.get(symbol, countingClient));
        }

        assertEquals(5, upstreamCalls.get());
        QuoteType sixth = results.get(5);
        assertEquals(QuoteErrorCode.RATE_LIMITED, sixth.errorCode());
        assertFalse(sixth.stale());
        assertNull(sixth.price());
        assertNull(cache.peek("NVDA"), "rate limited results are not cached");
    }

    @Test
    void testGet_rateLimitedWithStaleEntry_servesAnnotatedFallback() {
        QuoteType original = cache.get("AAPL", countingClient);
        for (String symbol : List.of("MSFT", "GOOGL", "AMZN", "TSLA")) {
            cache.get(symbol, countingClient);
        }
        clock.advance(TTL);
        // Refill tokens landed, spend them again
        while (rateLimiter.tryAcquire().granted()) {
            // drain
        }

        QuoteType fallback = cache.get("AAPL", countingClient);

        assertEquals(5, upstreamCalls.get());
        assertTrue(fallback.stale());
        assertEquals(QuoteErrorCode.RATE_LIMITED, fallback.errorCode());
        assertEquals(original.price(), fallback.price());
        assertEquals(original.lastUpdated(), fallback.lastUpdated());
    }

    @Test
    void testGet_upstreamFailureWithStaleEntry_servesAnnotatedFallback() {
        QuoteType original = cache.get("AAPL", countingClient);
        clock.advance(TTL.plusMinutes(5));

        QuoteType fallback = cache.get("AAPL", symbol -> {
            throw new QuoteFetchException(QuoteErrorCode.TIMEOUT, "Alpha Vantage request for AAPL timed out");
        });

        assertTrue(fallback.stale());
        assertFalse(fallback.failed());
        assertEquals(QuoteErrorCode.TIMEOUT, fallback.errorCode());
        assertEquals("Alpha Vantage request for AAPL timed out", fallback.error());
        assertEquals(original.price(), fallback.price());
        assertSame(original, cache.peek("AAPL").quote(), "stale entry is kept, not replaced by the failure");
    }

    @Test
    void testGet_upstreamFailureWithoutEntry_returnsErrorAndDoesNotCache() {
        QuoteType failed = cache.get("NOPE", symbol -> {
            throw new QuoteFetchException(QuoteErrorCode.NOT_FOUND, "Symbol NOPE not found");
        });

        assertTrue(failed.failed());
        assertEquals(QuoteErrorCode.NOT_FOUND, failed.errorCode());
        assertEquals("NOPE", failed.symbol());
        assertNotNull(failed.lastUpdated());
        assertNull(cache.peek("NOPE"));

        QuoteType retried = cache.get("NOPE", countingClient);
        assertEquals(1, upstreamCalls.get(), "next request retries upstream");
        assertNull(retried.errorCode());
    }

    @Test
    void testGet_unexpectedException_mapsToUpstreamUnavailable() {
        QuoteType failed = cache.get("AAPL", symbol -> {
            throw new IllegalStateException("boom");
        });

        assertEquals(QuoteErrorCode.UPSTREAM_UNAVAILABLE, failed.errorCode());
        assertEquals(1.0, meterRegistry.counter("quotes.fetch.total", "status", "error").count());
    }

    @Test
    void testGet_invalidSymbol_skipsCacheAndLimiter() {
        QuoteType invalid = cache.get(" INVALID@@ ", countingClient);

        assertEquals(QuoteErrorCode.INVALID_SYMBOL, invalid.errorCode());
        assertEquals("INVALID@@", invalid.symbol());
        assertEquals(0, upstreamCalls.get());
        assertEquals(5, rateLimiter.availableTokens());
        assertEquals(0.0, meterRegistry.counter("quotes.cache.misses").count());
        assertEquals(0, cache.size());
    }

    @Test
    void testGet_successfulRefreshReplacesStaleEntry() {
        cache.get("AAPL", countingClient);
        clock.advance(TTL.plusSeconds(30));

        QuoteType refreshed = cache.get("AAPL", symbol -> quote(symbol, "155.00"));

        assertEquals(new BigDecimal("155.00"), refreshed.price());
        assertSame(refreshed, cache.peek("AAPL").quote());
        assertEquals(1, cache.size());
    }

    private QuoteType quote(String symbol, String price) {
        return QuoteType.of(symbol, symbol + " Inc", new BigDecimal(price), new BigDecimal("5.00"),
                new BigDecimal(price).divide(new BigDecimal("5.00")), "1000000000", clock.instant());
    }
}
