/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.quotes.api.types.QuoteType;
import villagecompute.quotes.services.QuoteCache;
import villagecompute.quotes.services.UpstreamRateLimiter;
import villagecompute.quotes.testing.MutableClock;

/**
 * Unit tests for {@link QuoteMetrics} gauges.
 */
class QuoteMetricsTest {

    private SimpleMeterRegistry registry;
    private QuoteCache cache;
    private UpstreamRateLimiter limiter;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-01-09T15:00:00Z");
        registry = new SimpleMeterRegistry();
        limiter = new UpstreamRateLimiter(5, Duration.ofSeconds(60), clock);
        cache = new QuoteCache(Duration.ofHours(1), 100, limiter, clock, registry);

        QuoteMetrics metrics = new QuoteMetrics();
        metrics.registry = registry;
        metrics.quoteCache = cache;
        metrics.rateLimiter = limiter;
        metrics.registerMetrics(new Object());
    }

    @Test
    void testGaugesTrackCacheAndBucket() {
        assertEquals(0.0, registry.get("quotes_cache_entries").gauge().value());
        assertEquals(5.0, registry.get("quotes_rate_limit_tokens_available").gauge().value());

        cache.get("AAPL", symbol -> QuoteType.of(symbol, "Apple Inc", new BigDecimal("200.0000"),
                new BigDecimal("6.42"), new BigDecimal("30.25"), "3000000000000", Instant.EPOCH));

        assertEquals(1.0, registry.get("quotes_cache_entries").gauge().value());
        assertEquals(4.0, registry.get("quotes_rate_limit_tokens_available").gauge().value());
    }
}
