/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.quotes.services.QuoteCache;
import villagecompute.quotes.services.UpstreamRateLimiter;

/**
 * Registers gauges for the quote layer's shared state.
 *
 * <p>
 * <b>Metrics:</b>
 * <ul>
 * <li>{@code quotes_cache_entries} - cached symbols, live and stale</li>
 * <li>{@code quotes_rate_limit_tokens_available} - whole upstream tokens left in the bucket</li>
 * </ul>
 *
 * <p>
 * Counters and timers for cache hits, misses, single-flight joins, stale fallbacks and upstream latency are recorded
 * by {@link QuoteCache} itself. Everything is exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class QuoteMetrics {

    private static final Logger LOG = Logger.getLogger(QuoteMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    QuoteCache quoteCache;

    @Inject
    UpstreamRateLimiter rateLimiter;

    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        LOG.info("Registering quote layer metrics");

        Gauge.builder("quotes_cache_entries", quoteCache, QuoteCache::size)
                .description("Cached quote entries, live and stale").register(registry);

        Gauge.builder("quotes_rate_limit_tokens_available", rateLimiter, UpstreamRateLimiter::availableTokens)
                .description("Upstream call tokens currently available").register(registry);
    }
}
