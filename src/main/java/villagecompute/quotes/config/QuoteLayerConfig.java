/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.config;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.quotes.exceptions.QuoteConfigurationException;
import villagecompute.quotes.integration.stocks.AlphaVantageClient;
import villagecompute.quotes.integration.stocks.UpstreamQuoteClient;
import villagecompute.quotes.services.QuoteBatchCoordinator;
import villagecompute.quotes.services.QuoteCache;
import villagecompute.quotes.services.UpstreamRateLimiter;

/**
 * Configuration and wiring for the quote retrieval layer.
 *
 * <p>
 * Validates settings at startup and produces one instance each of the rate limiter, cache, upstream client and batch
 * coordinator. Those classes take their settings through constructors and hold no static state.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code quotes.upstream.api-key} - Alpha Vantage API key (from ALPHAVANTAGE_API_KEY env var)</li>
 * <li>{@code quotes.upstream.primary-url} - query endpoint (default: https://www.alphavantage.co/query)</li>
 * <li>{@code quotes.upstream.secondary-url} - optional endpoint tried after a transport failure</li>
 * <li>{@code quotes.upstream.timeout} - timeout per attempt (default: PT10S)</li>
 * <li>{@code quotes.cache.ttl} - cache entry lifetime (default: PT1H)</li>
 * <li>{@code quotes.cache.max-entries} - cache size bound (default: 10000)</li>
 * <li>{@code quotes.rate-limit.capacity} - upstream calls per window (default: 5)</li>
 * <li>{@code quotes.rate-limit.refill-interval} - full refill window (default: PT60S)</li>
 * <li>{@code quotes.default-symbols} - dashboard watchlist (default: AAPL,GOOGL,MSFT,TSLA)</li>
 * </ul>
 */
@ApplicationScoped
@Startup
public class QuoteLayerConfig {

    private static final Logger LOG = Logger.getLogger(QuoteLayerConfig.class);

    @ConfigProperty(
            name = "quotes.upstream.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "quotes.upstream.primary-url",
            defaultValue = "https://www.alphavantage.co/query")
    String primaryUrl;

    @ConfigProperty(
            name = "quotes.upstream.secondary-url")
    Optional<String> secondaryUrl;

    @ConfigProperty(
            name = "quotes.upstream.timeout",
            defaultValue = "PT10S")
    Duration upstreamTimeout;

    @ConfigProperty(
            name = "quotes.cache.ttl",
            defaultValue = "PT1H")
    Duration cacheTtl;

    @ConfigProperty(
            name = "quotes.cache.max-entries",
            defaultValue = "10000")
    long cacheMaxEntries;

    @ConfigProperty(
            name = "quotes.rate-limit.capacity",
            defaultValue = "5")
    int rateLimitCapacity;

    @ConfigProperty(
            name = "quotes.rate-limit.refill-interval",
            defaultValue = "PT60S")
    Duration rateLimitRefillInterval;

    @ConfigProperty(
            name = "quotes.default-symbols",
            defaultValue = "AAPL,GOOGL,MSFT,TSLA")
    List<String> defaultSymbols;

    /**
     * Rejects settings the quote layer cannot run with.
     *
     * @throws QuoteConfigurationException
     *             if a duration is not positive, capacity or cache size is below 1, or the primary URL is blank
     */
    @PostConstruct
    public void validateConfiguration() {
        requirePositive("quotes.upstream.timeout", upstreamTimeout);
        requirePositive("quotes.cache.ttl", cacheTtl);
        requirePositive("quotes.rate-limit.refill-interval", rateLimitRefillInterval);
        if (rateLimitCapacity < 1) {
            fail("quotes.rate-limit.capacity must be at least 1, got " + rateLimitCapacity);
        }
        if (cacheMaxEntries < 1) {
            fail("quotes.cache.max-entries must be at least 1, got " + cacheMaxEntries);
        }
        if (primaryUrl == null || primaryUrl.isBlank()) {
            fail("quotes.upstream.primary-url must not be blank");
        }

        if (apiKey.isEmpty() || apiKey.get().isBlank()) {
            LOG.warn("ALPHAVANTAGE_API_KEY is not configured; upstream quote fetches will fail until it is set");
        }

        LOG.infof("Quote layer configured: ttl=%s, rate limit=%d per %s, timeout=%s, secondary endpoint=%s", cacheTtl,
                rateLimitCapacity, rateLimitRefillInterval, upstreamTimeout, secondaryUrl.isPresent());
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public UpstreamRateLimiter upstreamRateLimiter(Clock clock) {
        return new UpstreamRateLimiter(rateLimitCapacity, rateLimitRefillInterval, clock);
    }

    @Produces
    @Singleton
    public QuoteCache quoteCache(UpstreamRateLimiter rateLimiter, Clock clock, MeterRegistry meterRegistry) {
        return new QuoteCache(cacheTtl, cacheMaxEntries, rateLimiter, clock, meterRegistry);
    }

    @Produces
    @Singleton
    public UpstreamQuoteClient upstreamQuoteClient(ObjectMapper objectMapper, Clock clock) {
        URI secondary = secondaryUrl.filter(url -> !url.isBlank()).map(URI::create).orElse(null);
        return new AlphaVantageClient(objectMapper, apiKey.orElse(""), URI.create(primaryUrl), secondary,
                upstreamTimeout, clock);
    }

    @Produces
    @Singleton
    @Named("quoteBatchExecutor")
    public ExecutorService quoteBatchExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "quote-batch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }

    void shutdownQuoteBatchExecutor(@Disposes @Named("quoteBatchExecutor") ExecutorService executor) {
        executor.shutdownNow();
    }

    @Produces
    @Singleton
    public QuoteBatchCoordinator quoteBatchCoordinator(QuoteCache cache, UpstreamQuoteClient upstreamClient,
            @Named("quoteBatchExecutor") ExecutorService executor, Clock clock) {
        return new QuoteBatchCoordinator(cache, upstreamClient, executor, clock);
    }

    /**
     * @return configured default watchlist, normalized to uppercase
     */
    public List<String> defaultSymbols() {
        return defaultSymbols.stream().map(String::trim).filter(s -> !s.isEmpty())
                .map(s -> s.toUpperCase(Locale.ROOT)).toList();
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            fail(name + " must be a positive duration, got " + value);
        }
    }

    private static void fail(String message) {
        LOG.fatal(message);
        throw new QuoteConfigurationException(message);
    }
}
