/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.services;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

import org.jboss.logging.Logger;

import villagecompute.quotes.api.types.QuoteType;
import villagecompute.quotes.exceptions.InvalidBatchSizeException;
import villagecompute.quotes.exceptions.InvalidSymbolException;
import villagecompute.quotes.exceptions.QuoteErrorCode;
import villagecompute.quotes.integration.stocks.UpstreamQuoteClient;
import villagecompute.quotes.util.SymbolNormalizer;

/**
 * Fans a batch of symbols out to {@link QuoteCache} concurrently and reassembles the results in request order.
 *
 * <p>
 * Every position gets exactly one quote. An invalid symbol, a denied token or a failed fetch only affects its own
 * position. Positions that normalize to the same symbol share a single lookup. The coordinator adds no parallelism cap
 * of its own: cache hits run uncontended and upstream calls are throttled by the rate limiter inside the cache.
 */
public class QuoteBatchCoordinator {

    private static final Logger LOG = Logger.getLogger(QuoteBatchCoordinator.class);

    public static final int MAX_BATCH_SIZE = 10;

    private final QuoteCache cache;
    private final UpstreamQuoteClient upstreamClient;
    private final ExecutorService executor;
    private final Clock clock;

    public QuoteBatchCoordinator(QuoteCache cache, UpstreamQuoteClient upstreamClient, ExecutorService executor,
            Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.upstreamClient = Objects.requireNonNull(upstreamClient, "upstreamClient is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Fetches quotes for up to {@value #MAX_BATCH_SIZE} symbols.
     *
     * @param rawSymbols
     *            symbols as supplied by the caller, in display order
     * @return one quote per input position, in input order
     * @throws InvalidBatchSizeException
     *             if the batch is null, empty, or larger than {@value #MAX_BATCH_SIZE}; no fetch is started
     */
    public List<QuoteType> fetchBatch(List<String> rawSymbols) {
        int size = rawSymbols == null ? 0 : rawSymbols.size();
        if (size < 1 || size > MAX_BATCH_SIZE) {
            throw new InvalidBatchSizeException(size, MAX_BATCH_SIZE);
        }

        LOG.debugf("Fetching batch of %d symbols", size);

        List<CompletableFuture<QuoteType>> positions = new ArrayList<>(size);
        Map<String, CompletableFuture<QuoteType>> lookups = new LinkedHashMap<>();

        for (String raw : rawSymbols) {
            String symbol;
            try {
                symbol = SymbolNormalizer.normalize(raw);
            } catch (InvalidSymbolException e) {
                String shown = raw == null ? "" : raw.trim();
                positions.add(CompletableFuture.completedFuture(
                        QuoteType.failure(shown, e.getErrorCode(), e.getMessage(), clock.instant())));
                continue;
            }
            positions.add(lookups.computeIfAbsent(symbol,
                    s -> CompletableFuture.supplyAsync(() -> cache.getNormalized(s, upstreamClient), executor)));
        }

        List<QuoteType> results = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            results.add(collect(rawSymbols.get(i), positions.get(i)));
        }

        long failures = results.stream().filter(QuoteType::failed).count();
        LOG.debugf("Batch of %d symbols complete (%d unique lookups, %d failed)", size, lookups.size(), failures);
        return results;
    }

    private QuoteType collect(String raw, CompletableFuture<QuoteType> position) {
        try {
            return position.join();
        } catch (CompletionException e) {
            String symbol = SymbolNormalizer.isValid(raw) ? SymbolNormalizer.normalize(raw) : String.valueOf(raw);
            LOG.errorf(e.getCause(), "Batch lookup failed for symbol %s", symbol);
            return QuoteType.failure(symbol, QuoteErrorCode.UPSTREAM_UNAVAILABLE, "Failed to fetch quote for " + symbol,
                    clock.instant());
        }
    }
}
