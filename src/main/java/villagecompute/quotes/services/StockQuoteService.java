/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.services;

import java.util.List;

import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.quotes.api.types.QuoteType;
import villagecompute.quotes.config.QuoteLayerConfig;
import villagecompute.quotes.exceptions.InvalidBatchSizeException;
import villagecompute.quotes.integration.stocks.UpstreamQuoteClient;

/**
 * Application-scoped entry point for quote retrieval used by the REST layer.
 *
 * <p>
 * Single-symbol lookups go straight through {@link QuoteCache}; batches go through {@link QuoteBatchCoordinator}. Both
 * always answer with quote-shaped results for resolvable symbols. Only a malformed batch is rejected with an exception.
 * Each call runs inside an OpenTelemetry span.
 */
@ApplicationScoped
public class StockQuoteService {

    private static final Logger LOG = Logger.getLogger(StockQuoteService.class);

    @Inject
    QuoteCache quoteCache;

    @Inject
    UpstreamQuoteClient upstreamClient;

    @Inject
    QuoteBatchCoordinator batchCoordinator;

    @Inject
    QuoteLayerConfig config;

    @Inject
    Tracer tracer;

    /**
     * Get the quote for one symbol (cache-first).
     *
     * @param rawSymbol
     *            ticker symbol as supplied by the caller
     * @return quote, error-bearing when the symbol is invalid or could not be fetched
     */
    public QuoteType getQuote(String rawSymbol) {
        Span span = tracer.spanBuilder("quotes.get_quote").setAttribute("symbol", String.valueOf(rawSymbol))
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            QuoteType quote = quoteCache.get(rawSymbol, upstreamClient);
            if (quote.errorCode() != null) {
                span.setAttribute("error_code", quote.errorCode().name());
                span.setAttribute("stale", quote.stale());
                LOG.debugf("Quote for %s returned %s (stale=%s)", quote.symbol(), quote.errorCode(), quote.stale());
            }
            return quote;
        } finally {
            span.end();
        }
    }

    /**
     * Get quotes for a batch of symbols in request order.
     *
     * @param rawSymbols
     *            1 to {@value QuoteBatchCoordinator#MAX_BATCH_SIZE} ticker symbols
     * @return one quote per input position
     * @throws InvalidBatchSizeException
     *             if the batch size is out of range
     */
    public List<QuoteType> getQuotes(List<String> rawSymbols) {
        int size = rawSymbols == null ? 0 : rawSymbols.size();
        Span span = tracer.spanBuilder("quotes.fetch_batch").setAttribute("batch_size", size).startSpan();

        try (Scope scope = span.makeCurrent()) {
            return batchCoordinator.fetchBatch(rawSymbols);
        } catch (InvalidBatchSizeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * @return the watchlist the dashboard shows before the user searches
     */
    public List<String> getDefaultSymbols() {
        return config.defaultSymbols();
    }
}
