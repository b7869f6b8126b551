/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.quotes.api.types.QuoteType;
import villagecompute.quotes.config.QuoteLayerConfig;
import villagecompute.quotes.exceptions.InvalidBatchSizeException;
import villagecompute.quotes.exceptions.QuoteErrorCode;
import villagecompute.quotes.integration.stocks.UpstreamQuoteClient;

/**
 * Unit tests for {@link StockQuoteService}.
 */
class StockQuoteServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-09T15:00:00Z");

    @Mock
    QuoteCache quoteCache;

    @Mock
    UpstreamQuoteClient upstreamClient;

    @Mock
    QuoteBatchCoordinator batchCoordinator;

    @Mock
    QuoteLayerConfig config;

    @Mock
    Tracer tracer;

    @InjectMocks
    StockQuoteService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        // Mock OpenTelemetry tracer
        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));
    }

    @Test
    void testGetQuote_delegatesToCacheWithUpstreamClient() {
        QuoteType aapl = QuoteType.of("AAPL", "Apple Inc", new BigDecimal("200.0000"), new BigDecimal("6.42"),
                new BigDecimal("30.25"), "3000000000000", NOW);
        when(quoteCache.get("aapl", upstreamClient)).thenReturn(aapl);

        QuoteType result = service.getQuote("aapl");

        assertSame(aapl, result);
        verify(tracer).spanBuilder("quotes.get_quote");
    }

    @Test
    void testGetQuote_errorQuoteReturnedAsIs() {
        QuoteType notFound = QuoteType.failure("ZZZZ", QuoteErrorCode.NOT_FOUND, "Symbol ZZZZ not found", NOW);
        when(quoteCache.get("ZZZZ", upstreamClient)).thenReturn(notFound);

        QuoteType result = service.getQuote("ZZZZ");

        assertEquals(QuoteErrorCode.NOT_FOUND, result.errorCode());
    }

    @Test
    void testGetQuotes_delegatesToCoordinator() {
        List<String> symbols = List.of("AAPL", "MSFT");
        List<QuoteType> quotes = List.of(
                QuoteType.failure("AAPL", QuoteErrorCode.TIMEOUT, "Timed out fetching AAPL", NOW),
                QuoteType.failure("MSFT", QuoteErrorCode.TIMEOUT, "Timed out fetching MSFT", NOW));
        when(batchCoordinator.fetchBatch(symbols)).thenReturn(quotes);

        assertSame(quotes, service.getQuotes(symbols));
        verify(tracer).spanBuilder("quotes.fetch_batch");
        verifyNoInteractions(quoteCache);
    }

    @Test
    void testGetQuotes_invalidBatchSizePropagates() {
        List<String> symbols = List.of();
        when(batchCoordinator.fetchBatch(symbols)).thenThrow(new InvalidBatchSizeException(0, 10));

        assertThrows(InvalidBatchSizeException.class, () -> service.getQuotes(symbols));
    }

    @Test
    void testGetDefaultSymbols() {
        when(config.defaultSymbols()).thenReturn(List.of("AAPL", "GOOGL", "MSFT", "TSLA"));

        assertEquals(List.of("AAPL", "GOOGL", "MSFT", "TSLA"), service.getDefaultSymbols());
    }
}
