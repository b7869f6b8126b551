/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.integration.stocks;

import villagecompute.quotes.api.types.QuoteType;
import villagecompute.quotes.exceptions.QuoteFetchException;

/**
 * A single upstream quote lookup. Implementations issue exactly one provider request per call and never retry.
 */
@FunctionalInterface
public interface UpstreamQuoteClient {

    /**
     * Fetches current metrics for a symbol.
     *
     * @param symbol
     *            canonical ticker symbol
     * @return quote with any fields the provider left out set to null
     * @throws QuoteFetchException
     *             if the provider reports an error, throttles, times out, or returns an unreadable payload
     */
    QuoteType fetch(String symbol);
}
