/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.api.types;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * PE ratio view of a quote returned by {@code GET /pe-ratio/{symbol}}.
 *
 * @param symbol
 *            canonical ticker symbol
 * @param peRatio
 *            price-to-earnings ratio
 * @param price
 *            current share price
 * @param earningsPerShare
 *            trailing earnings per share
 * @param lastUpdated
 *            ISO 8601 fetch timestamp
 * @param dataSource
 *            {@code alpha_vantage} for fresh data, {@code cache-stale} for last-known-good data
 */
@Schema(
        description = "PE ratio for a single symbol")
public record PeRatioType(String symbol, @JsonProperty("pe_ratio") BigDecimal peRatio, BigDecimal price,
        @JsonProperty("earnings_per_share") BigDecimal earningsPerShare,
        @JsonProperty("last_updated") String lastUpdated, @JsonProperty("data_source") String dataSource) {

    public static final String SOURCE_UPSTREAM = "alpha_vantage";
    public static final String SOURCE_STALE_CACHE = "cache-stale";

    public static PeRatioType from(QuoteType quote) {
        return new PeRatioType(quote.symbol(), quote.peRatio(), quote.price(), quote.earningsPerShare(),
                quote.lastUpdated(), quote.stale() ? SOURCE_STALE_CACHE : SOURCE_UPSTREAM);
    }
}
