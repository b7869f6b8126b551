/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.api.types;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Full company metrics view returned by {@code GET /stock-info/{symbol}}.
 */
@Schema(
        description = "Company metrics for a single symbol")
public record StockInfoType(String symbol, @JsonProperty("company_name") String companyName,
        @JsonProperty("pe_ratio") BigDecimal peRatio, BigDecimal price,
        @JsonProperty("earnings_per_share") BigDecimal earningsPerShare, @JsonProperty("market_cap") String marketCap,
        @JsonProperty("last_updated") String lastUpdated) {

    public static StockInfoType from(QuoteType quote) {
        return new StockInfoType(quote.symbol(), quote.companyName(), quote.peRatio(), quote.price(),
                quote.earningsPerShare(), quote.marketCap(), quote.lastUpdated());
    }
}
