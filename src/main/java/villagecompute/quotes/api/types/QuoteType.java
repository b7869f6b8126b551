/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.api.types;

import java.math.BigDecimal;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.quotes.exceptions.QuoteErrorCode;

/**
 * Type representing the financial metrics of a single ticker symbol.
 *
 * <p>
 * All JSON-marshalled types in this project use the Type suffix and record classes. Numeric fields are null when the
 * provider did not supply them. When {@code error} is set the numeric fields are not trustworthy, unless
 * {@code stale} is also set, in which case they hold the last successfully fetched values.
 *
 * @param symbol
 *            canonical ticker symbol (uppercase), or the trimmed raw input for invalid symbols
 * @param companyName
 *            company name
 * @param price
 *            current share price
 * @param earningsPerShare
 *            trailing earnings per share
 * @param peRatio
 *            price-to-earnings ratio, provider-supplied or derived from price and EPS
 * @param marketCap
 *            market capitalization in whole currency units, kept as a string to avoid precision loss
 * @param lastUpdated
 *            ISO 8601 timestamp of the fetch (or of the failed attempt for error quotes)
 * @param error
 *            human-readable failure description
 * @param errorCode
 *            failure classification
 * @param stale
 *            true when this is last-known-good data served after a failed or denied refresh
 */
@Schema(
        description = "Stock quote with price, earnings and valuation metrics")
public record QuoteType(@Schema(
        description = "Stock ticker symbol (uppercase)",
        example = "AAPL",
        required = true) @NotBlank String symbol,

        @Schema(
                description = "Company name",
                example = "Apple Inc") @JsonProperty("company_name") String companyName,

        @Schema(
                description = "Current share price",
                example = "189.8400") BigDecimal price,

        @Schema(
                description = "Trailing earnings per share",
                example = "6.43") @JsonProperty("earnings_per_share") BigDecimal earningsPerShare,

        @Schema(
                description = "Price-to-earnings ratio",
                example = "29.52") @JsonProperty("pe_ratio") BigDecimal peRatio,

        @Schema(
                description = "Market capitalization",
                example = "2950000000000") @JsonProperty("market_cap") String marketCap,

        @Schema(
                description = "ISO 8601 timestamp when the quote was fetched",
                example = "2026-01-24T16:00:00Z",
                required = true) @JsonProperty("last_updated") @NotBlank String lastUpdated,

        @Schema(
                description = "Failure description, absent on success") String error,

        @Schema(
                description = "Failure classification, absent on success") @JsonProperty("error_code") QuoteErrorCode errorCode,

        @Schema(
                description = "True when last-known-good data is served after a failed refresh") boolean stale) {

    /**
     * Builds a successful quote.
     */
    public static QuoteType of(String symbol, String companyName, BigDecimal price, BigDecimal earningsPerShare,
            BigDecimal peRatio, String marketCap, Instant fetchedAt) {
        return new QuoteType(symbol, companyName, price, earningsPerShare, peRatio, marketCap, fetchedAt.toString(),
                null, null, false);
    }

    /**
     * Builds an error quote with no data.
     *
     * @param symbol
     *            canonical symbol, or the raw input when it failed normalization
     * @param errorCode
     *            failure classification
     * @param message
     *            failure description
     * @param attemptedAt
     *            time of the failed attempt
     */
    public static QuoteType failure(String symbol, QuoteErrorCode errorCode, String message, Instant attemptedAt) {
        return new QuoteType(symbol, null, null, null, null, null, attemptedAt.toString(), message, errorCode, false);
    }

    /**
     * Copies this quote's data and annotates it with the error that prevented a refresh.
     */
    public QuoteType asStaleFallback(QuoteErrorCode cause, String message) {
        return new QuoteType(symbol, companyName, price, earningsPerShare, peRatio, marketCap, lastUpdated, message,
                cause, true);
    }

    /**
     * @return true when the quote carries an error and no usable fallback data
     */
    public boolean failed() {
        return errorCode != null && !stale;
    }
}
