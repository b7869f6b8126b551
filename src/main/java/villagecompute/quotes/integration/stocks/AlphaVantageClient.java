/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.integration.stocks;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.quotes.api.types.QuoteType;
import villagecompute.quotes.exceptions.QuoteErrorCode;
import villagecompute.quotes.exceptions.QuoteFetchException;
import villagecompute.quotes.exceptions.RateLimitException;

/**
 * HTTP client for the Alpha Vantage company overview API.
 *
 * <p>
 * Alpha Vantage free tier includes:
 * <ul>
 * <li>25 requests per day</li>
 * <li>5 requests per minute</li>
 * </ul>
 *
 * <p>
 * Each {@link #fetch(String)} issues one {@code function=OVERVIEW} request, which supplies company name, EPS, PE ratio,
 * market capitalization and shares outstanding. The overview carries no live price, so price is derived as market
 * capitalization divided by shares outstanding. When the provider omits the PE ratio it is derived as price divided by
 * EPS, never when EPS is zero or missing.
 *
 * <p>
 * Rate limit responses are HTTP 200 with JSON containing a "Note" or "Information" field. Unknown symbols come back as
 * an empty JSON object.
 *
 * <p>
 * A transport failure on the primary endpoint is retried once against the secondary endpoint when one is configured.
 * Timeouts and HTTP error statuses are not retried.
 */
public class AlphaVantageClient implements UpstreamQuoteClient {

    private static final Logger LOG = Logger.getLogger(AlphaVantageClient.class);

    private static final int DECIMAL_SCALE = 4;
    private static final Set<String> MISSING_VALUES = Set.of("", "None", "-", "null");

    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final URI primaryUrl;
    private final URI secondaryUrl;
    private final Duration timeout;
    private final Clock clock;
    private final HttpClient httpClient;

    /**
     * @param objectMapper
     *            JSON mapper
     * @param apiKey
     *            Alpha Vantage API key, blank disables upstream access
     * @param primaryUrl
     *            query endpoint, e.g. {@code https://www.alphavantage.co/query}
     * @param secondaryUrl
     *            fallback query endpoint for transport failures, may be null
     * @param timeout
     *            timeout per attempt
     * @param clock
     *            source of fetch timestamps
     */
    public AlphaVantageClient(ObjectMapper objectMapper, String apiKey, URI primaryUrl, URI secondaryUrl,
            Duration timeout, Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.primaryUrl = Objects.requireNonNull(primaryUrl, "primaryUrl is required");
        this.secondaryUrl = secondaryUrl;
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public QuoteType fetch(String symbol) {
        if (apiKey.isEmpty()) {
            throw new QuoteFetchException(QuoteErrorCode.UPSTREAM_UNAVAILABLE, "Alpha Vantage API key is not configured");
        }

        LOG.debugf("Fetching overview for symbol: %s", symbol);

        HttpResponse<String> response = send(symbol);
        JsonNode root = readBody(symbol, response);
        QuoteType quote = parseOverview(symbol, root);

        LOG.debugf("Fetched overview for %s: price=%s, eps=%s, pe=%s", symbol, quote.price(), quote.earningsPerShare(),
                quote.peRatio());
        return quote;
    }

    private HttpResponse<String> send(String symbol) {
        try {
            return sendTo(primaryUrl, symbol);
        } catch (HttpTimeoutException e) {
            throw timeout(symbol, e);
        } catch (IOException e) {
            if (secondaryUrl == null) {
                throw unavailable(symbol, e);
            }
            LOG.warnf("Primary Alpha Vantage endpoint unreachable for %s (%s), trying secondary endpoint", symbol,
                    e.getMessage());
        }

        try {
            return sendTo(secondaryUrl, symbol);
        } catch (HttpTimeoutException e) {
            throw timeout(symbol, e);
        } catch (IOException e) {
            throw unavailable(symbol, e);
        }
    }

    private HttpResponse<String> sendTo(URI baseUrl, String symbol) throws IOException {
        String url = String.format("%s?function=OVERVIEW&symbol=%s&apikey=%s", baseUrl,
                URLEncoder.encode(symbol, StandardCharsets.UTF_8), URLEncoder.encode(apiKey, StandardCharsets.UTF_8));

        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout).GET().build();

        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QuoteFetchException(QuoteErrorCode.UPSTREAM_UNAVAILABLE,
                    "Interrupted while fetching quote for " + symbol, e);
        }
    }

    private JsonNode readBody(String symbol, HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 429) {
            LOG.warnf("Alpha Vantage throttled request for %s with HTTP 429", symbol);
            throw new RateLimitException("Alpha Vantage rate limit exceeded (HTTP 429)");
        }
        if (status < 200 || status >= 300) {
            throw new QuoteFetchException(QuoteErrorCode.UPSTREAM_UNAVAILABLE,
                    "Alpha Vantage API returned status " + status + " for " + symbol);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new QuoteFetchException(QuoteErrorCode.PARSE_ERROR,
                    "Unreadable response from Alpha Vantage for " + symbol, e);
        }

        if (root == null || !root.isObject()) {
            throw new QuoteFetchException(QuoteErrorCode.PARSE_ERROR,
                    "Unexpected response from Alpha Vantage for " + symbol + ": not a JSON object");
        }

        // Check for rate limit response
        for (String field : new String[]{"Note", "Information"}) {
            if (root.has(field)) {
                String message = root.get(field).asText();
                LOG.warnf("Alpha Vantage rate limit exceeded: %s", message);
                throw new RateLimitException("Alpha Vantage rate limit exceeded: " + message);
            }
        }

        if (root.has("Error Message")) {
            throw new QuoteFetchException(QuoteErrorCode.NOT_FOUND,
                    "Symbol " + symbol + " not found: " + root.get("Error Message").asText());
        }

        if (root.isEmpty()) {
            throw new QuoteFetchException(QuoteErrorCode.NOT_FOUND, "Symbol " + symbol + " not found");
        }

        return root;
    }

    /**
     * Maps an overview payload to a quote. Missing or non-numeric metrics become null.
     */
    QuoteType parseOverview(String symbol, JsonNode root) {
        String companyName = text(root, "Name");
        BigDecimal eps = decimal(root, "EPS");
        BigInteger marketCap = integer(root, "MarketCapitalization");
        BigInteger sharesOutstanding = integer(root, "SharesOutstanding");

        BigDecimal price = null;
        if (marketCap != null && sharesOutstanding != null && sharesOutstanding.signum() != 0) {
            price = new BigDecimal(marketCap).divide(new BigDecimal(sharesOutstanding), DECIMAL_SCALE,
                    RoundingMode.HALF_UP);
        }

        BigDecimal peRatio = decimal(root, "PERatio");
        if (peRatio == null) {
            peRatio = derivePeRatio(price, eps);
        }

        return QuoteType.of(symbol, companyName, price, eps, peRatio, marketCap == null ? null : marketCap.toString(),
                clock.instant());
    }

    /**
     * Derives price-to-earnings from price and EPS.
     *
     * @return price / eps at scale 4, or null when either is missing or EPS is zero
     */
    static BigDecimal derivePeRatio(BigDecimal price, BigDecimal eps) {
        if (price == null || eps == null || eps.signum() == 0) {
            return null;
        }
        return price.divide(eps, DECIMAL_SCALE, RoundingMode.HALF_UP);
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return MISSING_VALUES.contains(value) ? null : value;
    }

    private static BigDecimal decimal(JsonNode root, String field) {
        String value = text(root, field);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            LOG.debugf("Ignoring non-numeric %s value '%s'", field, value);
            return null;
        }
    }

    private static BigInteger integer(JsonNode root, String field) {
        BigDecimal value = decimal(root, field);
        if (value == null) {
            return null;
        }
        try {
            return value.toBigIntegerExact();
        } catch (ArithmeticException e) {
            LOG.debugf("Ignoring fractional %s value '%s'", field, value);
            return null;
        }
    }

    private static QuoteFetchException timeout(String symbol, HttpTimeoutException e) {
        LOG.warnf("Alpha Vantage request for %s timed out", symbol);
        return new QuoteFetchException(QuoteErrorCode.TIMEOUT, "Alpha Vantage request for " + symbol + " timed out",
                e);
    }

    private static QuoteFetchException unavailable(String symbol, IOException e) {
        LOG.errorf(e, "Failed to reach Alpha Vantage for symbol: %s", symbol);
        return new QuoteFetchException(QuoteErrorCode.UPSTREAM_UNAVAILABLE,
                "Alpha Vantage unreachable while fetching " + symbol, e);
    }
}
