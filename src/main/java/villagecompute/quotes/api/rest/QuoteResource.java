/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.api.rest;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.quotes.api.types.ErrorResponseType;
import villagecompute.quotes.api.types.PeRatioType;
import villagecompute.quotes.api.types.QuoteBatchType;
import villagecompute.quotes.api.types.QuoteType;
import villagecompute.quotes.api.types.StockInfoType;
import villagecompute.quotes.exceptions.InvalidBatchSizeException;
import villagecompute.quotes.observability.LoggingConfig;
import villagecompute.quotes.services.StockQuoteService;

/**
 * REST endpoints for stock quotes.
 *
 * <p>
 * Single-symbol endpoints translate error quotes into HTTP statuses (404 not found or invalid, 429 throttled, 503
 * upstream unavailable or timed out, 502 unreadable provider payload). A stale fallback is served as 200 with
 * {@code data_source=cache-stale}. The batch endpoint always answers 200 with per-entry errors, except for a missing or
 * out-of-range {@code symbols} parameter.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Quotes",
        description = "Stock quote and PE ratio operations")
public class QuoteResource {

    private static final Logger LOG = Logger.getLogger(QuoteResource.class);

    @Inject
    StockQuoteService stockQuoteService;

    /**
     * Get the PE ratio for one symbol.
     *
     * @param symbol
     *            ticker symbol, case-insensitive
     * @return PeRatioType or ErrorResponseType
     */
    @GET
    @Path("pe-ratio/{symbol}")
    @Operation(
            summary = "Get PE ratio",
            description = "Price, EPS and PE ratio for a single symbol, served from cache when fresh")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "PE ratio returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = PeRatioType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Unknown or invalid symbol"),
                    @APIResponse(
                            responseCode = "429",
                            description = "Upstream call budget exhausted"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Upstream provider unavailable")})
    public Response getPeRatio(@Parameter(
            description = "Ticker symbol",
            example = "AAPL") @PathParam("symbol") String symbol) {
        return single("/pe-ratio/{symbol}", symbol, PeRatioType::from);
    }

    /**
     * Get full company metrics for one symbol.
     *
     * @param symbol
     *            ticker symbol, case-insensitive
     * @return StockInfoType or ErrorResponseType
     */
    @GET
    @Path("stock-info/{symbol}")
    @Operation(
            summary = "Get stock info",
            description = "Company name, price, EPS, PE ratio and market cap for a single symbol")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Stock info returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = StockInfoType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Unknown or invalid symbol"),
                    @APIResponse(
                            responseCode = "429",
                            description = "Upstream call budget exhausted"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Upstream provider unavailable")})
    public Response getStockInfo(@Parameter(
            description = "Ticker symbol",
            example = "AAPL") @PathParam("symbol") String symbol) {
        return single("/stock-info/{symbol}", symbol, StockInfoType::from);
    }

    /**
     * Get quotes for up to ten symbols.
     *
     * @param symbols
     *            comma-separated ticker symbols
     * @return QuoteBatchType in request order, or 400 for a malformed request
     */
    @GET
    @Path("pe-ratios/batch")
    @Operation(
            summary = "Get PE ratios in batch",
            description = "Quotes for 1-10 comma-separated symbols in request order with per-entry errors")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Quotes returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = QuoteBatchType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Missing symbols parameter or more than 10 symbols",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponseType.class)))})
    public Response getBatch(@Parameter(
            description = "Comma-separated ticker symbols",
            example = "AAPL,MSFT,GOOGL") @QueryParam("symbols") String symbols) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin("/pe-ratios/batch");

        try {
            if (symbols == null) {
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(new ErrorResponseType("Symbols parameter is required", null)).build();
            }

            List<String> requested = symbols.isBlank() ? List.of() : Arrays.asList(symbols.split(",", -1));
            LoggingConfig.setBatchSize(requested.size());

            List<QuoteType> quotes = stockQuoteService.getQuotes(requested);
            return Response.ok(new QuoteBatchType(quotes)).build();

        } catch (InvalidBatchSizeException e) {
            LOG.debugf("Rejected batch request: %s", e.getMessage());
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(new ErrorResponseType(e.getMessage(), e.getErrorCode())).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Get the default dashboard watchlist.
     *
     * @return {@code {"stocks": [...]}}
     */
    @GET
    @Path("api/stocks")
    @Operation(
            summary = "Default watchlist",
            description = "Symbols the dashboard loads before the user searches")
    public DefaultSymbolsResponse getDefaultSymbols() {
        return new DefaultSymbolsResponse(stockQuoteService.getDefaultSymbols());
    }

    private Response single(String origin, String symbol, Function<QuoteType, ?> view) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin(origin);
        LoggingConfig.setSymbol(symbol);

        try {
            QuoteType quote = stockQuoteService.getQuote(symbol);

            if (quote.failed()) {
                LOG.debugf("Quote request for %s failed with %s", symbol, quote.errorCode());
                return Response.status(quote.errorCode().httpStatus())
                        .entity(new ErrorResponseType(quote.error(), quote.errorCode())).build();
            }

            return Response.ok(view.apply(quote)).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    public record DefaultSymbolsResponse(List<String> stocks) {
    }
}
