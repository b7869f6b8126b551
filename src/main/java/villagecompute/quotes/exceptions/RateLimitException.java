/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.exceptions;

/**
 * Exception thrown when the upstream provider throttles a request.
 *
 * <p>
 * Alpha Vantage signals throttling with an HTTP 200 body holding a "Note" or "Information" field, or occasionally with
 * HTTP 429. The local token bucket running dry is not an exception; it yields a {@link QuoteErrorCode#RATE_LIMITED}
 * quote instead.
 */
public class RateLimitException extends QuoteFetchException {

    public RateLimitException(String message) {
        super(QuoteErrorCode.UPSTREAM_THROTTLED, message);
    }

    public RateLimitException(String message, Throwable cause) {
        super(QuoteErrorCode.UPSTREAM_THROTTLED, message, cause);
    }
}
