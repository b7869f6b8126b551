/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.exceptions;

/**
 * Error taxonomy for quote retrieval.
 *
 * <p>
 * Each code carries the HTTP status the single-symbol endpoints answer with when no stale data can be served. The batch
 * endpoint embeds the code per entry instead and answers 200.
 */
public enum QuoteErrorCode {

    INVALID_SYMBOL(404), INVALID_BATCH_SIZE(400), NOT_FOUND(404), RATE_LIMITED(429), UPSTREAM_THROTTLED(
            429), UPSTREAM_UNAVAILABLE(503), TIMEOUT(503), PARSE_ERROR(502);

    private final int httpStatus;

    QuoteErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
