/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.exceptions;

import java.util.Objects;

/**
 * Exception thrown when a single upstream quote fetch fails.
 *
 * <p>
 * Carries the {@link QuoteErrorCode} the failure maps to. {@code QuoteCache} catches it and converts it into an
 * error-bearing quote, so it never reaches the HTTP layer.
 */
public class QuoteFetchException extends RuntimeException {

    private final QuoteErrorCode errorCode;

    public QuoteFetchException(QuoteErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode is required");
    }

    public QuoteFetchException(QuoteErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode is required");
    }

    public QuoteErrorCode getErrorCode() {
        return errorCode;
    }
}
