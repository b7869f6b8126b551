/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.exceptions;

/**
 * Exception thrown when request input fails validation before any cache or network work starts.
 *
 * <p>
 * Extends RuntimeException per project standards. Subclasses name the {@link QuoteErrorCode} they represent.
 */
public abstract class ValidationException extends RuntimeException {

    protected ValidationException(String message) {
        super(message);
    }

    public abstract QuoteErrorCode getErrorCode();
}
