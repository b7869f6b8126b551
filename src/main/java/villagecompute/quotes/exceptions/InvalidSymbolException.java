/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.exceptions;

/**
 * Exception thrown when a ticker symbol is empty, too long, or contains non-alphanumeric characters.
 */
public class InvalidSymbolException extends ValidationException {

    private final String rawSymbol;

    public InvalidSymbolException(String rawSymbol, String message) {
        super(message);
        this.rawSymbol = rawSymbol;
    }

    /**
     * @return the symbol exactly as supplied, possibly null
     */
    public String getRawSymbol() {
        return rawSymbol;
    }

    @Override
    public QuoteErrorCode getErrorCode() {
        return QuoteErrorCode.INVALID_SYMBOL;
    }
}
