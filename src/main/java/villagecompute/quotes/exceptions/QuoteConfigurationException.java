/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.exceptions;

/**
 * Exception thrown at startup when quote layer configuration is invalid. Prevents the application from starting.
 */
public class QuoteConfigurationException extends RuntimeException {

    public QuoteConfigurationException(String message) {
        super(message);
    }
}
