/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.services;

import java.time.Instant;

import villagecompute.quotes.api.types.QuoteType;

/**
 * Immutable cache entry wrapping the last successful {@link QuoteType} for a symbol.
 *
 * <p>
 * An expired entry is stale, not gone: it stays in the cache as a last-known-good fallback until a refresh succeeds.
 */
public record QuoteCacheEntry(QuoteType quote, Instant fetchedAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
