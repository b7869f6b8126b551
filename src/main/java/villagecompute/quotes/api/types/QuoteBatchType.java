/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.api.types;

import java.util.List;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Batch quote response. Entries appear in request order, one per requested symbol including duplicates.
 *
 * @param symbols
 *            quotes in request order
 */
@Schema(
        description = "Quotes for a batch of symbols in request order")
public record QuoteBatchType(List<QuoteType> symbols) {
}
