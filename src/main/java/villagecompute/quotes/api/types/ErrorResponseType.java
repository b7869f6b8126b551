/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.quotes.exceptions.QuoteErrorCode;

/**
 * Error body for non-2xx responses.
 *
 * @param error
 *            human-readable message
 * @param errorCode
 *            failure classification, null for request errors outside the quote taxonomy
 */
@Schema(
        description = "Error response")
public record ErrorResponseType(String error, @JsonProperty("error_code") QuoteErrorCode errorCode) {
}
