/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.exceptions;

/**
 * Exception thrown when a batch request holds fewer than one or more than the maximum number of symbols. Mapped to
 * HTTP 400 Bad Request.
 */
public class InvalidBatchSizeException extends ValidationException {

    private final int size;

    public InvalidBatchSizeException(int size, int maxSize) {
        super("Batch must contain between 1 and " + maxSize + " symbols, got " + size);
        this.size = size;
    }

    public int getSize() {
        return size;
    }

    @Override
    public QuoteErrorCode getErrorCode() {
        return QuoteErrorCode.INVALID_BATCH_SIZE;
    }
}
