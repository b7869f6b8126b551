/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.quotes.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching quote layer logs with request context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - current span identifier within the trace</li>
 * <li>{@code symbol} - ticker symbol of a single-symbol request, as supplied</li>
 * <li>{@code batch_size} - number of symbols in a batch request</li>
 * <li>{@code request_origin} - HTTP path template that produced the log entry</li>
 * </ul>
 *
 * <p>
 * <b>Usage in REST resources:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setRequestOrigin("/pe-ratio/{symbol}");
 * LoggingConfig.setSymbol(symbol);
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> MDC is thread-local. Batch workers run on other threads and do not inherit these fields.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_SYMBOL = "symbol";

    public static final String MDC_BATCH_SIZE = "batch_size";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Without an active span the fields are
     * set to empty strings to keep the log structure consistent.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setSymbol(String symbol) {
        if (symbol != null) {
            MDC.put(MDC_SYMBOL, symbol);
        }
    }

    public static void setBatchSize(int batchSize) {
        MDC.put(MDC_BATCH_SIZE, Integer.toString(batchSize));
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears all fields set by this class. Call at the end of every request.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_SYMBOL);
        MDC.remove(MDC_BATCH_SIZE);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
