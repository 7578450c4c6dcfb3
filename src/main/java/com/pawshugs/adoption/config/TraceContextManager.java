package com.pawshugs.adoption.config;

import org.slf4j.MDC;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.UUID;

/**
 * Trace context helper used by the HTTP filter.
 * Handles generation, MDC population, header propagation and cleanup.
 */
public final class TraceContextManager {

    public static final String TRACE_ID = "traceId";
    public static final String SPAN_ID = "spanId";
    public static final String TRACE_HEADER = "X-Trace-Id";

    private TraceContextManager() {}

    public static String ensureForHttp(HttpServletRequest request, HttpServletResponse response) {
        String traceId = request.getHeader(TRACE_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = MDC.get(TRACE_ID);
        }
        if (traceId == null || traceId.isBlank()) {
            traceId = generateTraceId();
        }
        String spanId = MDC.get(SPAN_ID);
        if (spanId == null || spanId.isBlank()) {
            spanId = generateSpanId();
        }

        MDC.put(TRACE_ID, traceId);
        MDC.put(SPAN_ID, spanId);

        if (response != null) {
            response.setHeader(TRACE_HEADER, traceId);
        }

        return traceId;
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static String generateSpanId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    public static void clear() {
        MDC.remove(TRACE_ID);
        MDC.remove(SPAN_ID);
    }
}
