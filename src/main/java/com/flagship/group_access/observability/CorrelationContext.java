package com.flagship.group_access.observability;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys the service logs with.
 *
 * HTTP requests take the id from {@code X-Correlation-ID} or get a fresh one. Background jobs
 * (reconciliation, sweep, finalization worker) open their own scope per run, so every log line
 * of a run shares one id.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String USER_ID_MDC_KEY = "userId";
    public static final String PAYMENT_ID_MDC_KEY = "paymentId";
    public static final String JOB_MDC_KEY = "job";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form, readable in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
