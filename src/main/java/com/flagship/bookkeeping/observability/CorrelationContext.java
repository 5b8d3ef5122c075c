package com.flagship.bookkeeping.observability;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used by the engines.
 *
 * The id comes from the {@code X-Correlation-ID} request header (or is generated)
 * and is copied into every log line and every audit event of the request.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String POSTING_DATE_MDC_KEY = "postingDate";
    public static final String BATCH_REF_MDC_KEY = "batchRef";
    public static final String PERIOD_YEAR_MDC_KEY = "periodYear";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Current correlation id, generating one for threads that did not come
     * through the HTTP filter (schedulers, tests).
     */
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

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
