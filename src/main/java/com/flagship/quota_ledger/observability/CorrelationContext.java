package com.flagship.quota_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys and helpers for request correlation.
 *
 * The correlation id comes from the caller's {@code X-Correlation-ID} header
 * or is generated, and is attached to every log line of the request.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String USER_KEY_MDC_KEY = "userKey";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";

    private CorrelationContext() {
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(USER_KEY_MDC_KEY);
        MDC.remove(TRANSACTION_ID_MDC_KEY);
    }
}
