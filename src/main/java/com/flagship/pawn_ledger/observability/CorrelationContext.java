package com.flagship.pawn_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Request headers and MDC keys the ledger logs with.
 *
 * The correlation id and actor are bound per request by {@link CorrelationIdFilter}.
 * Services bind the company, voucher, pledge or payment they work on for the
 * duration of the operation and unbind it in {@code finally}.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String ACTOR_HEADER = "X-Actor-Id";

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACTOR_MDC_KEY = "actor";
    public static final String COMPANY_ID_MDC_KEY = "companyId";
    public static final String VOUCHER_ID_MDC_KEY = "voucherId";
    public static final String PLEDGE_ID_MDC_KEY = "pledgeId";
    public static final String PAYMENT_ID_MDC_KEY = "paymentId";

    private static final String[] LEDGER_KEYS = {
        COMPANY_ID_MDC_KEY, VOUCHER_ID_MDC_KEY, PLEDGE_ID_MDC_KEY, PAYMENT_ID_MDC_KEY
    };

    private CorrelationContext() {
    }

    /**
     * Correlation id of the current thread, or null outside a request.
     */
    public static String currentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    /**
     * Eight hex characters; enough to tell requests apart in one day's logs.
     */
    public static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    static void bindRequest(String correlationId, String actor) {
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
        if (actor != null && !actor.isBlank()) {
            MDC.put(ACTOR_MDC_KEY, actor);
        }
    }

    static void unbindRequest() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(ACTOR_MDC_KEY);
        for (String key : LEDGER_KEYS) {
            MDC.remove(key);
        }
    }
}
