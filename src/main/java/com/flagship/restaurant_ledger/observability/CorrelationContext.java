package com.flagship.restaurant_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Request correlation and the entity ids attached to log lines.
 *
 * The correlation id lives in the MDC for the duration of a request. It is
 * copied onto outbox rows so relayed back-office events can be traced back to
 * the request that caused them.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String MOVEMENT_ID_MDC_KEY = "movementId";
    public static final String INVOICE_ID_MDC_KEY = "invoiceId";
    public static final String ORDER_ID_MDC_KEY = "orderId";

    private static final int MAX_INCOMING_LENGTH = 64;

    private CorrelationContext() {
    }

    /**
     * Starts a request: keeps a usable incoming id, otherwise mints one.
     *
     * @return the id now in effect
     */
    public static String begin(String incoming) {
        String id = incoming == null || incoming.isBlank() || incoming.length() > MAX_INCOMING_LENGTH
                ? newId()
                : incoming.trim();
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Id of the current request, or null outside one (scheduled jobs).
     */
    public static String current() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    /**
     * Tags log lines with an entity id until the returned handle is closed.
     */
    public static MDC.MDCCloseable tag(String key, Object id) {
        return MDC.putCloseable(key, String.valueOf(id));
    }

    public static void end() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(MOVEMENT_ID_MDC_KEY);
        MDC.remove(INVOICE_ID_MDC_KEY);
        MDC.remove(ORDER_ID_MDC_KEY);
    }

    static String newId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
