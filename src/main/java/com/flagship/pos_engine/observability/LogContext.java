package com.flagship.pos_engine.observability;

import org.slf4j.MDC;

/**
 * MDC keys used by the sale and stock services.
 *
 * Services {@link #put} these at the start of an operation and {@link #restore}
 * them in a finally block, so a caller's context survives nested operations.
 * The log pattern in logback-spring.xml prints them on every line.
 */
public final class LogContext {

    public static final String MERCHANT_ID_MDC_KEY = "merchantId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String STOCK_ITEM_ID_MDC_KEY = "stockItemId";

    /**
     * Puts a value and returns the one it replaced, or null.
     */
    public static String put(String key, Object value) {
        String previous = MDC.get(key);
        MDC.put(key, String.valueOf(value));
        return previous;
    }

    /**
     * Puts back a value returned by {@link #put}, removing the key if there was none.
     */
    public static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }

    private LogContext() {
        // Utility class
    }
}
