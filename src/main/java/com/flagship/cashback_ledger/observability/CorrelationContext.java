package com.flagship.cashback_ledger.observability;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Thread-local correlation id plus scoped MDC entries for log statements.
 *
 * The correlation id flows through:
 * - HTTP requests (from header or generated)
 * - Money operations and order transitions (owner and order ids in MDC)
 * - Scheduled jobs (a fresh id per run)
 * - Replication tasks dispatched to the async executor
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ORDER_ID_MDC_KEY = "orderId";
    public static final String OWNER_ID_MDC_KEY = "ownerId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
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

    /**
     * Generates a new correlation ID, short enough to read in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    /**
     * Puts the correlation id and the owner id into the MDC until the scope is closed.
     */
    public static Scope forOwner(String ownerId) {
        return open().put(OWNER_ID_MDC_KEY, ownerId);
    }

    /**
     * Puts the correlation id and the order id into the MDC until the scope is closed.
     */
    public static Scope forOrder(String orderId) {
        return open().put(ORDER_ID_MDC_KEY, orderId);
    }

    /**
     * Starts a scope carrying only the correlation id, generating one if the thread has none.
     */
    public static Scope open() {
        Scope scope = new Scope(!hasCorrelationId());
        return scope.put(CORRELATION_ID_MDC_KEY, getCorrelationId());
    }

    /**
     * MDC entries added by one scope. Closing restores whatever the keys held before.
     */
    public static final class Scope implements AutoCloseable {

        private final boolean ownsCorrelationId;
        private final List<String> keys = new ArrayList<>();
        private final List<String> previous = new ArrayList<>();

        private Scope(boolean ownsCorrelationId) {
            this.ownsCorrelationId = ownsCorrelationId;
        }

        public Scope put(String key, String value) {
            if (value == null) {
                return this;
            }
            keys.add(key);
            previous.add(MDC.get(key));
            MDC.put(key, value);
            return this;
        }

        @Override
        public void close() {
            for (int i = keys.size() - 1; i >= 0; i--) {
                String prior = previous.get(i);
                if (prior == null) {
                    MDC.remove(keys.get(i));
                } else {
                    MDC.put(keys.get(i), prior);
                }
            }
            if (ownsCorrelationId) {
                CorrelationContext.clear();
            }
        }
    }
}
