package com.flagship.token_ledger.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;

/**
 * Correlation ID of the request a thread is serving.
 *
 * The ID is bound when an HTTP request enters, copied into MDC for log lines, stamped on
 * every notification the request produces and forwarded as a Kafka header when the
 * notification is published. One ledger operation can be followed from the API call to
 * the consumer.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CALLER_ADDRESS_MDC_KEY = "callerAddress";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Binds {@code incoming} (or a generated ID if it is blank) to the current thread and MDC.
     *
     * @return the bound ID
     */
    public static String bind(String incoming) {
        String id = incoming == null || incoming.isBlank() ? generate() : incoming;
        correlationId.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    public static Optional<String> current() {
        return Optional.ofNullable(correlationId.get());
    }

    /**
     * The bound ID, or a fresh one for work that did not start from a request
     * (startup, tests, scheduled jobs). A fresh ID is not bound.
     */
    public static String currentOrGenerate() {
        return current().orElseGet(CorrelationContext::generate);
    }

    /**
     * Removes the ID and the request-scoped MDC keys from the current thread.
     */
    public static void unbind() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(CALLER_ADDRESS_MDC_KEY);
    }

    // Short form keeps log lines readable
    static String generate() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
