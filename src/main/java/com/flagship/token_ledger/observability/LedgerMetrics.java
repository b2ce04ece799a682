package com.flagship.token_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Metrics for ledger operations.
 *
 * Metrics exposed:
 * - token.operations: Counter tagged with operation and outcome
 *   (success, declined, rejected, error)
 * - token.operation.duration: Timer tagged with operation
 * - token.total.supply: Gauge of the total supply in whole units
 */
@Component
public class LedgerMetrics {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_DECLINED = "declined";
    public static final String OUTCOME_REJECTED = "rejected";
    public static final String OUTCOME_ERROR = "error";

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the outcome of an operation.
     * A declined transfer returned false; a rejected operation threw a ledger error.
     */
    public void recordOperation(String operation, String outcome) {
        registry.counter("token.operations",
                "operation", operation,
                "outcome", outcome
        ).increment();
    }

    public void recordRejection(String operation, String errorCode) {
        registry.counter("token.operations.rejected",
                "operation", operation,
                "error_code", errorCode
        ).increment();
    }

    public void recordLatency(String operation, Duration duration) {
        registry.timer("token.operation.duration",
                "operation", operation
        ).record(duration);
    }

    /**
     * Registers a gauge that reads the total supply on every scrape.
     */
    public void registerTotalSupplyGauge(Supplier<Number> supplier) {
        Gauge.builder("token.total.supply", supplier, s -> s.get().doubleValue())
                .description("Total token supply in whole units")
                .strongReference(true)
                .register(registry);
    }
}
