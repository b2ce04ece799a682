package com.flagship.token_ledger.observability;

import com.flagship.token_ledger.ledger.TokenLedger;
import com.flagship.token_ledger.outbox.OutboxService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Custom health indicators for the token ledger.
 */
public class HealthIndicators {

    /**
     * Down if the balances no longer add up to the total supply.
     */
    @Component("supplyInvariantHealth")
    public static class SupplyInvariantHealthIndicator implements HealthIndicator {

        private final TokenLedger tokenLedger;

        public SupplyInvariantHealthIndicator(TokenLedger tokenLedger) {
            this.tokenLedger = tokenLedger;
        }

        @Override
        public Health health() {
            BigInteger totalSupply = tokenLedger.totalSupply();
            BigInteger sumOfBalances = tokenLedger.balances().values().stream()
                    .reduce(BigInteger.ZERO, BigInteger::add);

            Health.Builder builder = totalSupply.equals(sumOfBalances) ? Health.up() : Health.down();
            return builder
                    .withDetail("totalSupply", totalSupply.toString())
                    .withDetail("sumOfBalances", sumOfBalances.toString())
                    .build();
        }
    }

    /**
     * Health indicator for the outbox backlog.
     * Unhealthy if too many notifications are waiting to be published.
     * Only registered when the publisher runs; without it nothing is ever marked published.
     */
    @Component("outboxHealth")
    @ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private final OutboxService outboxService;
        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        public OutboxHealthIndicator(OutboxService outboxService) {
            this.outboxService = outboxService;
        }

        @Override
        public Health health() {
            long backlogSize = outboxService.countUnpublished();

            Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();

            return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("journalSize", outboxService.size())
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
        }
    }
}
