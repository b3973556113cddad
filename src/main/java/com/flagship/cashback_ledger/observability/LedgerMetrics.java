package com.flagship.cashback_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for wallet and settlement operations.
 *
 * Metrics exposed:
 * - ledger.wallet.mutations: Counter tagged by transaction type and outcome
 * - ledger.idempotency.replays: Counter of requests answered from an existing journal row
 * - ledger.wallet.cas.conflicts: Counter of lost compare-and-swap attempts
 * - ledger.wallet.mutation.duration: Timer around a whole wallet mutation
 * - ledger.order.transitions: Counter tagged by from/to status and outcome
 * - ledger.pending.recovered: Counter of crashed rows resolved by recovery
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter idempotencyReplays;
    private final Counter casConflicts;
    private final Timer mutationTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.idempotencyReplays = Counter.builder("ledger.idempotency.replays")
                .description("Requests answered from an existing journal row")
                .register(registry);

        this.casConflicts = Counter.builder("ledger.wallet.cas.conflicts")
                .description("Wallet writes that lost a version race and were retried")
                .register(registry);

        this.mutationTimer = Timer.builder("ledger.wallet.mutation.duration")
                .description("Time taken by a wallet mutation including retries")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordMutation(String type, String outcome) {
        registry.counter("ledger.wallet.mutations",
                "type", sanitizeTag(type),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordReplay() {
        idempotencyReplays.increment();
    }

    public void recordCasConflict() {
        casConflicts.increment();
    }

    public <T> T timeMutation(Supplier<T> operation) {
        return mutationTimer.record(operation);
    }

    public void recordTransition(String from, String to, String outcome) {
        registry.counter("ledger.order.transitions",
                "from", sanitizeTag(from),
                "to", sanitizeTag(to),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordPendingRecovered(String resolution) {
        registry.counter("ledger.pending.recovered", "resolution", sanitizeTag(resolution)).increment();
    }

    /**
     * Sanitizes a tag value to keep cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
