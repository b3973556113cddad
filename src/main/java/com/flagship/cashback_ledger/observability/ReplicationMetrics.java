package com.flagship.cashback_ledger.observability;

import com.flagship.cashback_ledger.replication.ReplicationOutbox;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for primary-to-shadow replication.
 *
 * Gauges read cached values refreshed by {@link MetricsScheduler}, so a
 * Prometheus scrape never queries the outbox collection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReplicationMetrics {

    private final ReplicationOutbox outbox;
    private final MeterRegistry meterRegistry;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestTaskAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadTaskCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("replication.backlog.size", backlogSize, AtomicLong::get)
                .description("Replication tasks waiting for delivery")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("replication.backlog.age.seconds", oldestTaskAgeSeconds, AtomicLong::get)
                .description("Age of the oldest undelivered replication task in seconds")
                .register(meterRegistry);

        Gauge.builder("replication.tasks.dead", deadTaskCount, AtomicLong::get)
                .description("Replication tasks that exhausted their retries")
                .tag("status", "dead")
                .register(meterRegistry);

        log.info("Replication metrics registered with Micrometer");
    }

    public void refreshMetrics() {
        try {
            long pending = outbox.countPending();
            backlogSize.set(pending);

            outbox.findOldestPendingCreatedAt()
                    .ifPresentOrElse(
                            oldest -> oldestTaskAgeSeconds.set(Math.max(0, Duration.between(oldest, Instant.now()).getSeconds())),
                            () -> oldestTaskAgeSeconds.set(0)
                    );

            long dead = outbox.countDead();
            deadTaskCount.set(dead);

            log.debug("Replication metrics refreshed: backlog={}, oldestAge={}s, dead={}",
                    pending, oldestTaskAgeSeconds.get(), dead);

        } catch (Exception e) {
            log.warn("Failed to refresh replication metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public void recordDelivered(String entity, String operation) {
        meterRegistry.counter("replication.tasks.delivered",
                "entity", entity,
                "operation", operation,
                "status", "success"
        ).increment();
    }

    public void recordDeliveryFailed(String entity, String operation) {
        meterRegistry.counter("replication.tasks.delivered",
                "entity", entity,
                "operation", operation,
                "status", "failure"
        ).increment();
    }

    public void recordDeadLettered(String entity) {
        meterRegistry.counter("replication.tasks.dead_lettered", "entity", entity).increment();
    }

    public void recordEnqueueFailed(String entity) {
        meterRegistry.counter("replication.tasks.enqueue_failed", "entity", entity).increment();
    }

    public void recordResync(String entity, int processed, int failed) {
        meterRegistry.counter("replication.resync.documents", "entity", entity, "status", "success").increment(processed);
        meterRegistry.counter("replication.resync.documents", "entity", entity, "status", "failure").increment(failed);
    }

    public void recordReconciled(String entity, long repaired, long removed, long failed) {
        meterRegistry.counter("replication.reconciliation.documents", "entity", entity, "status", "repaired").increment(repaired);
        meterRegistry.counter("replication.reconciliation.documents", "entity", entity, "status", "removed").increment(removed);
        meterRegistry.counter("replication.reconciliation.documents", "entity", entity, "status", "failure").increment(failed);
    }
}
