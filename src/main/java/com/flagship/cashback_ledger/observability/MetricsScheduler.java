package com.flagship.cashback_ledger.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes gauge metrics that need a database query.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final ReplicationMetrics replicationMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshReplicationMetrics() {
        replicationMetrics.refreshMetrics();
    }
}
