package com.flagship.cashback_ledger.replication;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background worker that delivers replication tasks the async path did not finish:
 * tasks whose executor slot was rejected, whose worker died mid-lease, or
 * whose delivery failed and is due for another attempt.
 */
@Component
@ConditionalOnProperty(name = "replication.poller.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ReplicationTaskPoller {

    private final ReplicationOutbox outbox;
    private final ReplicationHandle handle;
    private final int batchSize;
    private final Duration deliveredRetention;

    public ReplicationTaskPoller(ReplicationOutbox outbox,
                                 ReplicationHandle handle,
                                 @Value("${replication.poller.batch-size:100}") int batchSize,
                                 @Value("${replication.poller.delivered-retention:P1D}") Duration deliveredRetention) {
        this.outbox = outbox;
        this.handle = handle;
        this.batchSize = batchSize;
        this.deliveredRetention = deliveredRetention;
    }

    @Scheduled(fixedDelayString = "${replication.poller.poll-interval-ms:2000}")
    public void deliverPendingTasks() {
        if (!handle.isEnabled()) {
            return;
        }
        try {
            List<ReplicationTask> tasks = outbox.claimBatch(batchSize, handle.lease());
            if (tasks.isEmpty()) {
                return;
            }

            log.debug("Claimed {} replication tasks", tasks.size());
            int delivered = 0;
            for (ReplicationTask task : tasks) {
                if (handle.deliver(task)) {
                    delivered++;
                }
            }
            log.debug("Delivered {} of {} replication tasks", delivered, tasks.size());

        } catch (Exception e) {
            log.error("Error in replication poller loop", e);
        }
    }

    @Scheduled(fixedDelayString = "${replication.poller.purge-interval-ms:3600000}")
    public void purgeDeliveredTasks() {
        try {
            long purged = outbox.purgeDeliveredBefore(Instant.now().minus(deliveredRetention));
            if (purged > 0) {
                log.info("Purged {} delivered replication tasks", purged);
            }
        } catch (Exception e) {
            log.warn("Failed to purge delivered replication tasks: {}", e.getMessage());
        }
    }
}
