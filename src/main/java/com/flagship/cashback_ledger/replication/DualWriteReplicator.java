package com.flagship.cashback_ledger.replication;

import com.flagship.cashback_ledger.observability.ReplicationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Entry point of primary-to-shadow replication.
 *
 * {@link #initialize} turns a list of registrations into a {@link ReplicationHandle}.
 * Application wiring calls it exactly once and exposes the handle as the
 * {@link PrimaryWriteHooks} the stores report their writes to.
 */
@Component
@Slf4j
public class DualWriteReplicator {

    private final ReplicationOutbox outbox;
    private final PrimaryDocumentSource primary;
    private final ReplicationMetrics metrics;
    private final Executor executor;

    public DualWriteReplicator(ReplicationOutbox outbox,
                               PrimaryDocumentSource primary,
                               ReplicationMetrics metrics,
                               @Qualifier("replicationExecutor") Executor executor) {
        this.outbox = outbox;
        this.primary = primary;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Registers the shadow writers and returns the handle that owns them.
     *
     * @throws IllegalArgumentException if an entity type is registered twice
     */
    public ReplicationHandle initialize(List<ReplicationRegistration<?>> registrations, ReplicationSettings settings) {
        ReplicationHandle handle = new ReplicationHandle(registrations, outbox, primary, metrics, executor, settings);
        log.info("Replication {} for {}",
                settings.isEnabled() ? "initialized" : "registered but disabled",
                registrations.stream().map(r -> r.getEntity().getLabel()).collect(Collectors.joining(", ")));
        return handle;
    }
}
