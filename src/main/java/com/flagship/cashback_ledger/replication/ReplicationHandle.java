package com.flagship.cashback_ledger.replication;

import com.flagship.cashback_ledger.observability.CorrelationContext;
import com.flagship.cashback_ledger.observability.ReplicationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * The registered replication hooks, obtained once from {@link DualWriteReplicator#initialize}.
 *
 * Every primary write of a registered entity becomes a replication task.
 * The task is handed to the async executor right away and also stays in the
 * outbox, so the scheduled poller delivers it if the executor is saturated or
 * the process dies. Shadow-write errors are logged, counted and recorded on
 * the task; they never reach the code that performed the primary write.
 */
@Slf4j
public class ReplicationHandle implements PrimaryWriteHooks {

    public static final int DEFAULT_RESYNC_LIMIT = 5000;

    private final Map<ReplicatedEntity, ReplicationRegistration<?>> registrations;
    private final ReplicationOutbox outbox;
    private final PrimaryDocumentSource primary;
    private final ReplicationMetrics metrics;
    private final Executor executor;
    private final ReplicationSettings settings;

    ReplicationHandle(List<ReplicationRegistration<?>> registrations,
                      ReplicationOutbox outbox,
                      PrimaryDocumentSource primary,
                      ReplicationMetrics metrics,
                      Executor executor,
                      ReplicationSettings settings) {
        Map<ReplicatedEntity, ReplicationRegistration<?>> byEntity = new EnumMap<>(ReplicatedEntity.class);
        for (ReplicationRegistration<?> registration : registrations) {
            if (byEntity.putIfAbsent(registration.getEntity(), registration) != null) {
                throw new IllegalArgumentException("Entity registered twice: " + registration.getEntity());
            }
        }
        this.registrations = Collections.unmodifiableMap(byEntity);
        this.outbox = outbox;
        this.primary = primary;
        this.metrics = metrics;
        this.executor = executor;
        this.settings = settings;
    }

    // ==================== Hooks ====================

    @Override
    public void afterUpsert(ReplicatedEntity entity, String foreignId) {
        enqueue(entity, foreignId, ReplicationOperation.UPSERT);
    }

    @Override
    public void afterDelete(ReplicatedEntity entity, String foreignId) {
        enqueue(entity, foreignId, ReplicationOperation.DELETE);
    }

    private void enqueue(ReplicatedEntity entity, String foreignId, ReplicationOperation operation) {
        if (!settings.isEnabled() || foreignId == null || !registrations.containsKey(entity)) {
            return;
        }
        try {
            ReplicationTask task = outbox.enqueue(entity, foreignId, operation);
            executor.execute(() -> dispatch(task.getId()));
        } catch (Exception e) {
            // The poller or reconciliation picks this write up later
            metrics.recordEnqueueFailed(entity.getLabel());
            log.warn("Could not schedule replication of {} {} ({}): {}",
                    entity.getLabel(), foreignId, operation, e.getMessage());
        }
    }

    private void dispatch(String taskId) {
        try {
            outbox.claim(taskId, settings.getLease()).ifPresent(this::deliver);
        } catch (Exception e) {
            log.warn("Async dispatch of replication task {} failed, leaving it to the poller: {}", taskId, e.getMessage());
        }
    }

    // ==================== Delivery ====================

    /**
     * Delivers one claimed task: re-reads the primary document and writes it to
     * the shadow store, or removes the shadow row if the document is gone.
     *
     * @return true if the shadow store now matches the primary
     */
    public boolean deliver(ReplicationTask task) {
        ReplicationRegistration<?> registration = registrations.get(task.getEntity());
        if (registration == null) {
            log.warn("No replication registration for {}, dropping task {}", task.getEntity(), task.getId());
            outbox.markDelivered(task.getId());
            return false;
        }

        try (CorrelationContext.Scope ignored = CorrelationContext.open()) {
            if (task.getOperation() == ReplicationOperation.DELETE) {
                registration.getWriter().delete(task.getForeignId());
            } else {
                copyFromPrimary(registration, task.getForeignId());
            }
            outbox.markDelivered(task.getId());
            metrics.recordDelivered(task.getEntity().getLabel(), task.getOperation().name());
            return true;
        } catch (Exception e) {
            metrics.recordDeliveryFailed(task.getEntity().getLabel(), task.getOperation().name());
            log.warn("Replication of {} {} failed (attempt {}): {}",
                    task.getEntity().getLabel(), task.getForeignId(), task.getRetryCount() + 1, e.getMessage());
            recordFailure(task, e);
            return false;
        }
    }

    private void recordFailure(ReplicationTask task, Exception cause) {
        try {
            outbox.markFailed(task.getId(), cause.getMessage(), settings.getMaxRetries())
                    .filter(ReplicationTask::isDead)
                    .ifPresent(dead -> {
                        metrics.recordDeadLettered(dead.getEntity().getLabel());
                        log.error("Replication task {} for {} {} dead after {} attempts: {}",
                                dead.getId(), dead.getEntity().getLabel(), dead.getForeignId(),
                                dead.getRetryCount(), dead.getLastError());
                    });
        } catch (Exception e) {
            log.warn("Could not record failure of replication task {}: {}", task.getId(), e.getMessage());
        }
    }

    private <D> void copyFromPrimary(ReplicationRegistration<D> registration, String foreignId) {
        Optional<D> document = primary.findById(registration.getDocumentType(), foreignId);
        if (document.isPresent()) {
            registration.getWriter().upsert(document.get());
        } else {
            log.debug("{} {} no longer in primary store, removing shadow row", registration.getEntity().getLabel(), foreignId);
            registration.getWriter().delete(foreignId);
        }
    }

    // ==================== Repair ====================

    /**
     * Re-applies the shadow writer to primary documents touched by a bulk update.
     * Bulk updates bypass the per-document hooks, so callers run this afterwards.
     * Failures are counted, never thrown.
     */
    public ResyncReport resyncAfterBulkUpdate(ReplicatedEntity entity, Query filter) {
        return resyncAfterBulkUpdate(entity, filter, DEFAULT_RESYNC_LIMIT);
    }

    public ResyncReport resyncAfterBulkUpdate(ReplicatedEntity entity, Query filter, int limit) {
        ReplicationRegistration<?> registration = registrations.get(entity);
        if (registration == null) {
            log.warn("resyncAfterBulkUpdate: no registration for {}", entity);
            return ResyncReport.unregistered(entity);
        }
        try (CorrelationContext.Scope ignored = CorrelationContext.open()) {
            return resync(registration, filter == null ? new Query() : filter, limit);
        }
    }

    private <D> ResyncReport resync(ReplicationRegistration<D> registration, Query filter, int limit) {
        String label = registration.getEntity().getLabel();
        long matched;
        List<D> documents;
        try {
            matched = primary.count(registration.getDocumentType(), filter);
            documents = primary.find(registration.getDocumentType(), filter, limit);
        } catch (Exception e) {
            log.warn("resyncAfterBulkUpdate({}) could not read primary documents: {}", label, e.getMessage());
            metrics.recordResync(label, 0, 1);
            return new ResyncReport(registration.getEntity(), 0, 0, 1, false);
        }

        boolean truncated = matched > limit;
        if (truncated) {
            log.warn("resyncAfterBulkUpdate({}): {} documents matched, syncing the first {}; reconciliation covers the rest",
                    label, matched, limit);
        }

        int processed = 0;
        int failed = 0;
        for (D document : documents) {
            try {
                registration.getWriter().upsert(document);
                processed++;
            } catch (Exception e) {
                failed++;
                log.warn("resyncAfterBulkUpdate({}) failed for {}: {}",
                        label, registration.getWriter().foreignIdOf(document), e.getMessage());
            }
        }

        metrics.recordResync(label, processed, failed);
        if (failed > 0) {
            log.warn("resyncAfterBulkUpdate({}): {} of {} documents failed", label, failed, documents.size());
        } else {
            log.info("resyncAfterBulkUpdate({}): re-synced {} documents", label, processed);
        }
        return new ResyncReport(registration.getEntity(), matched, processed, failed, truncated);
    }

    /**
     * Removes a shadow row right away after a hard delete in the primary store. Best effort.
     */
    public void hardDeleteFromShadow(ReplicatedEntity entity, String foreignId) {
        ReplicationRegistration<?> registration = registrations.get(entity);
        if (registration == null || foreignId == null) {
            return;
        }
        try {
            registration.getWriter().delete(foreignId);
        } catch (Exception e) {
            metrics.recordDeliveryFailed(entity.getLabel(), ReplicationOperation.DELETE.name());
            log.warn("Hard delete of {} {} from shadow store failed: {}", entity.getLabel(), foreignId, e.getMessage());
        }
    }

    // ==================== Introspection ====================

    public Optional<ReplicationRegistration<?>> registration(ReplicatedEntity entity) {
        return Optional.ofNullable(registrations.get(entity));
    }

    public Collection<ReplicationRegistration<?>> registrations() {
        return registrations.values();
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    public Duration lease() {
        return settings.getLease();
    }
}
