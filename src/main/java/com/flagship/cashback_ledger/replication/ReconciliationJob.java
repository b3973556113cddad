package com.flagship.cashback_ledger.replication;

import com.flagship.cashback_ledger.observability.CorrelationContext;
import com.flagship.cashback_ledger.observability.ReplicationMetrics;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Periodic repair of the shadow store.
 *
 * For every registered entity type, scans primary documents modified since
 * the last watermark (all documents on the first run), compares each one's
 * version with the shadow row and re-writes missing or stale rows. Then pages
 * through the whole shadow table and deletes rows whose primary document is
 * gone. Dead replication tasks of the type are revived afterwards. The
 * watermark only advances when a run completes without failures or truncation.
 */
@Component
@ConditionalOnProperty(name = "reconciliation.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ReconciliationJob {

    private final ReplicationHandle handle;
    private final PrimaryDocumentSource primary;
    private final ReplicationOutbox outbox;
    private final ReplicationSyncStateRepository syncStateRepository;
    private final ReplicationMetrics metrics;
    private final ReconciliationSettings settings;

    public ReconciliationJob(ReplicationHandle handle,
                             PrimaryDocumentSource primary,
                             ReplicationOutbox outbox,
                             ReplicationSyncStateRepository syncStateRepository,
                             ReplicationMetrics metrics,
                             ReconciliationSettings settings) {
        this.handle = handle;
        this.primary = primary;
        this.outbox = outbox;
        this.syncStateRepository = syncStateRepository;
        this.metrics = metrics;
        this.settings = settings;
    }

    @Value
    public static class Outcome {
        ReplicatedEntity entity;
        long scanned;
        long repaired;
        long removed;
        long failed;
        boolean truncated;
        String status;
    }

    @Scheduled(fixedDelayString = "${reconciliation.interval-ms:300000}",
            initialDelayString = "${reconciliation.initial-delay-ms:60000}")
    public void reconcile() {
        try {
            runOnce();
        } catch (Exception e) {
            log.error("Reconciliation run failed", e);
        }
    }

    public List<Outcome> runOnce() {
        List<Outcome> outcomes = new ArrayList<>();
        if (!handle.isEnabled()) {
            return outcomes;
        }
        try (CorrelationContext.Scope ignored = CorrelationContext.open()) {
            for (ReplicationRegistration<?> registration : handle.registrations()) {
                outcomes.add(reconcileEntity(registration));
            }
        }
        return outcomes;
    }

    private <D> Outcome reconcileEntity(ReplicationRegistration<D> registration) {
        ReplicatedEntity entity = registration.getEntity();
        Instant startedAt = Instant.now();
        ReplicationSyncStateEntity state = syncStateRepository.findById(entity.name())
                .orElseGet(() -> newState(entity));
        Tally tally = new Tally();

        try {
            repairFromPrimary(registration, state, tally);
            removeOrphans(registration, tally);

            long revived = outbox.reviveDead(entity);
            if (revived > 0) {
                log.info("Revived {} dead {} replication tasks", revived, entity.getLabel());
            }

        } catch (Exception e) {
            tally.fail(e);
            log.error("Reconciliation of {} aborted after {} documents: {}",
                    entity.getLabel(), tally.scanned, e.getMessage());
        }

        String status = tally.failed > 0 ? ReplicationSyncStateEntity.STATUS_FAILED
                : tally.truncated ? ReplicationSyncStateEntity.STATUS_PARTIAL
                : ReplicationSyncStateEntity.STATUS_OK;
        if (ReplicationSyncStateEntity.STATUS_OK.equals(status)) {
            state.setLastSyncedAt(startedAt);
        }
        state.setLastRunAt(Instant.now());
        state.setScannedCount(tally.scanned);
        state.setRepairedCount(tally.repaired + tally.removed);
        state.setFailedCount(tally.failed);
        state.setStatus(status);
        state.setLastError(tally.lastError);
        saveState(state);

        metrics.recordReconciled(entity.getLabel(), tally.repaired, tally.removed, tally.failed);
        if (tally.repaired > 0 || tally.removed > 0 || tally.failed > 0) {
            log.info("Reconciliation of {}: scanned={}, repaired={}, removed={}, failed={}, status={}",
                    entity.getLabel(), tally.scanned, tally.repaired, tally.removed, tally.failed, status);
        } else {
            log.debug("Reconciliation of {}: scanned={}, shadow store in sync", entity.getLabel(), tally.scanned);
        }
        return new Outcome(entity, tally.scanned, tally.repaired, tally.removed, tally.failed, tally.truncated, status);
    }

    /**
     * Re-writes shadow rows that are missing or older than their primary document.
     */
    private <D> void repairFromPrimary(ReplicationRegistration<D> registration,
                                       ReplicationSyncStateEntity state, Tally tally) {
        ReplicatedEntity entity = registration.getEntity();
        ShadowWriter<D> writer = registration.getWriter();
        Instant windowStart = state.getLastSyncedAt() == null
                ? null
                : state.getLastSyncedAt().minus(settings.getOverlap());

        String lastId = null;
        long seen = 0;
        while (true) {
            if (seen >= settings.getMaxDocumentsPerRun()) {
                tally.truncated = true;
                return;
            }
            Query page = new Query().with(Sort.by(Sort.Direction.ASC, "_id"));
            if (windowStart != null) {
                page.addCriteria(Criteria.where(registration.getUpdatedAtField()).gte(windowStart));
            }
            if (lastId != null) {
                page.addCriteria(Criteria.where("_id").gt(lastId));
            }
            List<D> documents = primary.find(registration.getDocumentType(), page, settings.getPageSize());
            if (documents.isEmpty()) {
                return;
            }

            List<String> ids = new ArrayList<>(documents.size());
            for (D document : documents) {
                ids.add(writer.foreignIdOf(document));
            }
            Map<String, Long> shadowVersions = writer.shadowVersions(ids);

            for (D document : documents) {
                String id = writer.foreignIdOf(document);
                Long shadowVersion = shadowVersions.get(id);
                if (shadowVersion != null && shadowVersion >= writer.sourceVersionOf(document)) {
                    continue;
                }
                try {
                    writer.upsert(document);
                    tally.repaired++;
                    log.debug("Reconciled {} {} (shadow version {}, primary version {})",
                            entity.getLabel(), id, shadowVersion, writer.sourceVersionOf(document));
                } catch (Exception e) {
                    tally.fail(e);
                    log.warn("Reconciliation of {} {} failed: {}", entity.getLabel(), id, e.getMessage());
                }
            }

            seen += documents.size();
            tally.scanned += documents.size();
            lastId = ids.get(ids.size() - 1);
            if (documents.size() < settings.getPageSize()) {
                return;
            }
        }
    }

    /**
     * Deletes shadow rows whose primary document no longer exists, such as
     * rows left behind by a delete-by-filter the write hooks could not map to ids.
     */
    private <D> void removeOrphans(ReplicationRegistration<D> registration, Tally tally) {
        ReplicatedEntity entity = registration.getEntity();
        ShadowWriter<D> writer = registration.getWriter();

        String lastId = null;
        long seen = 0;
        while (true) {
            if (seen >= settings.getMaxDocumentsPerRun()) {
                tally.truncated = true;
                return;
            }
            List<String> shadowIds = writer.shadowIdsAfter(lastId, settings.getPageSize());
            if (shadowIds.isEmpty()) {
                return;
            }

            Set<String> live = primaryIds(registration, shadowIds);
            for (String id : shadowIds) {
                if (live.contains(id)) {
                    continue;
                }
                try {
                    writer.delete(id);
                    tally.removed++;
                    log.debug("Removed shadow {} {}: primary document is gone", entity.getLabel(), id);
                } catch (Exception e) {
                    tally.fail(e);
                    log.warn("Removing orphaned shadow {} {} failed: {}", entity.getLabel(), id, e.getMessage());
                }
            }

            seen += shadowIds.size();
            lastId = shadowIds.get(shadowIds.size() - 1);
            if (shadowIds.size() < settings.getPageSize()) {
                return;
            }
        }
    }

    private <D> Set<String> primaryIds(ReplicationRegistration<D> registration, List<String> ids) {
        Query query = Query.query(Criteria.where("_id").in(ids));
        query.fields().include("_id");
        Set<String> live = new HashSet<>();
        for (D document : primary.find(registration.getDocumentType(), query, ids.size())) {
            live.add(registration.getWriter().foreignIdOf(document));
        }
        return live;
    }

    private void saveState(ReplicationSyncStateEntity state) {
        try {
            syncStateRepository.save(state);
        } catch (Exception e) {
            log.warn("Could not save reconciliation state for {}: {}", state.getEntityType(), e.getMessage());
        }
    }

    private static final class Tally {
        long scanned;
        long repaired;
        long removed;
        long failed;
        boolean truncated;
        String lastError;

        void fail(Exception e) {
            failed++;
            lastError = e.getMessage();
        }
    }

    private static ReplicationSyncStateEntity newState(ReplicatedEntity entity) {
        ReplicationSyncStateEntity state = new ReplicationSyncStateEntity();
        state.setEntityType(entity.name());
        return state;
    }

    /**
     * Bound from {@code reconciliation.*}.
     */
    @Value
    public static class ReconciliationSettings {
        int pageSize;
        long maxDocumentsPerRun;
        /** Re-scan window before the watermark, covering writes whose updatedAt lagged the clock. */
        Duration overlap;

        public static ReconciliationSettings defaults() {
            return new ReconciliationSettings(200, 50_000, Duration.ofMinutes(5));
        }
    }
}
