package com.flagship.cashback_ledger.replication;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Reconciliation watermark per entity type, kept in the shadow store.
 */
@Entity
@Table(name = "replication_sync_state")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ReplicationSyncStateEntity {

    public static final String STATUS_OK = "OK";
    public static final String STATUS_PARTIAL = "PARTIAL";
    public static final String STATUS_FAILED = "FAILED";

    @Id
    @Column(name = "entity_type", nullable = false, updatable = false, length = 50)
    private String entityType;

    /** Primary-store {@code updatedAt} up to which every document is known to be replicated. */
    @Column(name = "last_synced_at")
    private Instant lastSyncedAt;

    @Column(name = "last_run_at", nullable = false)
    private Instant lastRunAt;

    @Column(name = "scanned_count", nullable = false)
    private long scannedCount;

    @Column(name = "repaired_count", nullable = false)
    private long repairedCount;

    @Column(name = "failed_count", nullable = false)
    private long failedCount;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;
}
