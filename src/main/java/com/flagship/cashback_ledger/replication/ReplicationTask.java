package com.flagship.cashback_ledger.replication;

import lombok.Value;

import java.time.Instant;

/**
 * Outbox row asking for one primary document to be copied to (or removed from) the shadow store.
 *
 * Tasks carry only the entity type and foreign id: delivery re-reads the
 * primary document, so a task delivered late still writes current state.
 */
@Value
public class ReplicationTask {
    String id;
    ReplicatedEntity entity;
    String foreignId;
    ReplicationOperation operation;
    ReplicationTaskStatus status;
    int retryCount;
    String lastError;
    Instant createdAt;
    Instant nextAttemptAt;
    Instant claimedUntil;
    Instant processedAt;

    public static ReplicationTask create(ReplicatedEntity entity, String foreignId, ReplicationOperation operation) {
        Instant now = Instant.now();
        return new ReplicationTask(null, entity, foreignId, operation, ReplicationTaskStatus.PENDING,
                0, null, now, now, null, null);
    }

    public boolean isDead() {
        return status == ReplicationTaskStatus.DEAD;
    }
}
