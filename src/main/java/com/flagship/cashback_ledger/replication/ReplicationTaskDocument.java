package com.flagship.cashback_ledger.replication;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo mapping of {@link ReplicationTask}.
 */
@Document(collection = "replication_tasks")
@CompoundIndexes({
        @CompoundIndex(name = "status_next_attempt_idx", def = "{'status': 1, 'nextAttemptAt': 1}"),
        @CompoundIndex(name = "entity_status_idx", def = "{'entity': 1, 'status': 1}")
})
@Getter
@Setter
@NoArgsConstructor
public class ReplicationTaskDocument {

    static final String ENTITY = "entity";
    static final String STATUS = "status";
    static final String RETRY_COUNT = "retryCount";
    static final String LAST_ERROR = "lastError";
    static final String CREATED_AT = "createdAt";
    static final String NEXT_ATTEMPT_AT = "nextAttemptAt";
    static final String CLAIMED_UNTIL = "claimedUntil";
    static final String PROCESSED_AT = "processedAt";

    @Id
    private String id;
    private ReplicatedEntity entity;
    private String foreignId;
    private ReplicationOperation operation;
    private ReplicationTaskStatus status;
    private int retryCount;
    private String lastError;
    private Instant createdAt;
    private Instant nextAttemptAt;
    private Instant claimedUntil;
    private Instant processedAt;

    public static ReplicationTaskDocument fromDomain(ReplicationTask task) {
        ReplicationTaskDocument doc = new ReplicationTaskDocument();
        doc.id = task.getId();
        doc.entity = task.getEntity();
        doc.foreignId = task.getForeignId();
        doc.operation = task.getOperation();
        doc.status = task.getStatus();
        doc.retryCount = task.getRetryCount();
        doc.lastError = task.getLastError();
        doc.createdAt = task.getCreatedAt();
        doc.nextAttemptAt = task.getNextAttemptAt();
        doc.claimedUntil = task.getClaimedUntil();
        doc.processedAt = task.getProcessedAt();
        return doc;
    }

    public ReplicationTask toDomain() {
        return new ReplicationTask(id, entity, foreignId, operation, status, retryCount, lastError,
                createdAt, nextAttemptAt, claimedUntil, processedAt);
    }
}
