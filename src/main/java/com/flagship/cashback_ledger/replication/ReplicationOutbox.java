package com.flagship.cashback_ledger.replication;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Outbox of pending shadow writes, stored in {@code replication_tasks}.
 *
 * Tasks are claimed with a lease rather than locked: a claim sets
 * {@code claimedUntil}, and a task whose lease ran out (the worker died) is
 * claimable again. Failed deliveries back off exponentially and become DEAD
 * once they exceed the retry limit.
 */
@Service
@Slf4j
public class ReplicationOutbox {

    private final MongoTemplate mongoTemplate;
    private final long retryBaseMs;
    private final long retryMaxMs;

    public ReplicationOutbox(MongoTemplate mongoTemplate,
                             @Value("${replication.retry.base-ms:1000}") long retryBaseMs,
                             @Value("${replication.retry.max-ms:300000}") long retryMaxMs) {
        this.mongoTemplate = mongoTemplate;
        this.retryBaseMs = retryBaseMs;
        this.retryMaxMs = retryMaxMs;
    }

    public ReplicationTask enqueue(ReplicatedEntity entity, String foreignId, ReplicationOperation operation) {
        ReplicationTaskDocument saved = mongoTemplate.insert(
                ReplicationTaskDocument.fromDomain(ReplicationTask.create(entity, foreignId, operation)));
        log.debug("Enqueued replication task: id={}, entity={}, foreignId={}, operation={}",
                saved.getId(), entity, foreignId, operation);
        return saved.toDomain();
    }

    /**
     * Claims one specific task if it is pending and not leased by another worker.
     */
    public Optional<ReplicationTask> claim(String taskId, Duration lease) {
        Instant now = Instant.now();
        Query query = Query.query(Criteria.where("_id").is(taskId)
                .and(ReplicationTaskDocument.STATUS).is(ReplicationTaskStatus.PENDING)
                .orOperator(
                        Criteria.where(ReplicationTaskDocument.CLAIMED_UNTIL).is(null),
                        Criteria.where(ReplicationTaskDocument.CLAIMED_UNTIL).lt(now)));
        return Optional.ofNullable(claimOne(query, now.plus(lease)));
    }

    /**
     * Claims up to {@code limit} due tasks, oldest first.
     */
    public List<ReplicationTask> claimBatch(int limit, Duration lease) {
        List<ReplicationTask> claimed = new ArrayList<>();
        for (int i = 0; i < limit; i++) {
            Instant now = Instant.now();
            Query query = Query.query(Criteria.where(ReplicationTaskDocument.STATUS).is(ReplicationTaskStatus.PENDING)
                            .and(ReplicationTaskDocument.NEXT_ATTEMPT_AT).lte(now)
                            .orOperator(
                                    Criteria.where(ReplicationTaskDocument.CLAIMED_UNTIL).is(null),
                                    Criteria.where(ReplicationTaskDocument.CLAIMED_UNTIL).lt(now)))
                    .with(Sort.by(Sort.Direction.ASC, ReplicationTaskDocument.CREATED_AT));
            ReplicationTask task = claimOne(query, now.plus(lease));
            if (task == null) {
                break;
            }
            claimed.add(task);
        }
        return claimed;
    }

    public void markDelivered(String taskId) {
        Update update = new Update()
                .set(ReplicationTaskDocument.STATUS, ReplicationTaskStatus.DELIVERED)
                .set(ReplicationTaskDocument.PROCESSED_AT, Instant.now())
                .unset(ReplicationTaskDocument.CLAIMED_UNTIL)
                .unset(ReplicationTaskDocument.LAST_ERROR);
        mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(taskId)), update, ReplicationTaskDocument.class);
    }

    /**
     * Records a failed delivery, scheduling the next attempt or dead-lettering the task.
     *
     * @return The task after the update, empty if it no longer exists
     */
    public Optional<ReplicationTask> markFailed(String taskId, String error, int maxRetries) {
        ReplicationTaskDocument current = mongoTemplate.findById(taskId, ReplicationTaskDocument.class);
        if (current == null) {
            return Optional.empty();
        }
        int attempts = current.getRetryCount() + 1;
        Instant now = Instant.now();
        Update update = new Update()
                .set(ReplicationTaskDocument.RETRY_COUNT, attempts)
                .set(ReplicationTaskDocument.LAST_ERROR, truncate(error))
                .unset(ReplicationTaskDocument.CLAIMED_UNTIL);
        if (attempts >= maxRetries) {
            update.set(ReplicationTaskDocument.STATUS, ReplicationTaskStatus.DEAD)
                    .set(ReplicationTaskDocument.PROCESSED_AT, now);
        } else {
            update.set(ReplicationTaskDocument.NEXT_ATTEMPT_AT, now.plusMillis(backoffMs(attempts)));
        }
        ReplicationTaskDocument updated = mongoTemplate.findAndModify(
                Query.query(Criteria.where("_id").is(taskId)),
                update,
                FindAndModifyOptions.options().returnNew(true),
                ReplicationTaskDocument.class);
        return Optional.ofNullable(updated).map(ReplicationTaskDocument::toDomain);
    }

    /**
     * Puts dead tasks of one entity type back in the queue with a fresh retry budget.
     *
     * @return Number of tasks revived
     */
    public long reviveDead(ReplicatedEntity entity) {
        Update update = new Update()
                .set(ReplicationTaskDocument.STATUS, ReplicationTaskStatus.PENDING)
                .set(ReplicationTaskDocument.RETRY_COUNT, 0)
                .set(ReplicationTaskDocument.NEXT_ATTEMPT_AT, Instant.now())
                .unset(ReplicationTaskDocument.PROCESSED_AT);
        return mongoTemplate.updateMulti(
                Query.query(Criteria.where(ReplicationTaskDocument.ENTITY).is(entity)
                        .and(ReplicationTaskDocument.STATUS).is(ReplicationTaskStatus.DEAD)),
                update,
                ReplicationTaskDocument.class).getModifiedCount();
    }

    public long countPending() {
        return mongoTemplate.count(
                Query.query(Criteria.where(ReplicationTaskDocument.STATUS).is(ReplicationTaskStatus.PENDING)),
                ReplicationTaskDocument.class);
    }

    public long countDead() {
        return mongoTemplate.count(
                Query.query(Criteria.where(ReplicationTaskDocument.STATUS).is(ReplicationTaskStatus.DEAD)),
                ReplicationTaskDocument.class);
    }

    public Optional<Instant> findOldestPendingCreatedAt() {
        Query query = Query.query(Criteria.where(ReplicationTaskDocument.STATUS).is(ReplicationTaskStatus.PENDING))
                .with(Sort.by(Sort.Direction.ASC, ReplicationTaskDocument.CREATED_AT))
                .limit(1);
        return Optional.ofNullable(mongoTemplate.findOne(query, ReplicationTaskDocument.class))
                .map(ReplicationTaskDocument::getCreatedAt);
    }

    public Optional<ReplicationTask> findById(String taskId) {
        return Optional.ofNullable(mongoTemplate.findById(taskId, ReplicationTaskDocument.class))
                .map(ReplicationTaskDocument::toDomain);
    }

    /**
     * Deletes delivered tasks processed before the cutoff.
     */
    public long purgeDeliveredBefore(Instant cutoff) {
        return mongoTemplate.remove(
                Query.query(Criteria.where(ReplicationTaskDocument.STATUS).is(ReplicationTaskStatus.DELIVERED)
                        .and(ReplicationTaskDocument.PROCESSED_AT).lt(cutoff)),
                ReplicationTaskDocument.class).getDeletedCount();
    }

    long backoffMs(int attempts) {
        long delay = retryBaseMs * (1L << Math.min(attempts - 1, 20));
        return Math.min(delay, retryMaxMs);
    }

    private ReplicationTask claimOne(Query query, Instant leaseUntil) {
        ReplicationTaskDocument claimed = mongoTemplate.findAndModify(
                query,
                new Update().set(ReplicationTaskDocument.CLAIMED_UNTIL, leaseUntil),
                FindAndModifyOptions.options().returnNew(true),
                ReplicationTaskDocument.class);
        return claimed == null ? null : claimed.toDomain();
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > 1000 ? error.substring(0, 1000) : error;
    }
}
