package com.flagship.cashback_ledger.wallet;

import com.flagship.cashback_ledger.replication.PrimaryWriteHooks;
import com.flagship.cashback_ledger.replication.ReplicatedEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Journal backed by the {@code wallet_transactions} collection.
 *
 * Inserts go through {@code MongoTemplate.insert} and are picked up by the
 * mapping-event replication listener; status changes use {@code findAndModify}
 * and notify the replication hooks directly.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class MongoTransactionJournal implements TransactionJournal {

    private final MongoTemplate mongoTemplate;
    private final PrimaryWriteHooks writeHooks;

    @Override
    public WalletTransaction insertPending(WalletTransaction transaction) {
        WalletTransactionDocument saved = mongoTemplate.insert(WalletTransactionDocument.fromDomain(transaction));
        log.debug("Journaled pending transaction: id={}, key={}, type={}",
                saved.getId(), saved.getIdempotencyKey(), saved.getType());
        return saved.toDomain();
    }

    @Override
    public Optional<WalletTransaction> findById(String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, WalletTransactionDocument.class))
                .map(WalletTransactionDocument::toDomain);
    }

    @Override
    public Optional<WalletTransaction> findByIdempotencyKey(String idempotencyKey) {
        Query query = Query.query(Criteria.where(WalletTransactionDocument.IDEMPOTENCY_KEY).is(idempotencyKey));
        return Optional.ofNullable(mongoTemplate.findOne(query, WalletTransactionDocument.class))
                .map(WalletTransactionDocument::toDomain);
    }

    @Override
    public WalletTransaction markCompleted(String id, String walletId) {
        Update update = new Update()
                .set(WalletTransactionDocument.STATUS, TransactionStatus.COMPLETED)
                .set(WalletTransactionDocument.WALLET_ID, walletId)
                .unset(WalletTransactionDocument.FAILURE_REASON)
                .inc(WalletTransactionDocument.REVISION, 1)
                .set(WalletTransactionDocument.UPDATED_AT, Instant.now());
        WalletTransactionDocument updated = mongoTemplate.findAndModify(
                Query.query(Criteria.where("_id").is(id)),
                update,
                FindAndModifyOptions.options().returnNew(true),
                WalletTransactionDocument.class);
        if (updated == null) {
            throw new IllegalStateException("Journal row " + id + " disappeared before completion");
        }
        writeHooks.afterUpsert(ReplicatedEntity.TRANSACTION, id);
        return updated.toDomain();
    }

    @Override
    public Optional<WalletTransaction> markFailed(String id, String reason) {
        Update update = new Update()
                .set(WalletTransactionDocument.STATUS, TransactionStatus.FAILED)
                .set(WalletTransactionDocument.FAILURE_REASON, reason)
                .inc(WalletTransactionDocument.REVISION, 1)
                .set(WalletTransactionDocument.UPDATED_AT, Instant.now());
        WalletTransactionDocument updated = mongoTemplate.findAndModify(
                Query.query(Criteria.where("_id").is(id)
                        .and(WalletTransactionDocument.STATUS).is(TransactionStatus.PENDING)),
                update,
                FindAndModifyOptions.options().returnNew(true),
                WalletTransactionDocument.class);
        if (updated == null) {
            return Optional.empty();
        }
        writeHooks.afterUpsert(ReplicatedEntity.TRANSACTION, id);
        return Optional.of(updated.toDomain());
    }

    @Override
    public boolean reclaimFailed(String id) {
        Update update = new Update()
                .set(WalletTransactionDocument.STATUS, TransactionStatus.PENDING)
                .inc(WalletTransactionDocument.REVISION, 1)
                .set(WalletTransactionDocument.UPDATED_AT, Instant.now());
        WalletTransactionDocument updated = mongoTemplate.findAndModify(
                Query.query(Criteria.where("_id").is(id)
                        .and(WalletTransactionDocument.STATUS).is(TransactionStatus.FAILED)),
                update,
                FindAndModifyOptions.options().returnNew(true),
                WalletTransactionDocument.class);
        if (updated == null) {
            return false;
        }
        writeHooks.afterUpsert(ReplicatedEntity.TRANSACTION, id);
        return true;
    }

    @Override
    public List<WalletTransaction> findPendingCreatedBefore(Instant cutoff, int limit) {
        Query query = Query.query(Criteria.where(WalletTransactionDocument.STATUS).is(TransactionStatus.PENDING)
                        .and(WalletTransactionDocument.CREATED_AT).lt(cutoff))
                .with(Sort.by(Sort.Direction.ASC, WalletTransactionDocument.CREATED_AT))
                .limit(limit);
        return mongoTemplate.find(query, WalletTransactionDocument.class).stream()
                .map(WalletTransactionDocument::toDomain)
                .toList();
    }

    @Override
    public List<WalletTransaction> findByOwner(String ownerId, TransactionFilter filter) {
        Criteria criteria = Criteria.where(WalletTransactionDocument.OWNER_ID).is(ownerId);
        if (!filter.getTypes().isEmpty()) {
            criteria.and(WalletTransactionDocument.TYPE).in(filter.getTypes());
        }
        if (!filter.getStatuses().isEmpty()) {
            criteria.and(WalletTransactionDocument.STATUS).in(filter.getStatuses());
        }
        if (filter.getOrderId() != null) {
            criteria.and(WalletTransactionDocument.ORDER_ID).is(filter.getOrderId());
        }
        if (filter.getCreatedFrom() != null || filter.getCreatedBefore() != null) {
            Criteria created = criteria.and(WalletTransactionDocument.CREATED_AT);
            if (filter.getCreatedFrom() != null) {
                created.gte(filter.getCreatedFrom());
            }
            if (filter.getCreatedBefore() != null) {
                created.lt(filter.getCreatedBefore());
            }
        }

        Query query = Query.query(criteria)
                .with(Sort.by(Sort.Direction.DESC, WalletTransactionDocument.CREATED_AT))
                .limit(filter.effectiveLimit());
        return mongoTemplate.find(query, WalletTransactionDocument.class).stream()
                .map(WalletTransactionDocument::toDomain)
                .toList();
    }

    @Override
    public List<WalletTransaction> findByOrderId(String orderId) {
        Query query = Query.query(Criteria.where(WalletTransactionDocument.ORDER_ID).is(orderId))
                .with(Sort.by(Sort.Direction.ASC, WalletTransactionDocument.CREATED_AT));
        return mongoTemplate.find(query, WalletTransactionDocument.class).stream()
                .map(WalletTransactionDocument::toDomain)
                .toList();
    }
}
