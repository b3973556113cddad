package com.flagship.cashback_ledger.wallet;

import com.flagship.cashback_ledger.replication.PrimaryWriteHooks;
import com.flagship.cashback_ledger.replication.ReplicatedEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Wallet store backed by the {@code wallets} collection.
 *
 * Balance writes are a single {@code findAndModify} matching on the expected
 * version, so no two writers can both apply against the same snapshot.
 * {@code findAndModify} does not raise mapping lifecycle events, so the
 * replication hook is called explicitly after each write.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class MongoWalletStore implements WalletStore {

    private final MongoTemplate mongoTemplate;
    private final PrimaryWriteHooks writeHooks;

    @Override
    public Optional<Wallet> findByOwner(String ownerId) {
        Query query = Query.query(activeOwner(ownerId));
        return Optional.ofNullable(mongoTemplate.findOne(query, WalletDocument.class))
                .map(WalletDocument::toDomain);
    }

    @Override
    public Wallet ensureWallet(String ownerId) {
        Optional<Wallet> existing = findByOwner(ownerId);
        if (existing.isPresent()) {
            return existing.get();
        }

        Instant now = Instant.now();
        Update update = new Update()
                .setOnInsert(WalletDocument.OWNER_ID, ownerId)
                .setOnInsert("currency", Wallet.DEFAULT_CURRENCY)
                .setOnInsert(WalletDocument.AVAILABLE, 0L)
                .setOnInsert(WalletDocument.PENDING, 0L)
                .setOnInsert(WalletDocument.LOCKED, 0L)
                .setOnInsert(WalletDocument.VERSION, 0L)
                .setOnInsert(WalletDocument.CREATED_AT, now)
                .setOnInsert(WalletDocument.UPDATED_AT, now);

        try {
            WalletDocument created = mongoTemplate.findAndModify(
                    Query.query(activeOwner(ownerId)),
                    update,
                    FindAndModifyOptions.options().upsert(true).returnNew(true),
                    WalletDocument.class);
            log.info("Opened wallet for owner {}", ownerId);
            writeHooks.afterUpsert(ReplicatedEntity.WALLET, created.getId());
            return created.toDomain();
        } catch (DuplicateKeyException e) {
            // Lost the upsert race to another writer for the same owner
            log.debug("Concurrent wallet creation for owner {}, reading winner", ownerId);
            return findByOwner(ownerId)
                    .orElseThrow(() -> new IllegalStateException("Wallet for owner " + ownerId + " vanished after upsert race", e));
        }
    }

    @Override
    public Optional<Wallet> compareAndApply(Wallet expected, BalanceDelta delta, String transactionId) {
        Criteria criteria = Criteria.where("_id").is(expected.getId())
                .and(WalletDocument.VERSION).is(expected.getVersion())
                .and(WalletDocument.DELETED_AT).is(null);
        guardNonNegative(criteria, WalletDocument.AVAILABLE, delta.getAvailablePaise());
        guardNonNegative(criteria, WalletDocument.PENDING, delta.getPendingPaise());
        guardNonNegative(criteria, WalletDocument.LOCKED, delta.getLockedPaise());

        Update update = new Update()
                .inc(WalletDocument.AVAILABLE, delta.getAvailablePaise())
                .inc(WalletDocument.PENDING, delta.getPendingPaise())
                .inc(WalletDocument.LOCKED, delta.getLockedPaise())
                .inc(WalletDocument.VERSION, 1)
                .set(WalletDocument.UPDATED_AT, Instant.now());
        update.push(WalletDocument.RECENT_TRANSACTIONS)
                .slice(-Wallet.RECENT_TRANSACTIONS_KEPT)
                .each(transactionId);

        WalletDocument updated = mongoTemplate.findAndModify(
                Query.query(criteria),
                update,
                FindAndModifyOptions.options().returnNew(true),
                WalletDocument.class);

        if (updated == null) {
            return Optional.empty();
        }
        writeHooks.afterUpsert(ReplicatedEntity.WALLET, updated.getId());
        return Optional.of(updated.toDomain());
    }

    private static Criteria activeOwner(String ownerId) {
        return Criteria.where(WalletDocument.OWNER_ID).is(ownerId)
                .and(WalletDocument.DELETED_AT).is(null);
    }

    private static void guardNonNegative(Criteria criteria, String field, long change) {
        if (change < 0) {
            criteria.and(field).gte(-change);
        }
    }
}
