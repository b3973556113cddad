package com.flagship.cashback_ledger.support;

import com.flagship.cashback_ledger.wallet.TransactionFilter;
import com.flagship.cashback_ledger.wallet.TransactionJournal;
import com.flagship.cashback_ledger.wallet.TransactionStatus;
import com.flagship.cashback_ledger.wallet.WalletTransaction;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Journal with a unique idempotency key, raising the same exception the Mongo journal does.
 */
public class InMemoryTransactionJournal implements TransactionJournal {

    private final Map<String, WalletTransaction> byId = new LinkedHashMap<>();
    private final Map<String, String> idByKey = new LinkedHashMap<>();

    @Override
    public synchronized WalletTransaction insertPending(WalletTransaction transaction) {
        if (idByKey.containsKey(transaction.getIdempotencyKey())) {
            throw new DuplicateKeyException("duplicate idempotencyKey " + transaction.getIdempotencyKey());
        }
        idByKey.put(transaction.getIdempotencyKey(), transaction.getId());
        byId.put(transaction.getId(), transaction);
        return transaction;
    }

    @Override
    public synchronized Optional<WalletTransaction> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public synchronized Optional<WalletTransaction> findByIdempotencyKey(String idempotencyKey) {
        return Optional.ofNullable(idByKey.get(idempotencyKey)).map(byId::get);
    }

    @Override
    public synchronized WalletTransaction markCompleted(String id, String walletId) {
        WalletTransaction current = byId.get(id);
        if (current == null) {
            throw new IllegalStateException("Journal row " + id + " disappeared before completion");
        }
        return store(current.toBuilder()
                .status(TransactionStatus.COMPLETED)
                .walletId(walletId)
                .failureReason(null)
                .build());
    }

    @Override
    public synchronized Optional<WalletTransaction> markFailed(String id, String reason) {
        WalletTransaction current = byId.get(id);
        if (current == null || current.getStatus() != TransactionStatus.PENDING) {
            return Optional.empty();
        }
        return Optional.of(store(current.toBuilder()
                .status(TransactionStatus.FAILED)
                .failureReason(reason)
                .build()));
    }

    @Override
    public synchronized boolean reclaimFailed(String id) {
        WalletTransaction current = byId.get(id);
        if (current == null || current.getStatus() != TransactionStatus.FAILED) {
            return false;
        }
        store(current.toBuilder().status(TransactionStatus.PENDING).build());
        return true;
    }

    @Override
    public synchronized List<WalletTransaction> findPendingCreatedBefore(Instant cutoff, int limit) {
        return byId.values().stream()
                .filter(tx -> tx.getStatus() == TransactionStatus.PENDING)
                .filter(tx -> tx.getCreatedAt().isBefore(cutoff))
                .sorted(Comparator.comparing(WalletTransaction::getCreatedAt))
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized List<WalletTransaction> findByOwner(String ownerId, TransactionFilter filter) {
        return byId.values().stream()
                .filter(tx -> tx.getOwnerId().equals(ownerId))
                .filter(tx -> filter.getTypes().isEmpty() || filter.getTypes().contains(tx.getType()))
                .filter(tx -> filter.getStatuses().isEmpty() || filter.getStatuses().contains(tx.getStatus()))
                .filter(tx -> filter.getOrderId() == null || filter.getOrderId().equals(tx.getOrderId()))
                .filter(tx -> filter.getCreatedFrom() == null || !tx.getCreatedAt().isBefore(filter.getCreatedFrom()))
                .filter(tx -> filter.getCreatedBefore() == null || tx.getCreatedAt().isBefore(filter.getCreatedBefore()))
                .sorted(Comparator.comparing(WalletTransaction::getCreatedAt).reversed())
                .limit(filter.effectiveLimit())
                .toList();
    }

    @Override
    public synchronized List<WalletTransaction> findByOrderId(String orderId) {
        return byId.values().stream()
                .filter(tx -> orderId.equals(tx.getOrderId()))
                .toList();
    }

    /**
     * Inserts a row as-is, standing in for one written by an earlier (possibly crashed) process.
     */
    public synchronized void seed(WalletTransaction transaction) {
        idByKey.put(transaction.getIdempotencyKey(), transaction.getId());
        byId.put(transaction.getId(), transaction);
    }

    public synchronized List<WalletTransaction> all() {
        return new ArrayList<>(byId.values());
    }

    public synchronized long countByKey(String idempotencyKey) {
        return byId.values().stream().filter(tx -> tx.getIdempotencyKey().equals(idempotencyKey)).count();
    }

    private WalletTransaction store(WalletTransaction next) {
        WalletTransaction revised = next.toBuilder()
                .revision(next.getRevision() + 1)
                .updatedAt(Instant.now())
                .build();
        byId.put(revised.getId(), revised);
        return revised;
    }
}
