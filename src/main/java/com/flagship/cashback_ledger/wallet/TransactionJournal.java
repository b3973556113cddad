package com.flagship.cashback_ledger.wallet;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only journal of wallet-affecting operations, unique on idempotency key.
 */
public interface TransactionJournal {

    /**
     * Inserts a pending row.
     *
     * @throws org.springframework.dao.DuplicateKeyException if a row with the same
     *         idempotency key already exists
     */
    WalletTransaction insertPending(WalletTransaction transaction);

    Optional<WalletTransaction> findById(String id);

    Optional<WalletTransaction> findByIdempotencyKey(String idempotencyKey);

    /**
     * Marks the row completed. Wins over a concurrent failure mark because the
     * wallet already carries the row's effect.
     */
    WalletTransaction markCompleted(String id, String walletId);

    /**
     * Marks a pending row failed.
     *
     * @return The updated row, or empty if the row was no longer pending
     */
    Optional<WalletTransaction> markFailed(String id, String reason);

    /**
     * Moves a failed row back to pending so a replay can re-attempt it.
     *
     * @return true if this caller won the row
     */
    boolean reclaimFailed(String id);

    List<WalletTransaction> findPendingCreatedBefore(Instant cutoff, int limit);

    List<WalletTransaction> findByOwner(String ownerId, TransactionFilter filter);

    List<WalletTransaction> findByOrderId(String orderId);
}
