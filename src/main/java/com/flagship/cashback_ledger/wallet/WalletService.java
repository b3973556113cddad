package com.flagship.cashback_ledger.wallet;

import com.flagship.cashback_ledger.common.exception.BalanceLimitExceededException;
import com.flagship.cashback_ledger.common.exception.ConcurrentLedgerModificationException;
import com.flagship.cashback_ledger.common.exception.IdempotencyConflictException;
import com.flagship.cashback_ledger.common.exception.InvalidAmountException;
import com.flagship.cashback_ledger.common.exception.LedgerException;
import com.flagship.cashback_ledger.common.exception.LedgerUnavailableException;
import com.flagship.cashback_ledger.common.exception.WalletNotFoundException;
import com.flagship.cashback_ledger.observability.CorrelationContext;
import com.flagship.cashback_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Idempotent, at-most-once wallet mutations.
 *
 * Every mutation follows the same journal-first protocol:
 * 1. Insert a PENDING journal row keyed by the idempotency key
 * 2. A unique-key violation means the key was used before; that row's outcome is returned
 * 3. Apply the delta to the wallet with a compare-and-swap on its version,
 *    recording the row id on the wallet in the same write
 * 4. Mark the row COMPLETED, or FAILED when the wallet was not touched
 *
 * Concurrency:
 * - No in-process locks; same-owner writers serialize through the version check
 * - Lost version races are retried with exponential backoff
 * - A row left PENDING by a crash is resolved by asking the wallet whether it carries the row id
 */
@Service
@Slf4j
public class WalletService {

    private static final Set<TransactionType> SETTLE_TYPES =
            Set.of(TransactionType.COMMISSION_SETTLE, TransactionType.CASHBACK_SETTLE);
    private static final String REVERSAL_KEY_PREFIX = "reversal:";
    private static final int MAX_RESOLVE_ROUNDS = 3;

    private final WalletStore walletStore;
    private final TransactionJournal journal;
    private final IdempotencyCache idempotencyCache;
    private final LedgerMetrics metrics;
    private final WalletSettings settings;
    private final RetryTemplate casRetry;
    private final RetryTemplate pendingPoll;

    public WalletService(WalletStore walletStore,
                         TransactionJournal journal,
                         IdempotencyCache idempotencyCache,
                         LedgerMetrics metrics,
                         WalletSettings settings) {
        this.walletStore = walletStore;
        this.journal = journal;
        this.idempotencyCache = idempotencyCache;
        this.metrics = metrics;
        this.settings = settings;
        this.casRetry = RetryTemplate.builder()
                .maxAttempts(settings.getMaxAttempts())
                .exponentialBackoff(settings.getInitialBackoffMs(), 2.0, settings.getMaxBackoffMs())
                .retryOn(StaleWalletVersionException.class)
                .build();
        this.pendingPoll = RetryTemplate.builder()
                .maxAttempts(settings.getMaxAttempts())
                .exponentialBackoff(settings.getInitialBackoffMs(), 2.0, settings.getMaxBackoffMs())
                .retryOn(StillPendingException.class)
                .build();
    }

    // ==================== Mutations ====================

    /**
     * Credits an owner's wallet, opening the wallet if this is its first credit.
     * Lock-type credits land in the pending balance, all others in available.
     *
     * @param ownerId Wallet owner
     * @param amountPaise Positive amount
     * @param idempotencyKey Key identifying this operation across retries
     * @param type A credit type (see {@link TransactionType#isCredit()})
     * @param metadata Free-form context stored on the journal row
     * @return The completed journal row, or the row of an earlier identical call
     * @throws InvalidAmountException if amountPaise is not positive
     * @throws BalanceLimitExceededException if available would exceed the configured maximum
     * @throws IdempotencyConflictException if the key was used with different parameters
     */
    public WalletTransaction credit(String ownerId, long amountPaise, String idempotencyKey,
                                    TransactionType type, Map<String, Object> metadata) {
        return credit(mutation(ownerId, amountPaise, idempotencyKey, type, metadata));
    }

    public WalletTransaction credit(WalletMutation mutation) {
        if (mutation.getType() == null || !mutation.getType().isCredit()) {
            throw new IllegalArgumentException("Not a credit type: " + mutation.getType());
        }
        return apply(mutation);
    }

    /**
     * Debits the available balance of an existing wallet.
     *
     * @throws com.flagship.cashback_ledger.common.exception.InsufficientFundsException if available is too low
     * @throws WalletNotFoundException if the owner has no wallet
     * @throws IdempotencyConflictException if the key was used with different parameters
     */
    public WalletTransaction debit(String ownerId, long amountPaise, String idempotencyKey,
                                   TransactionType type, Map<String, Object> metadata) {
        return debit(mutation(ownerId, amountPaise, idempotencyKey, type, metadata));
    }

    public WalletTransaction debit(WalletMutation mutation) {
        if (mutation.getType() == null || !mutation.getType().isDebit()) {
            throw new IllegalArgumentException("Not a debit type: " + mutation.getType());
        }
        return apply(mutation);
    }

    /**
     * Moves funds from pending to available in one atomic wallet write.
     */
    public WalletTransaction moveLockedToAvailable(String ownerId, long amountPaise, String idempotencyKey) {
        return moveLockedToAvailable(mutation(ownerId, amountPaise, idempotencyKey,
                TransactionType.CASHBACK_SETTLE, Map.of()));
    }

    public WalletTransaction moveLockedToAvailable(WalletMutation mutation) {
        if (mutation.getType() == null || !SETTLE_TYPES.contains(mutation.getType())) {
            throw new IllegalArgumentException("Not a settle type: " + mutation.getType());
        }
        return apply(mutation);
    }

    /**
     * Moves available funds into the locked balance while a payout is in flight.
     */
    public WalletTransaction requestPayout(String ownerId, long amountPaise, String idempotencyKey, String payoutId) {
        return apply(payoutMutation(ownerId, amountPaise, idempotencyKey, payoutId, TransactionType.PAYOUT_REQUEST));
    }

    /**
     * Releases locked funds that have left the platform.
     */
    public WalletTransaction completePayout(String ownerId, long amountPaise, String idempotencyKey, String payoutId) {
        return apply(payoutMutation(ownerId, amountPaise, idempotencyKey, payoutId, TransactionType.PAYOUT_COMPLETE));
    }

    /**
     * Returns locked funds of a failed payout to available.
     */
    public WalletTransaction failPayout(String ownerId, long amountPaise, String idempotencyKey, String payoutId) {
        return apply(payoutMutation(ownerId, amountPaise, idempotencyKey, payoutId, TransactionType.PAYOUT_FAILED));
    }

    /**
     * Appends a compensating row with the inverse effect of a completed row,
     * keyed {@code reversal:<original key>}. The original row is not modified.
     */
    public WalletTransaction reverse(String transactionId) {
        WalletTransaction original = loadReversible(transactionId);
        return reverse(original, REVERSAL_KEY_PREFIX + original.getIdempotencyKey());
    }

    /**
     * Reverses a completed row under a caller-chosen idempotency key.
     */
    public WalletTransaction reverse(String transactionId, String idempotencyKey) {
        return reverse(loadReversible(transactionId), idempotencyKey);
    }

    // ==================== Reads ====================

    public Wallet ensureWallet(String ownerId) {
        requireText(ownerId, "Owner id");
        return walletStore.ensureWallet(ownerId);
    }

    public Optional<Wallet> getWallet(String ownerId) {
        requireText(ownerId, "Owner id");
        return walletStore.findByOwner(ownerId);
    }

    public List<WalletTransaction> listTransactions(String ownerId, TransactionFilter filter) {
        requireText(ownerId, "Owner id");
        return journal.findByOwner(ownerId, filter == null ? TransactionFilter.all() : filter);
    }

    public Optional<WalletTransaction> findTransactionByKey(String idempotencyKey) {
        return journal.findByIdempotencyKey(idempotencyKey);
    }

    public List<WalletTransaction> findTransactionsForOrder(String orderId) {
        return journal.findByOrderId(orderId);
    }

    // ==================== Recovery ====================

    /**
     * Settles the outcome of a row left PENDING by a crashed caller.
     * The row is completed if the wallet carries its id and failed otherwise.
     *
     * @return The resolved row
     */
    public WalletTransaction recoverPending(WalletTransaction pending) {
        try (CorrelationContext.Scope ignored = CorrelationContext.forOwner(pending.getOwnerId())) {
            boolean applied = walletStore.findByOwner(pending.getOwnerId())
                    .map(wallet -> wallet.hasApplied(pending.getId()))
                    .orElse(false);
            if (applied) {
                WalletTransaction completed = journal.markCompleted(pending.getId(), walletIdOf(pending));
                log.warn("Recovered pending transaction as completed: id={}, key={}",
                        pending.getId(), pending.getIdempotencyKey());
                metrics.recordPendingRecovered("completed");
                return completed;
            }
            Optional<WalletTransaction> failed = journal.markFailed(pending.getId(), "abandoned before wallet update");
            if (failed.isPresent()) {
                log.warn("Recovered pending transaction as failed: id={}, key={}",
                        pending.getId(), pending.getIdempotencyKey());
                metrics.recordPendingRecovered("failed");
                return failed.get();
            }
            // Another caller finalized it first
            return journal.findById(pending.getId()).orElse(pending);
        }
    }

    // ==================== Core protocol ====================

    private WalletTransaction apply(WalletMutation mutation) {
        return execute(mutation, mutation.getType().effectOf(mutation.getAmountPaise()), null);
    }

    private WalletTransaction reverse(WalletTransaction original, String idempotencyKey) {
        WalletMutation mutation = WalletMutation.builder()
                .ownerId(original.getOwnerId())
                .amountPaise(original.getAmountPaise())
                .idempotencyKey(idempotencyKey)
                .type(TransactionType.REVERSAL)
                .orderId(original.getOrderId())
                .campaignId(original.getCampaignId())
                .payoutId(original.getPayoutId())
                .metadataEntry("reversedType", original.getType().name())
                .metadataEntry("reversedKey", original.getIdempotencyKey())
                .build();
        return execute(mutation, original.getDelta().negate(), original.getId());
    }

    private WalletTransaction execute(WalletMutation mutation, BalanceDelta delta, String reversesTransactionId) {
        validate(mutation);

        try (CorrelationContext.Scope ignored = CorrelationContext.forOwner(mutation.getOwnerId())) {
            return metrics.timeMutation(() -> {
                WalletTransaction requested = WalletTransaction.pending(
                        new ObjectId().toHexString(), mutation, delta, reversesTransactionId, Instant.now());

                Optional<WalletTransaction> cached = replayFromCache(requested);
                if (cached.isPresent()) {
                    return cached.get();
                }

                WalletTransaction claimed;
                try {
                    claimed = journal.insertPending(requested);
                } catch (DuplicateKeyException e) {
                    log.debug("Idempotency key {} already journaled, resolving existing row", requested.getIdempotencyKey());
                    return resolveExisting(requested, 0);
                } catch (DataAccessException e) {
                    throw new LedgerUnavailableException(
                            "Journal unavailable for key " + requested.getIdempotencyKey(), e);
                }
                return applyToWallet(claimed);
            });
        }
    }

    private Optional<WalletTransaction> replayFromCache(WalletTransaction requested) {
        return idempotencyCache.lookup(requested.getIdempotencyKey())
                .flatMap(journal::findById)
                .filter(WalletTransaction::isCompleted)
                .map(existing -> {
                    requireSameOperation(existing, requested);
                    return replayed(existing);
                });
    }

    private WalletTransaction resolveExisting(WalletTransaction requested, int round) {
        if (round >= MAX_RESOLVE_ROUNDS) {
            throw new ConcurrentLedgerModificationException(
                    "Operation with key " + requested.getIdempotencyKey() + " keeps being re-attempted concurrently");
        }
        WalletTransaction existing = journal.findByIdempotencyKey(requested.getIdempotencyKey())
                .orElseThrow(() -> new LedgerUnavailableException(
                        "Journal row for key " + requested.getIdempotencyKey() + " not readable", null));
        requireSameOperation(existing, requested);

        return switch (existing.getStatus()) {
            case COMPLETED, REVERSED -> replayed(existing);
            case PENDING -> awaitPending(existing, requested, round);
            case FAILED -> retryFailed(existing, requested, round);
        };
    }

    private WalletTransaction replayed(WalletTransaction existing) {
        metrics.recordReplay();
        log.info("Replayed idempotent operation: key={}, transactionId={}",
                existing.getIdempotencyKey(), existing.getId());
        return existing;
    }

    /**
     * Waits with backoff for a concurrent caller to finish the row, resolving
     * it directly when the wallet already carries it or it has been abandoned.
     */
    private WalletTransaction awaitPending(WalletTransaction pending, WalletTransaction requested, int round) {
        WalletTransaction settled;
        try {
            settled = pendingPoll.execute(context -> {
                WalletTransaction current = journal.findById(pending.getId()).orElse(pending);
                if (current.getStatus() != TransactionStatus.PENDING) {
                    return current;
                }
                return resolveIfSettled(current).orElseThrow(StillPendingException::new);
            });
        } catch (StillPendingException e) {
            throw new ConcurrentLedgerModificationException(
                    "Operation with key " + pending.getIdempotencyKey() + " is still in progress");
        }

        if (settled.getStatus() == TransactionStatus.FAILED) {
            return retryFailed(settled, requested, round);
        }
        return replayed(settled);
    }

    private Optional<WalletTransaction> resolveIfSettled(WalletTransaction pending) {
        boolean applied = walletStore.findByOwner(pending.getOwnerId())
                .map(wallet -> wallet.hasApplied(pending.getId()))
                .orElse(false);
        if (applied) {
            return Optional.of(journal.markCompleted(pending.getId(), walletIdOf(pending)));
        }
        Instant staleBefore = Instant.now().minus(settings.getPendingStaleAfter());
        if (pending.getCreatedAt() != null && pending.getCreatedAt().isBefore(staleBefore)) {
            log.warn("Pending transaction {} abandoned since {}, marking failed", pending.getId(), pending.getCreatedAt());
            return Optional.of(journal.markFailed(pending.getId(), "abandoned before wallet update")
                    .orElseGet(() -> journal.findById(pending.getId()).orElse(pending)))
                    .filter(row -> row.getStatus() != TransactionStatus.PENDING);
        }
        return Optional.empty();
    }

    private WalletTransaction retryFailed(WalletTransaction failed, WalletTransaction requested, int round) {
        if (journal.reclaimFailed(failed.getId())) {
            log.info("Re-attempting failed transaction: key={}, previousFailure={}",
                    failed.getIdempotencyKey(), failed.getFailureReason());
            return applyToWallet(failed.toBuilder()
                    .status(TransactionStatus.PENDING)
                    .failureReason(null)
                    .build());
        }
        return resolveExisting(requested, round + 1);
    }

    private WalletTransaction applyToWallet(WalletTransaction transaction) {
        String type = transaction.getType().name();
        Wallet applied;
        try {
            applied = casRetry.execute(context -> attemptApply(transaction));
        } catch (StaleWalletVersionException e) {
            markFailedQuietly(transaction, "version conflict after " + settings.getMaxAttempts() + " attempts");
            metrics.recordMutation(type, "conflict");
            throw new ConcurrentLedgerModificationException(String.format(
                    "Wallet of owner %s kept changing, gave up after %d attempts",
                    transaction.getOwnerId(), settings.getMaxAttempts()));
        } catch (LedgerException e) {
            markFailedQuietly(transaction, e.getMessage());
            metrics.recordMutation(type, e.getErrorCode().name());
            throw e;
        } catch (DataAccessException e) {
            // Outcome unknown: the row stays PENDING until recovery asks the wallet
            metrics.recordMutation(type, "unavailable");
            throw new LedgerUnavailableException(
                    "Wallet store unavailable while applying " + transaction.getIdempotencyKey(), e);
        }

        WalletTransaction completed;
        try {
            completed = journal.markCompleted(transaction.getId(), applied.getId());
        } catch (DataAccessException e) {
            metrics.recordMutation(type, "unavailable");
            throw new LedgerUnavailableException(
                    "Wallet updated but journal not finalized for " + transaction.getIdempotencyKey(), e);
        }
        idempotencyCache.remember(completed.getIdempotencyKey(), completed.getId());
        metrics.recordMutation(type, "completed");
        log.info("Applied {} of {} paise: owner={}, key={}, walletVersion={}",
                type, completed.getAmountPaise(), completed.getOwnerId(),
                completed.getIdempotencyKey(), applied.getVersion());
        return completed;
    }

    private Wallet attemptApply(WalletTransaction transaction) {
        BalanceDelta delta = transaction.getDelta();
        String ownerId = transaction.getOwnerId();

        Wallet wallet = delta.withdrawsFromAnyBalance()
                ? walletStore.findByOwner(ownerId).orElseThrow(() -> new WalletNotFoundException(ownerId))
                : walletStore.ensureWallet(ownerId);

        if (wallet.hasApplied(transaction.getId())) {
            // A reclaimed row whose earlier attempt reached the wallet
            return wallet;
        }

        Wallet next;
        try {
            next = wallet.apply(delta, transaction.getId(), Instant.now());
        } catch (ArithmeticException e) {
            throw BalanceLimitExceededException.overflow(ownerId);
        }
        if (delta.getAvailablePaise() > 0 && next.getAvailablePaise() > settings.getMaxBalancePaise()) {
            throw new BalanceLimitExceededException(ownerId, next.getAvailablePaise(), settings.getMaxBalancePaise());
        }

        return walletStore.compareAndApply(wallet, delta, transaction.getId())
                .orElseThrow(() -> {
                    metrics.recordCasConflict();
                    log.debug("Version {} of wallet {} is stale, retrying", wallet.getVersion(), wallet.getId());
                    return new StaleWalletVersionException();
                });
    }

    private void markFailedQuietly(WalletTransaction transaction, String reason) {
        try {
            journal.markFailed(transaction.getId(), reason);
        } catch (DataAccessException e) {
            // The wallet was not touched, so recovery will fail the row later
            log.warn("Could not mark transaction {} failed: {}", transaction.getId(), e.getMessage());
        }
    }

    // ==================== Helpers ====================

    private WalletTransaction loadReversible(String transactionId) {
        requireText(transactionId, "Transaction id");
        WalletTransaction original = journal.findById(transactionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown transaction " + transactionId));
        if (original.getType() == TransactionType.REVERSAL) {
            throw new IllegalArgumentException("Transaction " + transactionId + " is itself a reversal");
        }
        if (!original.isCompleted()) {
            throw new IllegalStateException(String.format(
                    "Cannot reverse transaction %s in %s status. Only COMPLETED transactions can be reversed.",
                    transactionId, original.getStatus()));
        }
        return original;
    }

    private String walletIdOf(WalletTransaction transaction) {
        if (transaction.getWalletId() != null) {
            return transaction.getWalletId();
        }
        return walletStore.findByOwner(transaction.getOwnerId()).map(Wallet::getId).orElse(null);
    }

    private static void requireSameOperation(WalletTransaction existing, WalletTransaction requested) {
        List<String> differences = existing.differencesFrom(requested);
        if (!differences.isEmpty()) {
            throw new IdempotencyConflictException(existing.getIdempotencyKey(), String.join(", ", differences));
        }
    }

    private static void validate(WalletMutation mutation) {
        requireText(mutation.getOwnerId(), "Owner id");
        requireText(mutation.getIdempotencyKey(), "Idempotency key");
        if (mutation.getType() == null) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        if (mutation.getAmountPaise() <= 0) {
            throw new InvalidAmountException(mutation.getAmountPaise());
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }

    private static WalletMutation mutation(String ownerId, long amountPaise, String idempotencyKey,
                                           TransactionType type, Map<String, Object> metadata) {
        return WalletMutation.builder()
                .ownerId(ownerId)
                .amountPaise(amountPaise)
                .idempotencyKey(idempotencyKey)
                .type(type)
                .metadata(metadata == null ? Map.of() : metadata)
                .build();
    }

    private static WalletMutation payoutMutation(String ownerId, long amountPaise, String idempotencyKey,
                                                 String payoutId, TransactionType type) {
        return WalletMutation.builder()
                .ownerId(ownerId)
                .amountPaise(amountPaise)
                .idempotencyKey(idempotencyKey)
                .type(type)
                .payoutId(payoutId)
                .build();
    }

    /** Compare-and-swap lost to a concurrent writer. */
    static class StaleWalletVersionException extends RuntimeException {
        StaleWalletVersionException() {
            super("stale wallet version", null, false, false);
        }
    }

    /** The row being waited on is still PENDING. */
    static class StillPendingException extends RuntimeException {
        StillPendingException() {
            super("journal row still pending", null, false, false);
        }
    }
}
