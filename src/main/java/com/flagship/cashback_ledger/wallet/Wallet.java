package com.flagship.cashback_ledger.wallet;

import com.flagship.cashback_ledger.common.exception.InsufficientFundsException;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Wallet domain object.
 *
 * Key principles:
 * - Balances are in paise and never negative
 * - Every mutation bumps the version; writers present the version they read
 * - The ids of the last applied journal rows are kept so a crashed operation
 *   can be resolved by asking the wallet whether it was applied
 */
@Value
public class Wallet {

    public static final String DEFAULT_CURRENCY = "INR";
    public static final int RECENT_TRANSACTIONS_KEPT = 100;

    String id;
    String ownerId;
    String currency;
    long availablePaise;
    long pendingPaise;
    long lockedPaise;
    long version;
    List<String> recentTransactionIds;
    Instant createdAt;
    Instant updatedAt;
    Instant deletedAt;

    /**
     * Creates an empty wallet at version 0.
     */
    public static Wallet open(String id, String ownerId, Instant now) {
        return new Wallet(id, ownerId, DEFAULT_CURRENCY, 0, 0, 0, 0, List.of(), now, now, null);
    }

    /**
     * Applies a balance delta, returning the wallet as it will look after the write.
     *
     * @param delta Signed effect on each balance
     * @param transactionId Journal row being applied
     * @param now Mutation time
     * @return New Wallet instance with the next version
     * @throws InsufficientFundsException if any balance would go negative
     * @throws ArithmeticException if any balance would overflow
     */
    public Wallet apply(BalanceDelta delta, String transactionId, Instant now) {
        requireCovered("available", availablePaise, delta.getAvailablePaise());
        requireCovered("pending", pendingPaise, delta.getPendingPaise());
        requireCovered("locked", lockedPaise, delta.getLockedPaise());
        BalanceDelta next = balances().plus(delta);

        List<String> recent = new ArrayList<>(recentTransactionIds);
        recent.add(transactionId);
        if (recent.size() > RECENT_TRANSACTIONS_KEPT) {
            recent = recent.subList(recent.size() - RECENT_TRANSACTIONS_KEPT, recent.size());
        }

        return new Wallet(
                id,
                ownerId,
                currency,
                next.getAvailablePaise(),
                next.getPendingPaise(),
                next.getLockedPaise(),
                version + 1,
                List.copyOf(recent),
                createdAt,
                now,
                deletedAt);
    }

    /**
     * Whether the journal row with this id has already been applied to the balances.
     */
    public boolean hasApplied(String transactionId) {
        return recentTransactionIds.contains(transactionId);
    }

    public BalanceDelta balances() {
        return BalanceDelta.of(availablePaise, pendingPaise, lockedPaise);
    }

    public long totalPaise() {
        return Math.addExact(Math.addExact(availablePaise, pendingPaise), lockedPaise);
    }

    private void requireCovered(String balance, long current, long change) {
        if (change < 0 && current + change < 0) {
            throw new InsufficientFundsException(ownerId, balance, -change, current);
        }
    }
}
