package com.flagship.cashback_ledger.wallet;

import java.util.Optional;

/**
 * Persistence port for wallet balances.
 *
 * The only balance write is {@link #compareAndApply}, a single atomic
 * compare-and-swap on the wallet version.
 */
public interface WalletStore {

    Optional<Wallet> findByOwner(String ownerId);

    /**
     * Returns the owner's wallet, creating an empty one if none exists.
     * Safe under concurrent calls for the same owner.
     */
    Wallet ensureWallet(String ownerId);

    /**
     * Applies the delta if the stored wallet still has {@code expected.getVersion()}
     * and every resulting balance is non-negative. Records the transaction id on
     * the wallet in the same write.
     *
     * @return The updated wallet, or empty if the version no longer matches
     */
    Optional<Wallet> compareAndApply(Wallet expected, BalanceDelta delta, String transactionId);
}
