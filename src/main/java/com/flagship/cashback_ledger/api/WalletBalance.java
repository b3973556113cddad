package com.flagship.cashback_ledger.api;

import com.flagship.cashback_ledger.wallet.Wallet;
import lombok.Value;

/**
 * Read model of one owner's balances. Owners without a wallet read as zero.
 */
@Value
public class WalletBalance {
    String ownerId;
    String currency;
    long availablePaise;
    long pendingPaise;
    long lockedPaise;
    long version;

    public static WalletBalance of(Wallet wallet) {
        return new WalletBalance(wallet.getOwnerId(), wallet.getCurrency(),
                wallet.getAvailablePaise(), wallet.getPendingPaise(), wallet.getLockedPaise(), wallet.getVersion());
    }

    public static WalletBalance empty(String ownerId) {
        return new WalletBalance(ownerId, Wallet.DEFAULT_CURRENCY, 0, 0, 0, 0);
    }

    public long getTotalPaise() {
        return availablePaise + pendingPaise + lockedPaise;
    }
}
