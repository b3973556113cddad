package com.flagship.cashback_ledger.wallet;

import lombok.Value;

import java.time.Duration;

/**
 * Tunables for wallet mutations, bound from {@code ledger.wallet.*}.
 */
@Value
public class WalletSettings {

    /** 1 crore paise. */
    public static final long DEFAULT_MAX_BALANCE_PAISE = 1_00_00_000L;

    int maxAttempts;
    long initialBackoffMs;
    long maxBackoffMs;
    long maxBalancePaise;
    /** How long a pending row may sit before it is treated as abandoned. */
    Duration pendingStaleAfter;

    public static WalletSettings defaults() {
        return new WalletSettings(5, 20, 500, DEFAULT_MAX_BALANCE_PAISE, Duration.ofMinutes(2));
    }
}
