package com.flagship.cashback_ledger.config;

import com.flagship.cashback_ledger.wallet.WalletSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Binds {@code ledger.wallet.*} into the settings used by wallet mutations.
 */
@Configuration
public class LedgerConfig {

    @Bean
    public WalletSettings walletSettings(
            @Value("${ledger.wallet.max-attempts:5}") int maxAttempts,
            @Value("${ledger.wallet.initial-backoff-ms:20}") long initialBackoffMs,
            @Value("${ledger.wallet.max-backoff-ms:500}") long maxBackoffMs,
            @Value("${ledger.wallet.max-balance-paise:10000000}") long maxBalancePaise,
            @Value("${ledger.wallet.pending-stale-after:PT2M}") Duration pendingStaleAfter) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("ledger.wallet.max-attempts must be at least 1");
        }
        return new WalletSettings(maxAttempts, initialBackoffMs, maxBackoffMs, maxBalancePaise, pendingStaleAfter);
    }
}
