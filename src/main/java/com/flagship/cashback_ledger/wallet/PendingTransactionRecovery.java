package com.flagship.cashback_ledger.wallet;

import com.flagship.cashback_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Background job that finalizes journal rows a crashed caller left PENDING.
 *
 * A row older than {@code ledger.wallet.pending-stale-after} is completed when
 * its owner's wallet lists the row id among the applied transactions, and
 * failed otherwise. Either way no balance is touched here.
 */
@Component
@ConditionalOnProperty(name = "ledger.recovery.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PendingTransactionRecovery {

    private final TransactionJournal journal;
    private final WalletService walletService;
    private final WalletSettings settings;

    @Value("${ledger.recovery.batch-size:100}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${ledger.recovery.interval-ms:30000}")
    public void recoverAbandoned() {
        try (CorrelationContext.Scope ignored = CorrelationContext.open()) {
            int resolved = runOnce();
            if (resolved > 0) {
                log.info("Resolved {} abandoned pending transactions", resolved);
            }
        } catch (Exception e) {
            log.error("Error in pending transaction recovery loop", e);
        }
    }

    /**
     * Resolves one batch of abandoned rows.
     *
     * @return Number of rows resolved
     */
    public int runOnce() {
        Instant cutoff = Instant.now().minus(settings.getPendingStaleAfter());
        List<WalletTransaction> abandoned = journal.findPendingCreatedBefore(cutoff, batchSize);
        int resolved = 0;
        for (WalletTransaction pending : abandoned) {
            try {
                walletService.recoverPending(pending);
                resolved++;
            } catch (Exception e) {
                log.error("Failed to recover pending transaction: id={}, key={}, error={}",
                        pending.getId(), pending.getIdempotencyKey(), e.getMessage());
            }
        }
        return resolved;
    }
}
