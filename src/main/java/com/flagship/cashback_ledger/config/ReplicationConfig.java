package com.flagship.cashback_ledger.config;

import com.flagship.cashback_ledger.replication.DualWriteReplicator;
import com.flagship.cashback_ledger.replication.ReconciliationJob.ReconciliationSettings;
import com.flagship.cashback_ledger.replication.ReplicatedEntity;
import com.flagship.cashback_ledger.replication.ReplicationHandle;
import com.flagship.cashback_ledger.replication.ReplicationRegistration;
import com.flagship.cashback_ledger.replication.ReplicationSettings;
import com.flagship.cashback_ledger.replication.shadow.OrderShadowWriter;
import com.flagship.cashback_ledger.replication.shadow.TransactionShadowWriter;
import com.flagship.cashback_ledger.replication.shadow.WalletShadowWriter;
import com.flagship.cashback_ledger.settlement.OrderDocument;
import com.flagship.cashback_ledger.wallet.WalletDocument;
import com.flagship.cashback_ledger.wallet.WalletTransactionDocument;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Registers the shadow writers once and exposes the resulting handle as the
 * write hooks of the Mongo stores.
 */
@Configuration
public class ReplicationConfig {

    @Bean
    public ReplicationSettings replicationSettings(
            @Value("${replication.enabled:true}") boolean enabled,
            @Value("${replication.max-retries:8}") int maxRetries,
            @Value("${replication.lease:PT30S}") Duration lease) {
        return new ReplicationSettings(enabled, maxRetries, lease);
    }

    @Bean
    public ReconciliationSettings reconciliationSettings(
            @Value("${reconciliation.page-size:200}") int pageSize,
            @Value("${reconciliation.max-documents-per-run:50000}") long maxDocumentsPerRun,
            @Value("${reconciliation.overlap:PT5M}") Duration overlap) {
        return new ReconciliationSettings(pageSize, maxDocumentsPerRun, overlap);
    }

    @Bean
    public ReplicationHandle replicationHandle(DualWriteReplicator replicator,
                                               ReplicationSettings settings,
                                               WalletShadowWriter walletWriter,
                                               TransactionShadowWriter transactionWriter,
                                               OrderShadowWriter orderWriter) {
        // Wallets first: transaction rows reference the shadow wallet
        return replicator.initialize(List.of(
                ReplicationRegistration.of(ReplicatedEntity.WALLET, WalletDocument.class, walletWriter),
                ReplicationRegistration.of(ReplicatedEntity.TRANSACTION, WalletTransactionDocument.class, transactionWriter),
                ReplicationRegistration.of(ReplicatedEntity.ORDER, OrderDocument.class, orderWriter)
        ), settings);
    }
}
