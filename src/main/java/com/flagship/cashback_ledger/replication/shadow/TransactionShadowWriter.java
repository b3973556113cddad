package com.flagship.cashback_ledger.replication.shadow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.cashback_ledger.common.exception.ReplicationFailureException;
import com.flagship.cashback_ledger.replication.ReplicatedEntity;
import com.flagship.cashback_ledger.wallet.WalletTransactionDocument;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Copies journal rows into {@code shadow_transactions}, linking each to its
 * shadow wallet. A row whose wallet has not been replicated yet fails and is
 * retried by the outbox once the wallet task has been delivered.
 */
@Component
public class TransactionShadowWriter extends AbstractJdbcShadowWriter<WalletTransactionDocument> {

    private static final String UPSERT_SQL = """
            INSERT INTO shadow_transactions
                (mongo_id, idempotency_key, wallet_id, wallet_mongo_id, owner_id, type, status, amount_paise,
                 available_delta_paise, pending_delta_paise, locked_delta_paise,
                 order_id, campaign_id, payout_id, from_user_id, to_user_id, reverses_transaction_id,
                 metadata, failure_reason, source_version, created_at, updated_at, synced_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, CURRENT_TIMESTAMP)
            ON CONFLICT (mongo_id) DO UPDATE SET
                status = EXCLUDED.status,
                failure_reason = EXCLUDED.failure_reason,
                metadata = EXCLUDED.metadata,
                source_version = EXCLUDED.source_version,
                updated_at = EXCLUDED.updated_at,
                synced_at = CURRENT_TIMESTAMP
            WHERE shadow_transactions.source_version <= EXCLUDED.source_version
            """;

    public TransactionShadowWriter(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, ShadowIdResolver idResolver) {
        super(ReplicatedEntity.TRANSACTION, jdbcTemplate, objectMapper, idResolver);
    }

    @Override
    public String foreignIdOf(WalletTransactionDocument document) {
        return document.getId();
    }

    @Override
    public long sourceVersionOf(WalletTransactionDocument document) {
        return document.getRevision();
    }

    @Override
    public void upsert(WalletTransactionDocument document) {
        UUID walletId = idResolver.shadowIdOf(ReplicatedEntity.WALLET, document.getWalletId())
                .orElseThrow(() -> new ReplicationFailureException(entity().getLabel(), document.getId(),
                        "wallet " + document.getWalletId() + " not replicated yet"));

        jdbcTemplate.update(UPSERT_SQL,
                document.getId(),
                document.getIdempotencyKey(),
                walletId,
                document.getWalletId(),
                document.getOwnerId(),
                document.getType() == null ? null : document.getType().name(),
                document.getStatus() == null ? null : document.getStatus().name(),
                document.getAmountPaise(),
                document.getAvailableDeltaPaise(),
                document.getPendingDeltaPaise(),
                document.getLockedDeltaPaise(),
                document.getOrderId(),
                document.getCampaignId(),
                document.getPayoutId(),
                document.getFromUserId(),
                document.getToUserId(),
                document.getReversesTransactionId(),
                json(document.getId(), document.getMetadata()),
                document.getFailureReason(),
                document.getRevision(),
                timestamp(document.getCreatedAt()),
                timestamp(document.getUpdatedAt()));
    }
}
