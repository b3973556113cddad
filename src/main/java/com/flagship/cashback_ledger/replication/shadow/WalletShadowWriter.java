package com.flagship.cashback_ledger.replication.shadow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.cashback_ledger.replication.ReplicatedEntity;
import com.flagship.cashback_ledger.wallet.WalletDocument;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Copies wallet documents into {@code shadow_wallets}.
 */
@Component
public class WalletShadowWriter extends AbstractJdbcShadowWriter<WalletDocument> {

    private static final String UPSERT_SQL = """
            INSERT INTO shadow_wallets
                (mongo_id, owner_id, currency, available_paise, pending_paise, locked_paise,
                 source_version, created_at, updated_at, deleted_at, synced_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
            ON CONFLICT (mongo_id) DO UPDATE SET
                owner_id = EXCLUDED.owner_id,
                currency = EXCLUDED.currency,
                available_paise = EXCLUDED.available_paise,
                pending_paise = EXCLUDED.pending_paise,
                locked_paise = EXCLUDED.locked_paise,
                source_version = EXCLUDED.source_version,
                updated_at = EXCLUDED.updated_at,
                deleted_at = EXCLUDED.deleted_at,
                synced_at = CURRENT_TIMESTAMP
            WHERE shadow_wallets.source_version <= EXCLUDED.source_version
            """;

    public WalletShadowWriter(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, ShadowIdResolver idResolver) {
        super(ReplicatedEntity.WALLET, jdbcTemplate, objectMapper, idResolver);
    }

    @Override
    public String foreignIdOf(WalletDocument document) {
        return document.getId();
    }

    @Override
    public long sourceVersionOf(WalletDocument document) {
        return document.getVersion();
    }

    @Override
    public void upsert(WalletDocument document) {
        jdbcTemplate.update(UPSERT_SQL,
                document.getId(),
                document.getOwnerId(),
                document.getCurrency(),
                document.getAvailablePaise(),
                document.getPendingPaise(),
                document.getLockedPaise(),
                document.getVersion(),
                timestamp(document.getCreatedAt()),
                timestamp(document.getUpdatedAt()),
                timestamp(document.getDeletedAt()));
    }
}
