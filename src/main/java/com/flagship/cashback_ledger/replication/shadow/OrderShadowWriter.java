package com.flagship.cashback_ledger.replication.shadow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.cashback_ledger.common.exception.ReplicationFailureException;
import com.flagship.cashback_ledger.replication.ReplicatedEntity;
import com.flagship.cashback_ledger.settlement.OrderDocument;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Copies orders into {@code shadow_orders} and their append-only event log
 * into {@code shadow_order_events}, one row per log position.
 */
@Component
public class OrderShadowWriter extends AbstractJdbcShadowWriter<OrderDocument> {

    private static final String UPSERT_SQL = """
            INSERT INTO shadow_orders
                (mongo_id, status, shopper_id, mediator_id, brand_owner_id, commission_paise, cashback_paise,
                 items, settlement_ref, pending_effects, frozen, frozen_reason,
                 source_version, created_at, updated_at, deleted_at, synced_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
            ON CONFLICT (mongo_id) DO UPDATE SET
                status = EXCLUDED.status,
                items = EXCLUDED.items,
                settlement_ref = EXCLUDED.settlement_ref,
                pending_effects = EXCLUDED.pending_effects,
                frozen = EXCLUDED.frozen,
                frozen_reason = EXCLUDED.frozen_reason,
                source_version = EXCLUDED.source_version,
                updated_at = EXCLUDED.updated_at,
                deleted_at = EXCLUDED.deleted_at,
                synced_at = CURRENT_TIMESTAMP
            WHERE shadow_orders.source_version <= EXCLUDED.source_version
            """;

    private static final String INSERT_EVENT_SQL = """
            INSERT INTO shadow_order_events
                (order_id, seq, type, from_status, to_status, actor_id, metadata, occurred_at)
            VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (order_id, seq) DO NOTHING
            """;

    public OrderShadowWriter(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, ShadowIdResolver idResolver) {
        super(ReplicatedEntity.ORDER, jdbcTemplate, objectMapper, idResolver);
    }

    @Override
    public String foreignIdOf(OrderDocument document) {
        return document.getId();
    }

    @Override
    public long sourceVersionOf(OrderDocument document) {
        return document.getVersion();
    }

    @Override
    @Transactional
    public void upsert(OrderDocument document) {
        jdbcTemplate.update(UPSERT_SQL,
                document.getId(),
                document.getStatus() == null ? null : document.getStatus().name(),
                document.getShopperId(),
                document.getMediatorId(),
                document.getBrandOwnerId(),
                document.getCommissionPaise(),
                document.getCashbackPaise(),
                json(document.getId(), document.getItems()),
                document.getSettlementRef(),
                document.getPendingEffects() == null ? null : document.getPendingEffects().name(),
                document.isFrozen(),
                document.getFrozenReason(),
                document.getVersion(),
                timestamp(document.getCreatedAt()),
                timestamp(document.getUpdatedAt()),
                timestamp(document.getDeletedAt()));

        List<OrderDocument.Event> events = document.getEvents();
        if (events == null || events.isEmpty()) {
            return;
        }
        UUID orderId = idResolver.shadowIdOf(ReplicatedEntity.ORDER, document.getId())
                .orElseThrow(() -> new ReplicationFailureException(entity().getLabel(), document.getId(),
                        "shadow order row missing after upsert"));
        for (int seq = 0; seq < events.size(); seq++) {
            OrderDocument.Event event = events.get(seq);
            jdbcTemplate.update(INSERT_EVENT_SQL,
                    orderId,
                    seq,
                    event.getType(),
                    event.getFromStatus() == null ? null : event.getFromStatus().name(),
                    event.getToStatus() == null ? null : event.getToStatus().name(),
                    event.getActorId(),
                    json(document.getId(), event.getMetadata()),
                    timestamp(event.getAt()));
        }
    }
}
