package com.flagship.cashback_ledger.api;

import com.flagship.cashback_ledger.common.EntityId;
import com.flagship.cashback_ledger.common.exception.OrderNotFoundException;
import com.flagship.cashback_ledger.observability.CorrelationContext;
import com.flagship.cashback_ledger.replication.ReplicatedEntity;
import com.flagship.cashback_ledger.replication.ReplicationHandle;
import com.flagship.cashback_ledger.replication.ResyncReport;
import com.flagship.cashback_ledger.replication.shadow.ShadowIdResolver;
import com.flagship.cashback_ledger.settlement.CreateOrderCommand;
import com.flagship.cashback_ledger.settlement.Order;
import com.flagship.cashback_ledger.settlement.OrderEvent;
import com.flagship.cashback_ledger.settlement.OrderSettlementService;
import com.flagship.cashback_ledger.wallet.TransactionFilter;
import com.flagship.cashback_ledger.wallet.WalletMutation;
import com.flagship.cashback_ledger.wallet.WalletService;
import com.flagship.cashback_ledger.wallet.WalletTransaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Operations offered to the API layer. Callers pass the already-resolved
 * requester; its account id is recorded as the actor of each change.
 *
 * Ids arriving from clients may be primary-store ids or shadow-store UUIDs
 * and are resolved to primary ids here.
 */
@Service
@Slf4j
public class MarketplaceLedgerApi {

    static final String ACTOR_METADATA_KEY = "actorId";

    private final WalletService walletService;
    private final OrderSettlementService settlementService;
    private final ReplicationHandle replication;
    private final ShadowIdResolver idResolver;

    public MarketplaceLedgerApi(WalletService walletService,
                                OrderSettlementService settlementService,
                                ReplicationHandle replication,
                                ShadowIdResolver idResolver) {
        this.walletService = walletService;
        this.settlementService = settlementService;
        this.replication = replication;
        this.idResolver = idResolver;
    }

    public WalletTransaction applyCredit(RequesterIdentity requester, WalletMutation mutation) {
        return walletService.credit(withActor(requester, mutation));
    }

    public WalletTransaction applyDebit(RequesterIdentity requester, WalletMutation mutation) {
        return walletService.debit(withActor(requester, mutation));
    }

    public Order createOrder(RequesterIdentity requester, CreateOrderCommand command) {
        return settlementService.createOrder(command.toBuilder().actorId(requester.getAccountId()).build());
    }

    /**
     * Applies a workflow event to an order.
     *
     * @param orderId Primary id or shadow UUID of the order
     * @throws OrderNotFoundException if the id resolves to no order
     */
    public Order transitionOrder(RequesterIdentity requester, String orderId, OrderEvent event, Map<String, Object> metadata) {
        String primaryId = resolveOrderId(orderId);
        try (CorrelationContext.Scope ignored = CorrelationContext.forOrder(primaryId)) {
            log.debug("{} requested {} on order {}", requester.getAccountId(), event, primaryId);
            return settlementService.transitionOrder(primaryId, event, requester.getAccountId(), metadata);
        }
    }

    /**
     * Freezes every open order the account takes part in, as shopper, mediator or brand owner.
     *
     * @return Ids of the orders that were frozen
     */
    public List<String> freezeOrdersOf(RequesterIdentity requester, String accountId, String reason) {
        return settlementService.freezeOrdersOf(accountId, reason, requester.getAccountId());
    }

    public Order reactivateOrder(RequesterIdentity requester, String orderId, String reason) {
        String primaryId = resolveOrderId(orderId);
        try (CorrelationContext.Scope ignored = CorrelationContext.forOrder(primaryId)) {
            return settlementService.reactivateOrder(primaryId, reason, requester.getAccountId());
        }
    }

    public Order getOrder(String orderId) {
        return settlementService.getOrder(resolveOrderId(orderId));
    }

    public WalletBalance getWalletBalance(String ownerId) {
        return walletService.getWallet(ownerId)
                .map(WalletBalance::of)
                .orElseGet(() -> WalletBalance.empty(ownerId));
    }

    public List<WalletTransaction> listTransactions(String ownerId, TransactionFilter filter) {
        return walletService.listTransactions(ownerId, filter);
    }

    /**
     * Re-copies documents touched by a bulk update into the shadow store.
     */
    public ResyncReport resyncAfterBulkUpdate(ReplicatedEntity entity, Query filter, int limit) {
        return replication.resyncAfterBulkUpdate(entity, filter, limit);
    }

    private String resolveOrderId(String rawId) {
        EntityId id;
        try {
            id = EntityId.parse(rawId);
        } catch (IllegalArgumentException e) {
            throw new OrderNotFoundException(String.valueOf(rawId));
        }
        return idResolver.resolve(ReplicatedEntity.ORDER, id)
                .orElseThrow(() -> new OrderNotFoundException(id.getValue()));
    }

    private static WalletMutation withActor(RequesterIdentity requester, WalletMutation mutation) {
        if (requester == null || requester.getAccountId() == null) {
            return mutation;
        }
        return mutation.toBuilder().metadataEntry(ACTOR_METADATA_KEY, requester.getAccountId()).build();
    }
}
