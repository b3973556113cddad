package com.flagship.cashback_ledger.api;

import com.flagship.cashback_ledger.common.EntityId;
import com.flagship.cashback_ledger.common.exception.OrderFrozenException;
import com.flagship.cashback_ledger.common.exception.OrderNotFoundException;
import com.flagship.cashback_ledger.notification.OrderNotifier;
import com.flagship.cashback_ledger.observability.LedgerMetrics;
import com.flagship.cashback_ledger.replication.ReplicatedEntity;
import com.flagship.cashback_ledger.replication.ReplicationHandle;
import com.flagship.cashback_ledger.replication.ResyncReport;
import com.flagship.cashback_ledger.replication.shadow.ShadowIdResolver;
import com.flagship.cashback_ledger.settlement.CreateOrderCommand;
import com.flagship.cashback_ledger.settlement.Order;
import com.flagship.cashback_ledger.settlement.OrderEvent;
import com.flagship.cashback_ledger.settlement.OrderItem;
import com.flagship.cashback_ledger.settlement.OrderSettlementService;
import com.flagship.cashback_ledger.settlement.OrderStatus;
import com.flagship.cashback_ledger.support.InMemoryOrderStore;
import com.flagship.cashback_ledger.support.InMemoryTransactionJournal;
import com.flagship.cashback_ledger.support.InMemoryWalletStore;
import com.flagship.cashback_ledger.wallet.IdempotencyCache;
import com.flagship.cashback_ledger.wallet.TransactionType;
import com.flagship.cashback_ledger.wallet.WalletMutation;
import com.flagship.cashback_ledger.wallet.WalletService;
import com.flagship.cashback_ledger.wallet.WalletSettings;
import com.flagship.cashback_ledger.wallet.WalletTransaction;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MarketplaceLedgerApiTest {

    private static final RequesterIdentity OPS = RequesterIdentity.of("ops-1", "admin");
    private static final String SHADOW_UUID = "3f2504e0-4f89-11d3-9a0c-0305e82c3301";

    private ReplicationHandle replication;
    private ShadowIdResolver idResolver;
    private MarketplaceLedgerApi api;

    @BeforeEach
    void setUp() {
        WalletSettings settings = new WalletSettings(5, 1, 5, WalletSettings.DEFAULT_MAX_BALANCE_PAISE, Duration.ofMinutes(2));
        LedgerMetrics metrics = new LedgerMetrics(new SimpleMeterRegistry());
        WalletService walletService = new WalletService(new InMemoryWalletStore(), new InMemoryTransactionJournal(),
                IdempotencyCache.disabled(), metrics, settings);
        OrderSettlementService settlementService = new OrderSettlementService(new InMemoryOrderStore(), walletService,
                mock(OrderNotifier.class), metrics, settings);

        replication = mock(ReplicationHandle.class);
        idResolver = mock(ShadowIdResolver.class);
        when(idResolver.resolve(eq(ReplicatedEntity.ORDER), any(EntityId.class))).thenAnswer(inv -> {
            EntityId id = inv.getArgument(1);
            return id.isNative() ? Optional.empty() : Optional.of(id.getValue());
        });
        api = new MarketplaceLedgerApi(walletService, settlementService, replication, idResolver);
    }

    private Order newOrder() {
        return api.createOrder(OPS, CreateOrderCommand.builder()
                .shopperId("shopper-1")
                .mediatorId("mediator-1")
                .item(new OrderItem("sku-1", "Kettle", 2_500, 100, 1, null))
                .commissionPaise(100)
                .cashbackPaise(200)
                .actorId("spoofed")
                .build());
    }

    @Test
    @DisplayName("Wallet mutations record the requester as actor")
    void testApplyCredit_RecordsActor() {
        WalletTransaction tx = api.applyCredit(OPS, WalletMutation.builder()
                .ownerId("brand-1").amountPaise(5_000).idempotencyKey("topup-1")
                .type(TransactionType.BRAND_DEPOSIT).metadataEntry("channel", "upi").build());

        assertEquals("ops-1", tx.getMetadata().get(MarketplaceLedgerApi.ACTOR_METADATA_KEY));
        assertEquals("upi", tx.getMetadata().get("channel"));
        assertEquals(5_000, api.getWalletBalance("brand-1").getAvailablePaise());
    }

    @Test
    @DisplayName("Debits go through the same actor stamping")
    void testApplyDebit() {
        api.applyCredit(OPS, WalletMutation.builder().ownerId("brand-1").amountPaise(5_000)
                .idempotencyKey("topup-1").type(TransactionType.BRAND_DEPOSIT).build());

        WalletTransaction fee = api.applyDebit(OPS, WalletMutation.builder().ownerId("brand-1").amountPaise(500)
                .idempotencyKey("fee-1").type(TransactionType.PLATFORM_FEE).build());

        assertEquals("ops-1", fee.getMetadata().get(MarketplaceLedgerApi.ACTOR_METADATA_KEY));
        assertEquals(4_500, api.getWalletBalance("brand-1").getTotalPaise());
        assertEquals(2, api.listTransactions("brand-1", null).size());
    }

    @Test
    @DisplayName("Owners without a wallet read as zero")
    void testGetWalletBalance_NoWallet() {
        WalletBalance balance = api.getWalletBalance("nobody");

        assertEquals(0, balance.getTotalPaise());
        assertEquals("INR", balance.getCurrency());
    }

    @Test
    @DisplayName("Orders are created and moved on behalf of the requester")
    void testOrderActorIsRequester() {
        Order order = newOrder();
        assertEquals("ops-1", order.getEvents().get(0).getActorId());

        Order moved = api.transitionOrder(OPS, order.getId(), OrderEvent.PROOF_SUBMITTED, Map.of("proof", "img-1"));

        assertEquals(OrderStatus.UNDER_REVIEW, moved.getStatus());
        assertEquals("ops-1", moved.lastEvent().orElseThrow().getActorId());
        assertEquals("img-1", moved.lastEvent().orElseThrow().getMetadata().get("proof"));
        assertEquals(moved, api.getOrder(order.getId()));
    }

    @Test
    @DisplayName("Shadow UUIDs resolve through the shadow store and unknown ones are not found")
    void testTransitionOrder_UnknownIds() {
        assertThrows(OrderNotFoundException.class,
                () -> api.transitionOrder(OPS, SHADOW_UUID, OrderEvent.PROOF_SUBMITTED, Map.of()));
        assertThrows(OrderNotFoundException.class,
                () -> api.transitionOrder(OPS, " ", OrderEvent.PROOF_SUBMITTED, Map.of()));
        assertThrows(OrderNotFoundException.class, () -> api.getOrder("order-404"));
    }

    @Test
    @DisplayName("Shadow UUID of an existing order reaches the order")
    void testTransitionOrder_ShadowUuid() {
        Order order = newOrder();
        when(idResolver.resolve(ReplicatedEntity.ORDER, EntityId.parse(SHADOW_UUID))).thenReturn(Optional.of(order.getId()));

        Order moved = api.transitionOrder(OPS, SHADOW_UUID, OrderEvent.REJECTED, Map.of());

        assertEquals(OrderStatus.REJECTED, moved.getStatus());
    }

    @Test
    @DisplayName("Freezing an account holds its orders until one is reactivated")
    void testFreezeAndReactivate() {
        Order order = newOrder();

        assertEquals(List.of(order.getId()), api.freezeOrdersOf(OPS, "mediator-1", "chargeback"));
        assertThrows(OrderFrozenException.class,
                () -> api.transitionOrder(OPS, order.getId(), OrderEvent.PROOF_SUBMITTED, Map.of()));

        Order reactivated = api.reactivateOrder(OPS, order.getId(), "cleared");

        assertFalse(reactivated.isFrozen());
        assertEquals("ops-1", reactivated.lastEvent().orElseThrow().getActorId());
        assertEquals(OrderStatus.UNDER_REVIEW,
                api.transitionOrder(OPS, order.getId(), OrderEvent.PROOF_SUBMITTED, Map.of()).getStatus());
    }

    @Test
    @DisplayName("Bulk resync is delegated to the replication handle")
    void testResyncDelegates() {
        Query filter = new Query();
        ResyncReport report = new ResyncReport(ReplicatedEntity.ORDER, 2, 2, 0, false);
        when(replication.resyncAfterBulkUpdate(ReplicatedEntity.ORDER, filter, 100)).thenReturn(report);

        assertSame(report, api.resyncAfterBulkUpdate(ReplicatedEntity.ORDER, filter, 100));
    }

    @Test
    @DisplayName("Requester roles are checked by name")
    void testRequesterRoles() {
        assertTrue(OPS.hasRole("admin"));
        assertFalse(OPS.hasRole("shopper"));
        assertTrue(RequesterIdentity.system().hasRole("system"));
    }
}
