package com.flagship.cashback_ledger.settlement;

import com.flagship.cashback_ledger.common.exception.ConcurrentLedgerModificationException;
import com.flagship.cashback_ledger.common.exception.InsufficientFundsException;
import com.flagship.cashback_ledger.common.exception.InvalidTransitionException;
import com.flagship.cashback_ledger.common.exception.OrderFrozenException;
import com.flagship.cashback_ledger.common.exception.OrderNotFoundException;
import com.flagship.cashback_ledger.common.exception.WalletNotFoundException;
import com.flagship.cashback_ledger.notification.OrderNotifier;
import com.flagship.cashback_ledger.observability.CorrelationContext;
import com.flagship.cashback_ledger.observability.LedgerMetrics;
import com.flagship.cashback_ledger.wallet.TransactionStatus;
import com.flagship.cashback_ledger.wallet.TransactionType;
import com.flagship.cashback_ledger.wallet.WalletMutation;
import com.flagship.cashback_ledger.wallet.WalletService;
import com.flagship.cashback_ledger.wallet.WalletSettings;
import com.flagship.cashback_ledger.wallet.WalletTransaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives orders through the settlement workflow and applies the wallet
 * effects of each transition.
 *
 * Transition protocol:
 * 1. Look up the target status in {@link SettlementStateMachine}; unknown pairs fail with nothing changed
 * 2. Compare-and-swap the order on (status, version), appending the log entry and
 *    marking the event's wallet effects as pending
 * 3. Apply the wallet effects under deterministic idempotency keys
 * 4. Clear the pending-effects marker
 *
 * While the marker is set the order refuses every forward event. Resending the
 * marked event re-applies its effects (keys make this a no-op for the parts
 * already done) and clears the marker; REJECTED and FAILED are still accepted
 * from non-terminal statuses and release whatever the interrupted transition
 * had already moved. Frozen orders refuse every event until reactivated.
 *
 * Wallet effects:
 * - REVIEW_APPROVED: debit the brand (if set), lock commission for the mediator and cashback for the shopper
 * - PAYOUT_PROCESSED: move each payee's locked amount from pending to available
 * - REJECTED / FAILED: reverse every completed lock whose settle did not happen, refund the brand
 */
@Service
@Slf4j
public class OrderSettlementService {

    private final OrderStore orderStore;
    private final WalletService walletService;
    private final OrderNotifier notifier;
    private final LedgerMetrics metrics;
    private final int maxAttempts;

    public OrderSettlementService(OrderStore orderStore,
                                  WalletService walletService,
                                  OrderNotifier notifier,
                                  LedgerMetrics metrics,
                                  WalletSettings settings) {
        this.orderStore = orderStore;
        this.walletService = walletService;
        this.notifier = notifier;
        this.metrics = metrics;
        this.maxAttempts = settings.getMaxAttempts();
    }

    /**
     * Creates an order in ORDERED status.
     */
    public Order createOrder(CreateOrderCommand command) {
        requireText(command.getShopperId(), "Shopper id");
        requireText(command.getMediatorId(), "Mediator id");
        if (command.getItems() == null || command.getItems().isEmpty()) {
            throw new IllegalArgumentException("Order must have at least one item");
        }
        if (command.getCommissionPaise() < 0 || command.getCashbackPaise() < 0) {
            throw new IllegalArgumentException("Commission and cashback cannot be negative");
        }

        Instant now = Instant.now();
        Order order = Order.builder()
                .status(OrderStatus.ORDERED)
                .items(List.copyOf(command.getItems()))
                .shopperId(command.getShopperId())
                .mediatorId(command.getMediatorId())
                .brandOwnerId(command.getBrandOwnerId())
                .commissionPaise(command.getCommissionPaise())
                .cashbackPaise(command.getCashbackPaise())
                .events(List.of(OrderLogEntry.created(command.getActorId(), now)))
                .version(0)
                .createdAt(now)
                .updatedAt(now)
                .build();

        Order created = orderStore.insert(order);
        log.info("Created order {}: shopper={}, mediator={}, commission={}, cashback={}",
                created.getId(), created.getShopperId(), created.getMediatorId(),
                created.getCommissionPaise(), created.getCashbackPaise());
        return created;
    }

    /**
     * @throws OrderNotFoundException if the order does not exist or was soft-deleted
     */
    public Order getOrder(String orderId) {
        requireText(orderId, "Order id");
        return orderStore.findById(orderId)
                .filter(order -> !order.isDeleted())
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    /**
     * Applies an event to an order.
     *
     * @param orderId Order to move
     * @param event Workflow event
     * @param actorId Who triggered it, recorded in the event log
     * @param metadata Free-form context recorded in the event log
     * @return The order after the transition
     * @throws InvalidTransitionException if the event is not allowed from the current status,
     *         or the previous transition's wallet effects are still pending
     * @throws OrderFrozenException if the order is frozen
     * @throws OrderNotFoundException if the order does not exist or was soft-deleted
     * @throws ConcurrentLedgerModificationException if the order kept changing underneath
     */
    public Order transitionOrder(String orderId, OrderEvent event, String actorId, Map<String, Object> metadata) {
        requireText(orderId, "Order id");
        if (event == null) {
            throw new IllegalArgumentException("Event is required");
        }

        try (CorrelationContext.Scope ignored = CorrelationContext.forOrder(orderId)) {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                Order order = getOrder(orderId);
                if (order.isFrozen()) {
                    metrics.recordTransition(order.getStatus().name(), event.name(), "frozen");
                    throw new OrderFrozenException(orderId, order.getFrozenReason());
                }
                OrderStatus from = order.getStatus();

                if (order.getPendingEffects() == event) {
                    return completePendingEffects(order);
                }

                Optional<OrderStatus> target = SettlementStateMachine.next(from, event);
                if (target.isEmpty()) {
                    metrics.recordTransition(from.name(), event.name(), "invalid");
                    throw new InvalidTransitionException(orderId, from.name(), event.name());
                }
                if (order.hasPendingEffects() && !event.releasesFunds()) {
                    metrics.recordTransition(from.name(), event.name(), "held");
                    throw new InvalidTransitionException(orderId, from.name(), event.name(), String.format(
                            "Order %s cannot handle %s until the wallet effects of %s are applied; resend %s",
                            orderId, event, order.getPendingEffects(), order.getPendingEffects()));
                }

                if (event == OrderEvent.REVIEW_APPROVED) {
                    requireBrandFunds(order);
                }

                OrderStatus to = target.get();
                Instant now = Instant.now();
                OrderLogEntry entry = OrderLogEntry.transition(event, from, to, actorId, metadata, now);
                String settlementRef = event == OrderEvent.PAYOUT_PROCESSED ? orderId + ":" + event.getKeyword() : null;
                OrderEvent pendingEffects = event.hasWalletEffects() ? event : null;

                Optional<Order> updated = orderStore.compareAndTransition(
                        orderId, from, order.getVersion(), to, entry, settlementRef, pendingEffects);
                if (updated.isEmpty()) {
                    log.debug("Order {} changed during {} (attempt {}), re-reading", orderId, event, attempt);
                    continue;
                }

                Order moved = updated.get();
                log.info("Order {} moved {} -> {} on {} by {}", orderId, from, to, event, actorId);
                metrics.recordTransition(from.name(), to.name(), "applied");
                if (pendingEffects == null) {
                    return moved;
                }
                return applyAndConfirm(moved, event);
            }
            throw new ConcurrentLedgerModificationException(
                    "Order " + orderId + " kept changing, gave up after " + maxAttempts + " attempts");
        }
    }

    /**
     * Freezes every open order the account takes part in, for example when the account is suspended.
     * Frozen orders stay frozen until {@link #reactivateOrder} is called for each of them.
     *
     * @return Ids of the orders that were frozen
     */
    public List<String> freezeOrdersOf(String accountId, String reason, String actorId) {
        requireText(accountId, "Account id");
        requireText(reason, "Freeze reason");
        List<String> frozen = orderStore.freezeOrdersOf(accountId, reason,
                OrderLogEntry.frozen(reason, actorId, Instant.now()));
        log.info("Froze {} orders of account {}: reason={}, actor={}", frozen.size(), accountId, reason, actorId);
        return frozen;
    }

    /**
     * Lifts the freeze of an order so that it accepts events again.
     *
     * @throws InvalidTransitionException if the order is not frozen or already terminal
     * @throws OrderNotFoundException if the order does not exist or was soft-deleted
     */
    public Order reactivateOrder(String orderId, String reason, String actorId) {
        Order order = getOrder(orderId);
        Order reactivated = orderStore.reactivate(orderId,
                        OrderLogEntry.reactivated(order.getStatus(), reason, actorId, Instant.now()))
                .orElseThrow(() -> new InvalidTransitionException(orderId, order.getStatus().name(),
                        OrderLogEntry.REACTIVATED,
                        String.format("Order %s is not frozen or is already %s", orderId, order.getStatus())));
        log.info("Reactivated order {} in status {} by {}", orderId, reactivated.getStatus(), actorId);
        return reactivated;
    }

    /**
     * Soft-deletes an order. Its wallet effects are left as they are.
     */
    public Order softDelete(String orderId, String actorId) {
        Order order = getOrder(orderId);
        Order deleted = orderStore.softDelete(orderId, OrderLogEntry.deleted(order.getStatus(), actorId, Instant.now()))
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        log.info("Soft-deleted order {} in status {} by {}", orderId, deleted.getStatus(), actorId);
        return deleted;
    }

    // ==================== Wallet effects ====================

    private Order completePendingEffects(Order order) {
        OrderEvent event = order.getPendingEffects();
        log.info("Order {} has unconfirmed {} effects, applying them", order.getId(), event);
        return applyAndConfirm(order, event);
    }

    private Order applyAndConfirm(Order order, OrderEvent event) {
        try {
            applyEffects(order, event);
        } catch (RuntimeException e) {
            metrics.recordTransition(order.getStatus().name(), event.name(), "effects_pending");
            log.warn("Order {} is {} but the wallet effects of {} are incomplete, resend {} to finish them: {}",
                    order.getId(), order.getStatus(), event, event, e.getMessage());
            throw e;
        }

        Optional<Order> confirmed = orderStore.confirmEffects(order.getId(), event);
        if (confirmed.isEmpty()) {
            // Another caller confirmed them, or a release replaced the marker
            return getOrder(order.getId());
        }
        Order done = confirmed.get();
        if (done.getStatus().isTerminal()) {
            notifyParties(done, event);
        }
        return done;
    }

    private void applyEffects(Order order, OrderEvent event) {
        if (event.releasesFunds()) {
            releaseFunds(order, event);
        } else if (event == OrderEvent.REVIEW_APPROVED) {
            lockFunds(order);
        } else if (event == OrderEvent.PAYOUT_PROCESSED) {
            settleFunds(order);
        }
    }

    private void lockFunds(Order order) {
        String orderId = order.getId();
        long brandAmount = SettlementLeg.BRAND.amountOf(order);
        if (brandAmount > 0) {
            walletService.debit(legMutation(order, SettlementLeg.BRAND, OrderEvent.REVIEW_APPROVED,
                    TransactionType.ORDER_SETTLEMENT_DEBIT, brandAmount));
        }
        for (SettlementLeg leg : SettlementLeg.payees()) {
            long amount = leg.amountOf(order);
            if (amount > 0) {
                walletService.credit(legMutation(order, leg, OrderEvent.REVIEW_APPROVED, leg.getLockType(), amount));
            }
        }

        // A rejection that raced this approval may have run before these locks existed
        Order current = orderStore.findById(orderId).orElse(order);
        if (current.getStatus() == OrderStatus.REJECTED || current.getStatus() == OrderStatus.FAILED) {
            OrderEvent terminal = current.getStatus() == OrderStatus.REJECTED ? OrderEvent.REJECTED : OrderEvent.FAILED;
            log.warn("Order {} became {} while funds were being locked, releasing them", orderId, current.getStatus());
            releaseFunds(current, terminal);
            orderStore.confirmEffects(orderId, terminal);
        }
    }

    /**
     * Fails fast, before the order moves, when the brand cannot fund the order.
     * The debit itself still re-checks under compare-and-swap.
     */
    private void requireBrandFunds(Order order) {
        long amount = SettlementLeg.BRAND.amountOf(order);
        if (amount <= 0) {
            return;
        }
        String brandId = order.getBrandOwnerId();
        long available = walletService.getWallet(brandId)
                .orElseThrow(() -> new WalletNotFoundException(brandId))
                .getAvailablePaise();
        if (available < amount) {
            throw new InsufficientFundsException(brandId, "available", amount, available);
        }
    }

    private void settleFunds(Order order) {
        for (SettlementLeg leg : SettlementLeg.payees()) {
            long amount = leg.amountOf(order);
            if (amount > 0) {
                walletService.moveLockedToAvailable(
                        legMutation(order, leg, OrderEvent.PAYOUT_PROCESSED, leg.getSettleType(), amount));
            }
        }
    }

    /**
     * Reverses the locks that were not settled and returns to the brand what it
     * paid for them. Refuses to guess while a row of this order is still in flight.
     */
    private void releaseFunds(Order order, OrderEvent event) {
        String orderId = order.getId();
        long settledPaise = 0;
        for (SettlementLeg leg : SettlementLeg.payees()) {
            Optional<WalletTransaction> lock = finished(leg.keyFor(orderId, OrderEvent.REVIEW_APPROVED));
            if (lock.isEmpty()) {
                continue;
            }
            if (finished(leg.keyFor(orderId, OrderEvent.PAYOUT_PROCESSED)).isPresent()) {
                log.warn("Order {}: {} share already settled, leaving it in place", orderId, leg.getKeyword());
                settledPaise += lock.get().getAmountPaise();
                continue;
            }
            walletService.reverse(lock.get().getId(), leg.keyFor(orderId, event));
        }

        Optional<WalletTransaction> brandDebit = finished(SettlementLeg.BRAND.keyFor(orderId, OrderEvent.REVIEW_APPROVED));
        if (brandDebit.isEmpty()) {
            return;
        }
        String refundKey = SettlementLeg.BRAND.keyFor(orderId, event);
        if (settledPaise == 0) {
            walletService.reverse(brandDebit.get().getId(), refundKey);
            return;
        }
        long refundPaise = brandDebit.get().getAmountPaise() - settledPaise;
        if (refundPaise > 0) {
            walletService.credit(legMutation(order, SettlementLeg.BRAND, event, TransactionType.REFUND, refundPaise));
        }
    }

    /**
     * The completed row under {@code idempotencyKey}, if any.
     *
     * @throws ConcurrentLedgerModificationException if the row is still pending
     */
    private Optional<WalletTransaction> finished(String idempotencyKey) {
        Optional<WalletTransaction> row = walletService.findTransactionByKey(idempotencyKey);
        if (row.isPresent() && row.get().getStatus() == TransactionStatus.PENDING) {
            throw new ConcurrentLedgerModificationException(
                    "Wallet operation " + idempotencyKey + " is still in progress, resend once it has settled");
        }
        return row.filter(WalletTransaction::isCompleted);
    }

    private static WalletMutation legMutation(Order order, SettlementLeg leg, OrderEvent event,
                                              TransactionType type, long amount) {
        boolean brandPays = order.getBrandOwnerId() != null && leg != SettlementLeg.BRAND;
        return WalletMutation.builder()
                .ownerId(leg.accountOf(order))
                .amountPaise(amount)
                .idempotencyKey(leg.keyFor(order.getId(), event))
                .type(type)
                .orderId(order.getId())
                .campaignId(firstCampaign(order))
                .fromUserId(brandPays ? order.getBrandOwnerId() : null)
                .toUserId(leg == SettlementLeg.BRAND ? null : leg.accountOf(order))
                .metadataEntry("event", event.name())
                .metadataEntry("leg", leg.getKeyword())
                .build();
    }

    private static String firstCampaign(Order order) {
        return order.getItems().stream()
                .map(OrderItem::getCampaignId)
                .filter(id -> id != null && !id.isBlank())
                .findFirst()
                .orElse(null);
    }

    // ==================== Notifications ====================

    private void notifyParties(Order order, OrderEvent event) {
        Set<String> recipients = new LinkedHashSet<>();
        recipients.add(order.getShopperId());
        recipients.add(order.getMediatorId());
        if (order.getBrandOwnerId() != null) {
            recipients.add(order.getBrandOwnerId());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("orderId", order.getId());
        payload.put("status", order.getStatus().name());
        payload.put("event", event.name());
        payload.put("commissionPaise", order.getCommissionPaise());
        payload.put("cashbackPaise", order.getCashbackPaise());

        String notification = "ORDER_" + order.getStatus().name();
        for (String accountId : recipients) {
            try {
                notifier.notify(accountId, notification, payload);
            } catch (Exception e) {
                log.warn("Notification {} for order {} to {} failed: {}",
                        notification, order.getId(), accountId, e.getMessage());
            }
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
