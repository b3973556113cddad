package com.flagship.cashback_ledger.settlement;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port for orders. Status changes are compare-and-swap on (status, version)
 * and never apply to frozen or soft-deleted orders.
 */
public interface OrderStore {

    /**
     * Persists a new order, assigning an id when the order has none.
     */
    Order insert(Order order);

    Optional<Order> findById(String orderId);

    /**
     * Moves the order to {@code next}, appends {@code entry} and records
     * {@code pendingEffects} if it is still at {@code expectedStatus} and
     * {@code expectedVersion} and is not frozen.
     *
     * @param pendingEffects Event whose wallet effects are still to be applied, or null for none
     * @return The updated order, or empty if another writer got there first
     */
    Optional<Order> compareAndTransition(String orderId, OrderStatus expectedStatus, long expectedVersion,
                                         OrderStatus next, OrderLogEntry entry, String settlementRef,
                                         OrderEvent pendingEffects);

    /**
     * Clears the pending-effects marker if it still names {@code event}.
     *
     * @return The updated order, or empty if the marker was already cleared or replaced
     */
    Optional<Order> confirmEffects(String orderId, OrderEvent event);

    /**
     * Freezes every live, non-terminal, unfrozen order in which {@code accountId}
     * is the shopper, the mediator or the brand owner.
     *
     * @return Ids of the orders that were frozen
     */
    List<String> freezeOrdersOf(String accountId, String reason, OrderLogEntry entry);

    /**
     * Lifts the freeze of a live, non-terminal order.
     *
     * @return The updated order, or empty if the order is missing, deleted, terminal or not frozen
     */
    Optional<Order> reactivate(String orderId, OrderLogEntry entry);

    /**
     * Stamps {@code deletedAt} and appends {@code entry}.
     *
     * @return The updated order, or empty if it does not exist or is already deleted
     */
    Optional<Order> softDelete(String orderId, OrderLogEntry entry);
}
