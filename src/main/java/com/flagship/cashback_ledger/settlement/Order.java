package com.flagship.cashback_ledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Order domain object.
 *
 * An order is created at purchase time and afterwards changes only through
 * {@link SettlementStateMachine} transitions. It is never hard-deleted.
 * {@code commissionPaise} is owed to the mediator and {@code cashbackPaise}
 * to the shopper; when a brand owner is set, the brand funds both.
 */
@Value
@Builder(toBuilder = true)
public class Order {
    String id;
    OrderStatus status;
    List<OrderItem> items;
    String shopperId;
    String mediatorId;
    String brandOwnerId;
    long commissionPaise;
    long cashbackPaise;
    List<OrderLogEntry> events;
    String settlementRef;
    /** Event whose wallet effects have not been confirmed yet, null when none are outstanding. */
    OrderEvent pendingEffects;
    boolean frozen;
    String frozenReason;
    long version;
    Instant createdAt;
    Instant updatedAt;
    Instant deletedAt;

    public Optional<OrderLogEntry> lastEvent() {
        if (events == null || events.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(events.get(events.size() - 1));
    }

    public boolean hasPendingEffects() {
        return pendingEffects != null;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /**
     * Amount the brand is debited on approval.
     */
    public long brandFundedPaise() {
        return commissionPaise + cashbackPaise;
    }
}
