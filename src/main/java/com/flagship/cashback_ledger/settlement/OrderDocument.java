package com.flagship.cashback_ledger.settlement;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Mongo mapping of {@link Order}; items and the event log are embedded.
 */
@Document(collection = "orders")
@Getter
@Setter
@NoArgsConstructor
public class OrderDocument {

    static final String STATUS = "status";
    static final String VERSION = "version";
    static final String EVENTS = "events";
    static final String SETTLEMENT_REF = "settlementRef";
    static final String PENDING_EFFECTS = "pendingEffects";
    static final String FROZEN = "frozen";
    static final String FROZEN_AT = "frozenAt";
    static final String FROZEN_REASON = "frozenReason";
    static final String REACTIVATED_AT = "reactivatedAt";
    static final String SHOPPER_ID = "shopperId";
    static final String MEDIATOR_ID = "mediatorId";
    static final String BRAND_OWNER_ID = "brandOwnerId";
    static final String DELETED_AT = "deletedAt";
    static final String UPDATED_AT = "updatedAt";

    @Id
    private String id;

    @Indexed
    private OrderStatus status;

    private List<Item> items = new ArrayList<>();

    @Indexed
    private String shopperId;

    @Indexed
    private String mediatorId;

    @Indexed
    private String brandOwnerId;

    private long commissionPaise;
    private long cashbackPaise;
    private List<Event> events = new ArrayList<>();
    private String settlementRef;
    private OrderEvent pendingEffects;

    @Indexed
    private boolean frozen;

    private Instant frozenAt;
    private String frozenReason;
    private Instant reactivatedAt;
    private long version;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant deletedAt;

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Item {
        private String productId;
        private String title;
        private long pricePaise;
        private long commissionPaise;
        private int quantity;
        private String campaignId;

        static Item fromDomain(OrderItem item) {
            Item doc = new Item();
            doc.productId = item.getProductId();
            doc.title = item.getTitle();
            doc.pricePaise = item.getPricePaise();
            doc.commissionPaise = item.getCommissionPaise();
            doc.quantity = item.getQuantity();
            doc.campaignId = item.getCampaignId();
            return doc;
        }

        OrderItem toDomain() {
            return new OrderItem(productId, title, pricePaise, commissionPaise, quantity, campaignId);
        }
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Event {
        private String type;
        private OrderStatus fromStatus;
        private OrderStatus toStatus;
        private String actorId;
        private Map<String, Object> metadata = new HashMap<>();
        private Instant at;

        static Event fromDomain(OrderLogEntry entry) {
            Event doc = new Event();
            doc.type = entry.getType();
            doc.fromStatus = entry.getFromStatus();
            doc.toStatus = entry.getToStatus();
            doc.actorId = entry.getActorId();
            doc.metadata = entry.getMetadata() == null ? new HashMap<>() : new HashMap<>(entry.getMetadata());
            doc.at = entry.getAt();
            return doc;
        }

        OrderLogEntry toDomain() {
            return new OrderLogEntry(type, fromStatus, toStatus, actorId,
                    metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata)), at);
        }
    }

    public static OrderDocument fromDomain(Order order) {
        OrderDocument doc = new OrderDocument();
        doc.id = order.getId();
        doc.status = order.getStatus();
        doc.items = order.getItems().stream().map(Item::fromDomain).collect(Collectors.toCollection(ArrayList::new));
        doc.shopperId = order.getShopperId();
        doc.mediatorId = order.getMediatorId();
        doc.brandOwnerId = order.getBrandOwnerId();
        doc.commissionPaise = order.getCommissionPaise();
        doc.cashbackPaise = order.getCashbackPaise();
        doc.events = order.getEvents().stream().map(Event::fromDomain).collect(Collectors.toCollection(ArrayList::new));
        doc.settlementRef = order.getSettlementRef();
        doc.pendingEffects = order.getPendingEffects();
        doc.frozen = order.isFrozen();
        doc.frozenReason = order.getFrozenReason();
        doc.version = order.getVersion();
        doc.createdAt = order.getCreatedAt();
        doc.updatedAt = order.getUpdatedAt();
        doc.deletedAt = order.getDeletedAt();
        return doc;
    }

    public Order toDomain() {
        return Order.builder()
                .id(id)
                .status(status)
                .items(items == null ? List.of() : items.stream().map(Item::toDomain).toList())
                .shopperId(shopperId)
                .mediatorId(mediatorId)
                .brandOwnerId(brandOwnerId)
                .commissionPaise(commissionPaise)
                .cashbackPaise(cashbackPaise)
                .events(events == null ? List.of() : events.stream().map(Event::toDomain).toList())
                .settlementRef(settlementRef)
                .pendingEffects(pendingEffects)
                .frozen(frozen)
                .frozenReason(frozenReason)
                .version(version)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .deletedAt(deletedAt)
                .build();
    }
}
