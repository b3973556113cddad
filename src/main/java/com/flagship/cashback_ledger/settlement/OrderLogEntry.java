package com.flagship.cashback_ledger.settlement;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * One immutable entry of an order's event log.
 */
@Value
public class OrderLogEntry {

    public static final String CREATED = "CREATED";
    public static final String DELETED = "DELETED";
    public static final String FROZEN = "WORKFLOW_FROZEN";
    public static final String REACTIVATED = "WORKFLOW_REACTIVATED";

    String type;
    OrderStatus fromStatus;
    OrderStatus toStatus;
    String actorId;
    Map<String, Object> metadata;
    Instant at;

    public static OrderLogEntry transition(OrderEvent event, OrderStatus from, OrderStatus to,
                                           String actorId, Map<String, Object> metadata, Instant at) {
        return new OrderLogEntry(event.name(), from, to, actorId, copy(metadata), at);
    }

    public static OrderLogEntry created(String actorId, Instant at) {
        return new OrderLogEntry(CREATED, null, OrderStatus.ORDERED, actorId, Map.of(), at);
    }

    public static OrderLogEntry deleted(OrderStatus status, String actorId, Instant at) {
        return new OrderLogEntry(DELETED, status, status, actorId, Map.of(), at);
    }

    public static OrderLogEntry frozen(String reason, String actorId, Instant at) {
        return new OrderLogEntry(FROZEN, null, null, actorId, reasonOf(reason), at);
    }

    public static OrderLogEntry reactivated(OrderStatus status, String reason, String actorId, Instant at) {
        return new OrderLogEntry(REACTIVATED, status, status, actorId, reasonOf(reason), at);
    }

    private static Map<String, Object> reasonOf(String reason) {
        return reason == null ? Map.of() : Map.of("reason", reason);
    }

    private static Map<String, Object> copy(Map<String, Object> metadata) {
        return metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata));
    }
}
