package com.flagship.cashback_ledger.settlement;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The order workflow graph.
 *
 * <pre>
 * ORDERED --PROOF_SUBMITTED--> UNDER_REVIEW --REVIEW_APPROVED--> APPROVED
 *   --REQUIREMENT_VERIFIED--> REWARD_PENDING --PAYOUT_PROCESSED--> COMPLETED
 * </pre>
 * REJECTED and FAILED are reachable from every non-terminal status.
 * Terminal statuses accept no events.
 */
public final class SettlementStateMachine {

    private static final Map<OrderStatus, Map<OrderEvent, OrderStatus>> TRANSITIONS = buildTable();

    private SettlementStateMachine() {
    }

    /**
     * @return The status the event leads to, or empty if the event is not allowed from {@code from}
     */
    public static Optional<OrderStatus> next(OrderStatus from, OrderEvent event) {
        return Optional.ofNullable(TRANSITIONS.getOrDefault(from, Map.of()).get(event));
    }

    public static boolean allows(OrderStatus from, OrderEvent event) {
        return next(from, event).isPresent();
    }

    public static Map<OrderEvent, OrderStatus> transitionsFrom(OrderStatus from) {
        return TRANSITIONS.getOrDefault(from, Map.of());
    }

    private static Map<OrderStatus, Map<OrderEvent, OrderStatus>> buildTable() {
        Map<OrderStatus, Map<OrderEvent, OrderStatus>> table = new EnumMap<>(OrderStatus.class);
        forward(table, OrderStatus.ORDERED, OrderEvent.PROOF_SUBMITTED, OrderStatus.UNDER_REVIEW);
        forward(table, OrderStatus.UNDER_REVIEW, OrderEvent.REVIEW_APPROVED, OrderStatus.APPROVED);
        forward(table, OrderStatus.APPROVED, OrderEvent.REQUIREMENT_VERIFIED, OrderStatus.REWARD_PENDING);
        forward(table, OrderStatus.REWARD_PENDING, OrderEvent.PAYOUT_PROCESSED, OrderStatus.COMPLETED);

        for (OrderStatus status : OrderStatus.values()) {
            if (!status.isTerminal()) {
                forward(table, status, OrderEvent.REJECTED, OrderStatus.REJECTED);
                forward(table, status, OrderEvent.FAILED, OrderStatus.FAILED);
            }
        }

        table.replaceAll((status, edges) -> Collections.unmodifiableMap(edges));
        return Collections.unmodifiableMap(table);
    }

    private static void forward(Map<OrderStatus, Map<OrderEvent, OrderStatus>> table,
                                OrderStatus from, OrderEvent event, OrderStatus to) {
        table.computeIfAbsent(from, status -> new EnumMap<>(OrderEvent.class)).put(event, to);
    }
}
