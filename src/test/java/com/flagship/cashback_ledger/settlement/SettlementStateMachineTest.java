package com.flagship.cashback_ledger.settlement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SettlementStateMachineTest {

    @ParameterizedTest(name = "{0} --{1}--> {2}")
    @CsvSource({
            "ORDERED, PROOF_SUBMITTED, UNDER_REVIEW",
            "UNDER_REVIEW, REVIEW_APPROVED, APPROVED",
            "APPROVED, REQUIREMENT_VERIFIED, REWARD_PENDING",
            "REWARD_PENDING, PAYOUT_PROCESSED, COMPLETED"
    })
    @DisplayName("Happy path moves one step per event")
    void testForwardTransitions(OrderStatus from, OrderEvent event, OrderStatus to) {
        assertEquals(Optional.of(to), SettlementStateMachine.next(from, event));
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"ORDERED", "UNDER_REVIEW", "APPROVED", "REWARD_PENDING"})
    @DisplayName("Rejection and failure are reachable from every open status")
    void testReleaseEventsFromOpenStatuses(OrderStatus from) {
        assertEquals(Optional.of(OrderStatus.REJECTED), SettlementStateMachine.next(from, OrderEvent.REJECTED));
        assertEquals(Optional.of(OrderStatus.FAILED), SettlementStateMachine.next(from, OrderEvent.FAILED));
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"COMPLETED", "REJECTED", "FAILED"})
    @DisplayName("Terminal statuses accept no events")
    void testTerminalStatusesAcceptNothing(OrderStatus terminal) {
        assertTrue(terminal.isTerminal());
        for (OrderEvent event : OrderEvent.values()) {
            assertFalse(SettlementStateMachine.allows(terminal, event), terminal + " allowed " + event);
        }
        assertTrue(SettlementStateMachine.transitionsFrom(terminal).isEmpty());
    }

    @ParameterizedTest(name = "{0} refuses {1}")
    @CsvSource({
            "ORDERED, REVIEW_APPROVED",
            "ORDERED, PAYOUT_PROCESSED",
            "UNDER_REVIEW, PROOF_SUBMITTED",
            "APPROVED, PAYOUT_PROCESSED",
            "REWARD_PENDING, REVIEW_APPROVED"
    })
    @DisplayName("Skipping or repeating a step is not allowed")
    void testOutOfOrderEventsRefused(OrderStatus from, OrderEvent event) {
        assertTrue(SettlementStateMachine.next(from, event).isEmpty());
    }

    @Test
    @DisplayName("Only rejection and failure lead to the fund-releasing statuses")
    void testReleasingEventsMatchReleasingStatuses() {
        for (OrderEvent event : OrderEvent.values()) {
            Optional<OrderStatus> target = SettlementStateMachine.next(OrderStatus.APPROVED, event);
            boolean releases = target.map(to -> to == OrderStatus.REJECTED || to == OrderStatus.FAILED).orElse(false);
            if (target.isPresent()) {
                assertEquals(event.releasesFunds(), releases, event.name());
            }
        }
    }

    @Test
    @DisplayName("Transition table cannot be modified by callers")
    void testTableIsImmutable() {
        assertThrows(UnsupportedOperationException.class,
                () -> SettlementStateMachine.transitionsFrom(OrderStatus.ORDERED).clear());
    }
}
