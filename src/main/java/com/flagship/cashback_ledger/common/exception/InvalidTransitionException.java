package com.flagship.cashback_ledger.common.exception;

import lombok.Getter;

/**
 * Thrown when an order event is not allowed from the order's current status.
 * The current status is carried as a string so the exception stays free of settlement types.
 */
@Getter
public class InvalidTransitionException extends LedgerException {

    private final String orderId;
    private final String currentStatus;
    private final String event;

    public InvalidTransitionException(String orderId, String currentStatus, String event) {
        this(orderId, currentStatus, event,
                String.format("Order %s cannot handle %s while %s", orderId, event, currentStatus));
    }

    public InvalidTransitionException(String orderId, String currentStatus, String event, String message) {
        super(ErrorCode.INVALID_TRANSITION, message);
        this.orderId = orderId;
        this.currentStatus = currentStatus;
        this.event = event;
    }
}
