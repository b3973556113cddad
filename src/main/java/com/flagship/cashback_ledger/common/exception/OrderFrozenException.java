package com.flagship.cashback_ledger.common.exception;

import lombok.Getter;

/**
 * Thrown when an event is sent to an order that is frozen and has not been reactivated.
 */
@Getter
public class OrderFrozenException extends LedgerException {

    private final String orderId;
    private final String reason;

    public OrderFrozenException(String orderId, String reason) {
        super(ErrorCode.ORDER_FROZEN,
                String.format("Order %s is frozen (%s) and requires explicit reactivation", orderId, reason));
        this.orderId = orderId;
        this.reason = reason;
    }
}
