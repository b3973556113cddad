package com.flagship.cashback_ledger.common.exception;

import lombok.Getter;

@Getter
public class OrderNotFoundException extends LedgerException {

    private final String orderId;

    public OrderNotFoundException(String orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "Order not found: " + orderId);
        this.orderId = orderId;
    }
}
