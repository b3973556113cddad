package com.flagship.cashback_ledger.settlement;

public enum OrderStatus {
    ORDERED,
    UNDER_REVIEW,
    APPROVED,
    REWARD_PENDING,
    COMPLETED,
    REJECTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == REJECTED || this == FAILED;
    }
}
