package com.flagship.cashback_ledger.settlement;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Events that move an order through its workflow.
 * The keyword prefixes the idempotency keys of the wallet operations an event triggers.
 */
@Getter
@RequiredArgsConstructor
public enum OrderEvent {
    PROOF_SUBMITTED("submit"),
    REVIEW_APPROVED("approve"),
    REQUIREMENT_VERIFIED("verify"),
    PAYOUT_PROCESSED("settle"),
    REJECTED("reject"),
    FAILED("fail");

    private final String keyword;

    /**
     * Rejection and failure release locked funds; every other event moves forward.
     */
    public boolean releasesFunds() {
        return this == REJECTED || this == FAILED;
    }

    public boolean hasWalletEffects() {
        return this == REVIEW_APPROVED || this == PAYOUT_PROCESSED || releasesFunds();
    }
}
