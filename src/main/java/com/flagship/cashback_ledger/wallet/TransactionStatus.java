package com.flagship.cashback_ledger.wallet;

public enum TransactionStatus {
    /** Row inserted, wallet mutation not yet confirmed. */
    PENDING,
    COMPLETED,
    /** No balance change happened. A replay with identical parameters may re-attempt. */
    FAILED,
    /**
     * Carried by rows imported from the legacy journal. New reversals append a
     * compensating row and leave the reversed row untouched.
     */
    REVERSED;

    public boolean isFinal() {
        return this == COMPLETED || this == REVERSED;
    }
}
