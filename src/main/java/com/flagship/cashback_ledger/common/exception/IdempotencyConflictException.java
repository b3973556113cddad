package com.flagship.cashback_ledger.common.exception;

import lombok.Getter;

/**
 * Thrown when an idempotency key is replayed with parameters that differ from the first use.
 */
@Getter
public class IdempotencyConflictException extends LedgerException {

    private final String idempotencyKey;

    public IdempotencyConflictException(String idempotencyKey, String difference) {
        super(ErrorCode.IDEMPOTENCY_CONFLICT,
                "Idempotency key " + idempotencyKey + " was already used with different parameters: " + difference);
        this.idempotencyKey = idempotencyKey;
    }
}
