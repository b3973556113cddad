package com.flagship.cashback_ledger.common.exception;

import lombok.Getter;

/**
 * Base type for every failure a caller of the ledger can observe.
 *
 * All subclasses are unchecked and carry a stable {@link ErrorCode}.
 * Replication problems never surface through this hierarchy.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    protected LedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
