package com.flagship.cashback_ledger.common.exception;

/**
 * Thrown when a compare-and-swap keeps losing to concurrent writers after all retries,
 * or when a replay finds the original operation still in flight.
 */
public class ConcurrentLedgerModificationException extends LedgerException {

    public ConcurrentLedgerModificationException(String message) {
        super(ErrorCode.CONCURRENT_MODIFICATION, message);
    }
}
