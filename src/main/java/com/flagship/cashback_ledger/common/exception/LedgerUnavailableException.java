package com.flagship.cashback_ledger.common.exception;

/**
 * Thrown when the primary store cannot be reached or times out.
 * The operation's outcome is settled later by pending-transaction recovery.
 */
public class LedgerUnavailableException extends LedgerException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(ErrorCode.UNAVAILABLE, message, cause);
    }
}
