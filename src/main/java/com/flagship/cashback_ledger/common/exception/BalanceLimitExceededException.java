package com.flagship.cashback_ledger.common.exception;

import lombok.Getter;

@Getter
public class BalanceLimitExceededException extends LedgerException {

    private final String ownerId;
    private final long limitPaise;

    public BalanceLimitExceededException(String ownerId, long resultingPaise, long limitPaise) {
        super(ErrorCode.BALANCE_LIMIT_EXCEEDED,
                String.format("Available balance of owner %s would reach %d paise, limit is %d",
                        ownerId, resultingPaise, limitPaise));
        this.ownerId = ownerId;
        this.limitPaise = limitPaise;
    }

    /**
     * A balance would no longer fit in a long.
     */
    public static BalanceLimitExceededException overflow(String ownerId) {
        return new BalanceLimitExceededException(ownerId, Long.MAX_VALUE,
                String.format("A balance of owner %s would overflow", ownerId));
    }

    private BalanceLimitExceededException(String ownerId, long limitPaise, String message) {
        super(ErrorCode.BALANCE_LIMIT_EXCEEDED, message);
        this.ownerId = ownerId;
        this.limitPaise = limitPaise;
    }
}
