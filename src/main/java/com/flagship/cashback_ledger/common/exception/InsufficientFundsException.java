package com.flagship.cashback_ledger.common.exception;

import lombok.Getter;

/**
 * Thrown when a mutation would drive one of the wallet's balances below zero.
 */
@Getter
public class InsufficientFundsException extends LedgerException {

    private final String ownerId;
    private final String balance;
    private final long requestedPaise;
    private final long availableForBalancePaise;

    public InsufficientFundsException(String ownerId, String balance, long requestedPaise, long availableForBalancePaise) {
        super(ErrorCode.INSUFFICIENT_FUNDS,
                String.format("Insufficient %s balance for owner %s: requested %d, have %d",
                        balance, ownerId, requestedPaise, availableForBalancePaise));
        this.ownerId = ownerId;
        this.balance = balance;
        this.requestedPaise = requestedPaise;
        this.availableForBalancePaise = availableForBalancePaise;
    }
}
