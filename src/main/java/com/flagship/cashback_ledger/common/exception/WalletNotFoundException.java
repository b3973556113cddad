package com.flagship.cashback_ledger.common.exception;

import lombok.Getter;

@Getter
public class WalletNotFoundException extends LedgerException {

    private final String ownerId;

    public WalletNotFoundException(String ownerId) {
        super(ErrorCode.WALLET_NOT_FOUND, "No wallet for owner " + ownerId);
        this.ownerId = ownerId;
    }
}
