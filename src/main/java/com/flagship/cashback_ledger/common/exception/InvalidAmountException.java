package com.flagship.cashback_ledger.common.exception;

public class InvalidAmountException extends LedgerException {

    public InvalidAmountException(long amountPaise) {
        super(ErrorCode.INVALID_AMOUNT, "Amount must be a positive number of paise, got " + amountPaise);
    }
}
