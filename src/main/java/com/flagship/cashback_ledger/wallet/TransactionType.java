package com.flagship.cashback_ledger.wallet;

/**
 * Kinds of wallet-affecting operations and the balances each one moves.
 *
 * The effect of {@link #REVERSAL} is the inverse of the row it reverses and is
 * therefore not derivable from the amount alone.
 */
public enum TransactionType {
    BRAND_DEPOSIT(1, 0, 0),
    REFUND(1, 0, 0),
    AGENCY_RECEIPT(1, 0, 0),
    COMMISSION_LOCK(0, 1, 0),
    CASHBACK_LOCK(0, 1, 0),
    COMMISSION_SETTLE(1, -1, 0),
    CASHBACK_SETTLE(1, -1, 0),
    ORDER_SETTLEMENT_DEBIT(-1, 0, 0),
    PLATFORM_FEE(-1, 0, 0),
    AGENCY_PAYOUT(-1, 0, 0),
    PAYOUT_REQUEST(-1, 0, 1),
    PAYOUT_COMPLETE(0, 0, -1),
    PAYOUT_FAILED(1, 0, -1),
    REVERSAL(0, 0, 0);

    private final int availableSign;
    private final int pendingSign;
    private final int lockedSign;

    TransactionType(int availableSign, int pendingSign, int lockedSign) {
        this.availableSign = availableSign;
        this.pendingSign = pendingSign;
        this.lockedSign = lockedSign;
    }

    /**
     * Computes the balance effect of this operation for a positive amount.
     *
     * @throws UnsupportedOperationException for {@link #REVERSAL}
     */
    public BalanceDelta effectOf(long amountPaise) {
        if (this == REVERSAL) {
            throw new UnsupportedOperationException("Reversal effect depends on the reversed transaction");
        }
        return BalanceDelta.of(
                availableSign * amountPaise,
                pendingSign * amountPaise,
                lockedSign * amountPaise);
    }

    /**
     * Credit types only add money: they never withdraw from any balance.
     */
    public boolean isCredit() {
        return this != REVERSAL && availableSign >= 0 && pendingSign >= 0 && lockedSign >= 0;
    }

    public boolean isDebit() {
        return this != REVERSAL && availableSign < 0 && pendingSign == 0 && lockedSign == 0;
    }

    public boolean isLock() {
        return this == COMMISSION_LOCK || this == CASHBACK_LOCK;
    }
}
