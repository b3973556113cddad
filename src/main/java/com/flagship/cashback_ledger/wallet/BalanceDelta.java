package com.flagship.cashback_ledger.wallet;

import lombok.Value;

/**
 * Signed effect of one journal row on the three wallet balances, in paise.
 */
@Value
public class BalanceDelta {

    long availablePaise;
    long pendingPaise;
    long lockedPaise;

    public static BalanceDelta of(long availablePaise, long pendingPaise, long lockedPaise) {
        return new BalanceDelta(availablePaise, pendingPaise, lockedPaise);
    }

    public BalanceDelta negate() {
        return new BalanceDelta(-availablePaise, -pendingPaise, -lockedPaise);
    }

    /**
     * @throws ArithmeticException if any balance overflows
     */
    public BalanceDelta plus(BalanceDelta other) {
        return new BalanceDelta(
                Math.addExact(availablePaise, other.availablePaise),
                Math.addExact(pendingPaise, other.pendingPaise),
                Math.addExact(lockedPaise, other.lockedPaise));
    }

    /**
     * True when the delta takes money out of at least one balance.
     */
    public boolean withdrawsFromAnyBalance() {
        return availablePaise < 0 || pendingPaise < 0 || lockedPaise < 0;
    }
}
