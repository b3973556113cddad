package com.flagship.cashback_ledger.settlement;

import com.flagship.cashback_ledger.wallet.TransactionType;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * One party's share of an order's money movement.
 *
 * Wallet operations triggered by a transition use the deterministic key
 * {@code <orderId>:<event keyword>:<leg>}, so re-running a transition can
 * never apply its effect twice.
 */
@Getter
@RequiredArgsConstructor
public enum SettlementLeg {
    /** Brand funds the order: debited on approval, refunded on rejection. */
    BRAND("brand", null, null),
    MEDIATOR("mediator", TransactionType.COMMISSION_LOCK, TransactionType.COMMISSION_SETTLE),
    SHOPPER("shopper", TransactionType.CASHBACK_LOCK, TransactionType.CASHBACK_SETTLE);

    private final String keyword;
    private final TransactionType lockType;
    private final TransactionType settleType;

    public String keyFor(String orderId, OrderEvent event) {
        return orderId + ":" + event.getKeyword() + ":" + keyword;
    }

    public String accountOf(Order order) {
        return switch (this) {
            case BRAND -> order.getBrandOwnerId();
            case MEDIATOR -> order.getMediatorId();
            case SHOPPER -> order.getShopperId();
        };
    }

    public long amountOf(Order order) {
        return switch (this) {
            case BRAND -> order.getBrandOwnerId() == null ? 0 : order.brandFundedPaise();
            case MEDIATOR -> order.getCommissionPaise();
            case SHOPPER -> order.getCashbackPaise();
        };
    }

    /** Legs that receive money and hold it in pending until payout. */
    public static SettlementLeg[] payees() {
        return new SettlementLeg[]{MEDIATOR, SHOPPER};
    }
}
