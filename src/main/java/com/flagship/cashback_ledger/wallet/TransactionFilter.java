package com.flagship.cashback_ledger.wallet;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Criteria for listing an owner's journal rows, newest first.
 * Empty type or status sets mean "any".
 */
@Value
@Builder
public class TransactionFilter {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    @Singular("type")
    Set<TransactionType> types;
    @Singular("status")
    Set<TransactionStatus> statuses;
    Instant createdFrom;
    Instant createdBefore;
    String orderId;
    Integer limit;

    public static TransactionFilter all() {
        return TransactionFilter.builder().build();
    }

    public int effectiveLimit() {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
