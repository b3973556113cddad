package com.flagship.cashback_ledger.wallet;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A request to move money on one owner's wallet under an idempotency key.
 */
@Value
@Builder(toBuilder = true)
public class WalletMutation {
    String ownerId;
    long amountPaise;
    String idempotencyKey;
    TransactionType type;
    String orderId;
    String campaignId;
    String payoutId;
    String fromUserId;
    String toUserId;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
