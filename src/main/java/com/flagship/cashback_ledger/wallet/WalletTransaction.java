package com.flagship.cashback_ledger.wallet;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One journal row: the record of a wallet-affecting operation.
 *
 * Rows are created {@code PENDING} before the wallet is touched and finalized
 * afterwards. A row is never edited to change its effect; corrections are new
 * rows that point back through {@code reversesTransactionId}.
 */
@Value
@Builder(toBuilder = true)
public class WalletTransaction {
    String id;
    String idempotencyKey;
    TransactionType type;
    TransactionStatus status;
    long amountPaise;
    BalanceDelta delta;
    String ownerId;
    String walletId;
    String orderId;
    String campaignId;
    String payoutId;
    String fromUserId;
    String toUserId;
    String reversesTransactionId;
    Map<String, Object> metadata;
    String failureReason;
    long revision;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates the pending row that claims an idempotency key.
     */
    public static WalletTransaction pending(String id, WalletMutation mutation, BalanceDelta delta,
                                            String reversesTransactionId, Instant now) {
        return WalletTransaction.builder()
                .id(id)
                .idempotencyKey(mutation.getIdempotencyKey())
                .type(mutation.getType())
                .status(TransactionStatus.PENDING)
                .amountPaise(mutation.getAmountPaise())
                .delta(delta)
                .ownerId(mutation.getOwnerId())
                .orderId(mutation.getOrderId())
                .campaignId(mutation.getCampaignId())
                .payoutId(mutation.getPayoutId())
                .fromUserId(mutation.getFromUserId())
                .toUserId(mutation.getToUserId())
                .reversesTransactionId(reversesTransactionId)
                .metadata(mutation.getMetadata() == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(mutation.getMetadata())))
                .revision(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean isCompleted() {
        return status == TransactionStatus.COMPLETED;
    }

    /**
     * Compares the parameters that define what this row does with those of
     * another row claiming the same key. Metadata is not compared.
     *
     * @return Names of the differing fields, empty when the rows describe the same operation
     */
    public List<String> differencesFrom(WalletTransaction other) {
        List<String> diffs = new ArrayList<>();
        if (!Objects.equals(ownerId, other.ownerId)) {
            diffs.add("ownerId");
        }
        if (type != other.type) {
            diffs.add("type");
        }
        if (amountPaise != other.amountPaise) {
            diffs.add("amountPaise");
        }
        if (!Objects.equals(delta, other.delta)) {
            diffs.add("delta");
        }
        if (!Objects.equals(orderId, other.orderId)) {
            diffs.add("orderId");
        }
        if (!Objects.equals(reversesTransactionId, other.reversesTransactionId)) {
            diffs.add("reversesTransactionId");
        }
        return diffs;
    }
}
