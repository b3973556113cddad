package com.flagship.cashback_ledger.wallet;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Mongo mapping of {@link WalletTransaction}.
 */
@Document(collection = "wallet_transactions")
@CompoundIndexes({
        @CompoundIndex(name = "wallet_created_idx", def = "{'walletId': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "owner_created_idx", def = "{'ownerId': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "status_created_idx", def = "{'status': 1, 'createdAt': 1}")
})
@Getter
@Setter
@NoArgsConstructor
public class WalletTransactionDocument {

    static final String IDEMPOTENCY_KEY = "idempotencyKey";
    static final String STATUS = "status";
    static final String TYPE = "type";
    static final String OWNER_ID = "ownerId";
    static final String WALLET_ID = "walletId";
    static final String ORDER_ID = "orderId";
    static final String FAILURE_REASON = "failureReason";
    static final String REVISION = "revision";
    static final String CREATED_AT = "createdAt";
    static final String UPDATED_AT = "updatedAt";

    @Id
    private String id;

    @Indexed(unique = true)
    private String idempotencyKey;

    private TransactionType type;
    private TransactionStatus status;
    private long amountPaise;
    private long availableDeltaPaise;
    private long pendingDeltaPaise;
    private long lockedDeltaPaise;
    private String ownerId;
    private String walletId;

    @Indexed(sparse = true)
    private String orderId;

    private String campaignId;
    private String payoutId;
    private String fromUserId;
    private String toUserId;
    private String reversesTransactionId;
    private Map<String, Object> metadata = new HashMap<>();
    private String failureReason;
    private long revision;
    private Instant createdAt;
    private Instant updatedAt;

    public static WalletTransactionDocument fromDomain(WalletTransaction tx) {
        WalletTransactionDocument doc = new WalletTransactionDocument();
        doc.id = tx.getId();
        doc.idempotencyKey = tx.getIdempotencyKey();
        doc.type = tx.getType();
        doc.status = tx.getStatus();
        doc.amountPaise = tx.getAmountPaise();
        doc.availableDeltaPaise = tx.getDelta().getAvailablePaise();
        doc.pendingDeltaPaise = tx.getDelta().getPendingPaise();
        doc.lockedDeltaPaise = tx.getDelta().getLockedPaise();
        doc.ownerId = tx.getOwnerId();
        doc.walletId = tx.getWalletId();
        doc.orderId = tx.getOrderId();
        doc.campaignId = tx.getCampaignId();
        doc.payoutId = tx.getPayoutId();
        doc.fromUserId = tx.getFromUserId();
        doc.toUserId = tx.getToUserId();
        doc.reversesTransactionId = tx.getReversesTransactionId();
        doc.metadata = tx.getMetadata() == null ? new HashMap<>() : new HashMap<>(tx.getMetadata());
        doc.failureReason = tx.getFailureReason();
        doc.revision = tx.getRevision();
        doc.createdAt = tx.getCreatedAt();
        doc.updatedAt = tx.getUpdatedAt();
        return doc;
    }

    public WalletTransaction toDomain() {
        return WalletTransaction.builder()
                .id(id)
                .idempotencyKey(idempotencyKey)
                .type(type)
                .status(status)
                .amountPaise(amountPaise)
                .delta(BalanceDelta.of(availableDeltaPaise, pendingDeltaPaise, lockedDeltaPaise))
                .ownerId(ownerId)
                .walletId(walletId)
                .orderId(orderId)
                .campaignId(campaignId)
                .payoutId(payoutId)
                .fromUserId(fromUserId)
                .toUserId(toUserId)
                .reversesTransactionId(reversesTransactionId)
                .metadata(metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata)))
                .failureReason(failureReason)
                .revision(revision)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
