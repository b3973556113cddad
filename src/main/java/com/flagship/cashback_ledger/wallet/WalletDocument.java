package com.flagship.cashback_ledger.wallet;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mongo mapping of {@link Wallet}. Field names are referenced by the
 * compare-and-swap queries in {@link MongoWalletStore}.
 */
@Document(collection = "wallets")
@Getter
@Setter
@NoArgsConstructor
public class WalletDocument {

    static final String OWNER_ID = "ownerId";
    static final String AVAILABLE = "availablePaise";
    static final String PENDING = "pendingPaise";
    static final String LOCKED = "lockedPaise";
    static final String VERSION = "version";
    static final String RECENT_TRANSACTIONS = "recentTransactionIds";
    static final String DELETED_AT = "deletedAt";
    static final String CREATED_AT = "createdAt";
    static final String UPDATED_AT = "updatedAt";

    @Id
    private String id;

    @Indexed(unique = true)
    private String ownerId;

    private String currency;
    private long availablePaise;
    private long pendingPaise;
    private long lockedPaise;
    private long version;
    private List<String> recentTransactionIds = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;
    private Instant deletedAt;

    public Wallet toDomain() {
        return new Wallet(
                id,
                ownerId,
                currency == null ? Wallet.DEFAULT_CURRENCY : currency,
                availablePaise,
                pendingPaise,
                lockedPaise,
                version,
                recentTransactionIds == null ? List.of() : List.copyOf(recentTransactionIds),
                createdAt,
                updatedAt,
                deletedAt);
    }
}
