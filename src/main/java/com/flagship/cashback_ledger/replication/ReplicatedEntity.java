package com.flagship.cashback_ledger.replication;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Primary-store entity types that are shadowed into the relational store.
 */
@Getter
@RequiredArgsConstructor
public enum ReplicatedEntity {
    WALLET("Wallet", "wallets", "shadow_wallets"),
    TRANSACTION("Transaction", "wallet_transactions", "shadow_transactions"),
    ORDER("Order", "orders", "shadow_orders");

    private final String label;
    private final String collection;
    private final String shadowTable;

    public static Optional<ReplicatedEntity> forCollection(String collection) {
        return Arrays.stream(values())
                .filter(entity -> entity.collection.equals(collection))
                .findFirst();
    }
}
