package com.flagship.cashback_ledger.replication;

public enum ReplicationOperation {
    UPSERT,
    DELETE
}
