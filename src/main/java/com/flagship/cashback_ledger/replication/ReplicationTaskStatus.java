package com.flagship.cashback_ledger.replication;

public enum ReplicationTaskStatus {
    PENDING,
    DELIVERED,
    /** Exceeded max retries; revived by the reconciliation job. */
    DEAD
}
