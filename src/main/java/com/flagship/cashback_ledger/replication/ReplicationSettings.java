package com.flagship.cashback_ledger.replication;

import lombok.Value;

import java.time.Duration;

/**
 * Tunables bound from {@code replication.*}.
 */
@Value
public class ReplicationSettings {
    boolean enabled;
    int maxRetries;
    /** How long a claimed task is reserved for its worker. */
    Duration lease;

    public static ReplicationSettings defaults() {
        return new ReplicationSettings(true, 8, Duration.ofSeconds(30));
    }
}
