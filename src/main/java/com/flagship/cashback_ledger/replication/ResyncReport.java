package com.flagship.cashback_ledger.replication;

import lombok.Value;

/**
 * Outcome of {@link ReplicationHandle#resyncAfterBulkUpdate}.
 */
@Value
public class ResyncReport {
    ReplicatedEntity entity;
    long matched;
    int processed;
    int failed;
    /** True when more documents matched than the limit allowed to process. */
    boolean truncated;

    public static ResyncReport unregistered(ReplicatedEntity entity) {
        return new ResyncReport(entity, 0, 0, 0, false);
    }
}
