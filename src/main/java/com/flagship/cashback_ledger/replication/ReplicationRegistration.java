package com.flagship.cashback_ledger.replication;

import lombok.Value;

/**
 * Links one primary entity type to its document class and shadow writer.
 */
@Value
public class ReplicationRegistration<D> {
    ReplicatedEntity entity;
    Class<D> documentType;
    ShadowWriter<D> writer;
    /** Primary-store field holding the last modification time, used for incremental reconciliation. */
    String updatedAtField;

    public static <D> ReplicationRegistration<D> of(ReplicatedEntity entity, Class<D> documentType, ShadowWriter<D> writer) {
        return new ReplicationRegistration<>(entity, documentType, writer, "updatedAt");
    }
}
