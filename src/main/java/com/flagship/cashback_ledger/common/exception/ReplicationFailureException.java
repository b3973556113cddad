package com.flagship.cashback_ledger.common.exception;

import lombok.Getter;

/**
 * Failure writing a shadow row. Only ever raised inside the replication path,
 * where it is caught, logged and recorded on the replication task.
 */
@Getter
public class ReplicationFailureException extends RuntimeException {

    private final String entityType;
    private final String foreignId;

    public ReplicationFailureException(String entityType, String foreignId, String message) {
        super(entityType + " " + foreignId + ": " + message);
        this.entityType = entityType;
        this.foreignId = foreignId;
    }

    public ReplicationFailureException(String entityType, String foreignId, String message, Throwable cause) {
        super(entityType + " " + foreignId + ": " + message, cause);
        this.entityType = entityType;
        this.foreignId = foreignId;
    }
}
