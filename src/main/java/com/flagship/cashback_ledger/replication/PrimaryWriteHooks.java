package com.flagship.cashback_ledger.replication;

/**
 * Post-write callbacks fired after the primary store has accepted a write.
 *
 * Implementations must return quickly and must never throw: the primary
 * write has already happened and its caller must see its result.
 */
public interface PrimaryWriteHooks {

    /** Hooks that do nothing, for stores used without replication. */
    PrimaryWriteHooks NONE = new PrimaryWriteHooks() {
        @Override
        public void afterUpsert(ReplicatedEntity entity, String foreignId) {
        }

        @Override
        public void afterDelete(ReplicatedEntity entity, String foreignId) {
        }
    };

    void afterUpsert(ReplicatedEntity entity, String foreignId);

    void afterDelete(ReplicatedEntity entity, String foreignId);
}
