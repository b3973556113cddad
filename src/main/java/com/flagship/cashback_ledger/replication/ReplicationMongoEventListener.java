package com.flagship.cashback_ledger.replication;

import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.core.mapping.event.AbstractMongoEventListener;
import org.springframework.data.mongodb.core.mapping.event.AfterDeleteEvent;
import org.springframework.data.mongodb.core.mapping.event.AfterSaveEvent;
import org.springframework.stereotype.Component;

/**
 * Reports inserts and saves made through {@code MongoTemplate} to the write hooks.
 *
 * Only whole-document writes raise mapping events. Stores that write with
 * {@code findAndModify} or {@code updateFirst} call the hooks themselves, and
 * bulk updates go through {@link ReplicationHandle#resyncAfterBulkUpdate}.
 */
@Component
@Slf4j
public class ReplicationMongoEventListener extends AbstractMongoEventListener<Object> {

    private final PrimaryWriteHooks writeHooks;

    public ReplicationMongoEventListener(PrimaryWriteHooks writeHooks) {
        this.writeHooks = writeHooks;
    }

    @Override
    public void onAfterSave(AfterSaveEvent<Object> event) {
        ReplicatedEntity.forCollection(event.getCollectionName()).ifPresent(entity -> {
            String id = idOf(event.getDocument());
            if (id == null) {
                log.warn("Saved {} document without a usable _id, not replicated", entity.getLabel());
                return;
            }
            writeHooks.afterUpsert(entity, id);
        });
    }

    @Override
    public void onAfterDelete(AfterDeleteEvent<Object> event) {
        ReplicatedEntity.forCollection(event.getCollectionName()).ifPresent(entity -> {
            // The event carries the delete filter; only single-id filters can be mapped to a row
            String id = idOf(event.getDocument());
            if (id == null) {
                log.warn("Delete of {} by filter {} not replicated, reconciliation will remove the rows",
                        entity.getLabel(), event.getDocument());
                return;
            }
            writeHooks.afterDelete(entity, id);
        });
    }

    static String idOf(Document document) {
        if (document == null) {
            return null;
        }
        Object id = document.get("_id");
        if (id instanceof ObjectId) {
            return ((ObjectId) id).toHexString();
        }
        if (id instanceof String) {
            return (String) id;
        }
        return null;
    }
}
