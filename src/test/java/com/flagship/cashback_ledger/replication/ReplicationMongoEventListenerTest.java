package com.flagship.cashback_ledger.replication;

import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.mapping.event.AfterDeleteEvent;
import org.springframework.data.mongodb.core.mapping.event.AfterSaveEvent;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ReplicationMongoEventListenerTest {

    private PrimaryWriteHooks hooks;
    private ReplicationMongoEventListener listener;

    @BeforeEach
    void setUp() {
        hooks = mock(PrimaryWriteHooks.class);
        listener = new ReplicationMongoEventListener(hooks);
    }

    @Test
    @DisplayName("ObjectId and string ids are reported, anything else is not")
    void testIdOf() {
        ObjectId objectId = new ObjectId();

        assertEquals(objectId.toHexString(), ReplicationMongoEventListener.idOf(new Document("_id", objectId)));
        assertEquals("order-7", ReplicationMongoEventListener.idOf(new Document("_id", "order-7")));
        assertNull(ReplicationMongoEventListener.idOf(new Document("_id", 42)));
        assertNull(ReplicationMongoEventListener.idOf(new Document("shopperId", "s1")));
        assertNull(ReplicationMongoEventListener.idOf(null));
    }

    @Test
    @DisplayName("Saves to a replicated collection fire the upsert hook")
    void testSaveOfReplicatedCollection() {
        ObjectId id = new ObjectId();

        listener.onAfterSave(new AfterSaveEvent<>(new Object(), new Document("_id", id), "orders"));

        verify(hooks).afterUpsert(ReplicatedEntity.ORDER, id.toHexString());
    }

    @Test
    @DisplayName("Saves to other collections are ignored")
    void testSaveOfOtherCollection() {
        listener.onAfterSave(new AfterSaveEvent<>(new Object(), new Document("_id", new ObjectId()), "replication_tasks"));

        verifyNoInteractions(hooks);
    }

    @Test
    @DisplayName("Single-id deletes fire the delete hook, filter deletes do not")
    void testDeletes() {
        listener.onAfterDelete(new AfterDeleteEvent<>(new Document("_id", "w-1"), Object.class, "wallets"));
        listener.onAfterDelete(new AfterDeleteEvent<>(new Document("status", "DEAD"), Object.class, "wallets"));

        verify(hooks).afterDelete(ReplicatedEntity.WALLET, "w-1");
        verifyNoMoreInteractions(hooks);
    }
}
