package com.flagship.cashback_ledger.replication;

import com.flagship.cashback_ledger.observability.ReplicationMetrics;
import com.flagship.cashback_ledger.replication.ReconciliationJob.Outcome;
import com.flagship.cashback_ledger.replication.ReconciliationJob.ReconciliationSettings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ReconciliationJobTest {

    private ReplicationOutbox outbox;
    private PrimaryDocumentSource primary;
    private ShadowWriter<Doc> writer;
    private ReplicationSyncStateRepository syncStateRepository;
    private SimpleMeterRegistry registry;
    private ReplicationMetrics metrics;

    private final Doc inSync = new Doc("w1", 3);
    private final Doc missing = new Doc("w2", 1);
    private final Doc stale = new Doc("w3", 5);

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outbox = mock(ReplicationOutbox.class);
        primary = mock(PrimaryDocumentSource.class);
        writer = mock(ShadowWriter.class);
        syncStateRepository = mock(ReplicationSyncStateRepository.class);
        registry = new SimpleMeterRegistry();
        metrics = new ReplicationMetrics(outbox, registry);

        when(writer.foreignIdOf(any())).thenAnswer(inv -> ((Doc) inv.getArgument(0)).id);
        when(writer.sourceVersionOf(any())).thenAnswer(inv -> ((Doc) inv.getArgument(0)).version);
        when(writer.shadowVersions(anyCollection())).thenReturn(Map.of("w1", 3L, "w3", 2L));
        when(syncStateRepository.findById("WALLET")).thenReturn(Optional.empty());
    }

    private ReconciliationJob job(ReconciliationSettings settings, ReplicationSettings replicationSettings) {
        ReplicationHandle handle = new ReplicationHandle(
                List.of(ReplicationRegistration.of(ReplicatedEntity.WALLET, Doc.class, writer)),
                outbox, primary, metrics, Runnable::run, replicationSettings);
        return new ReconciliationJob(handle, primary, outbox, syncStateRepository, metrics, settings);
    }

    private ReplicationSyncStateEntity savedState() {
        ArgumentCaptor<ReplicationSyncStateEntity> captor = ArgumentCaptor.forClass(ReplicationSyncStateEntity.class);
        verify(syncStateRepository).save(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("Missing and stale shadow rows are rewritten, current ones are left alone")
    void testRepairsMissingAndStaleRows() {
        when(primary.find(eq(Doc.class), any(Query.class), eq(2)))
                .thenReturn(List.of(inSync, missing), List.of(stale));

        List<Outcome> outcomes = job(new ReconciliationSettings(2, 1_000, Duration.ofMinutes(5)),
                ReplicationSettings.defaults()).runOnce();

        Outcome outcome = outcomes.get(0);
        assertEquals(ReplicatedEntity.WALLET, outcome.getEntity());
        assertEquals(3, outcome.getScanned());
        assertEquals(2, outcome.getRepaired());
        assertEquals(ReplicationSyncStateEntity.STATUS_OK, outcome.getStatus());
        verify(writer).upsert(missing);
        verify(writer).upsert(stale);
        verify(writer, never()).upsert(inSync);
        verify(outbox).reviveDead(ReplicatedEntity.WALLET);

        ReplicationSyncStateEntity state = savedState();
        assertEquals("WALLET", state.getEntityType());
        assertNotNull(state.getLastSyncedAt());
        assertEquals(2, state.getRepairedCount());
    }

    @Test
    @DisplayName("Pages are read in id order after the last id seen")
    void testKeysetPaging() {
        when(primary.find(eq(Doc.class), any(Query.class), eq(2)))
                .thenReturn(List.of(inSync, missing), List.of());

        job(new ReconciliationSettings(2, 1_000, Duration.ofMinutes(5)), ReplicationSettings.defaults()).runOnce();

        ArgumentCaptor<Query> queries = ArgumentCaptor.forClass(Query.class);
        verify(primary, times(2)).find(eq(Doc.class), queries.capture(), eq(2));
        Query second = queries.getAllValues().get(1);
        assertEquals(new Document("$gt", "w2"), second.getQueryObject().get("_id"));
        assertEquals(new Document("_id", 1), second.getSortObject());
    }

    @Test
    @DisplayName("Scans resume from the saved watermark minus the overlap")
    void testWatermarkWindow() {
        Instant watermark = Instant.parse("2026-01-01T10:00:00Z");
        ReplicationSyncStateEntity previous = new ReplicationSyncStateEntity();
        previous.setEntityType("WALLET");
        previous.setLastSyncedAt(watermark);
        when(syncStateRepository.findById("WALLET")).thenReturn(Optional.of(previous));
        when(primary.find(eq(Doc.class), any(Query.class), anyInt())).thenReturn(List.of());

        job(new ReconciliationSettings(50, 1_000, Duration.ofMinutes(5)), ReplicationSettings.defaults()).runOnce();

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(primary).find(eq(Doc.class), query.capture(), eq(50));
        assertEquals(new Document("$gte", watermark.minus(Duration.ofMinutes(5))),
                query.getValue().getQueryObject().get("updatedAt"));
        assertTrue(savedState().getLastSyncedAt().isAfter(watermark));
    }

    @Test
    @DisplayName("A failed rewrite keeps the watermark so the next run retries")
    void testFailureKeepsWatermark() {
        when(primary.find(eq(Doc.class), any(Query.class), eq(10))).thenReturn(List.of(inSync, missing, stale));
        doThrow(new IllegalStateException("wallet row not replicated yet")).when(writer).upsert(missing);

        Outcome outcome = job(new ReconciliationSettings(10, 1_000, Duration.ofMinutes(5)),
                ReplicationSettings.defaults()).runOnce().get(0);

        assertEquals(1, outcome.getFailed());
        assertEquals(1, outcome.getRepaired());
        assertEquals(ReplicationSyncStateEntity.STATUS_FAILED, outcome.getStatus());
        ReplicationSyncStateEntity state = savedState();
        assertNull(state.getLastSyncedAt());
        assertEquals("wallet row not replicated yet", state.getLastError());
        assertEquals(1.0, registry.counter("replication.reconciliation.documents",
                "entity", "Wallet", "status", "failure").count());
    }

    @Test
    @DisplayName("A run that hits the document cap is partial and keeps the watermark")
    void testDocumentCap_Partial() {
        when(primary.find(eq(Doc.class), any(Query.class), eq(2))).thenReturn(List.of(inSync, missing));

        Outcome outcome = job(new ReconciliationSettings(2, 2, Duration.ofMinutes(5)),
                ReplicationSettings.defaults()).runOnce().get(0);

        assertTrue(outcome.isTruncated());
        assertEquals(ReplicationSyncStateEntity.STATUS_PARTIAL, outcome.getStatus());
        assertNull(savedState().getLastSyncedAt());
    }

    @Test
    @DisplayName("An unreadable primary store aborts the entity without throwing")
    void testPrimaryUnreadable() {
        when(primary.find(eq(Doc.class), any(Query.class), anyInt())).thenThrow(new IllegalStateException("mongo down"));

        Outcome outcome = assertDoesNotThrow(() -> job(ReconciliationSettings.defaults(),
                ReplicationSettings.defaults()).runOnce().get(0));

        assertEquals(ReplicationSyncStateEntity.STATUS_FAILED, outcome.getStatus());
        assertEquals(0, outcome.getScanned());
    }

    @Test
    @DisplayName("Shadow rows whose primary document is gone are deleted")
    void testOrphanedShadowRowsRemoved() {
        when(primary.find(eq(Doc.class), any(Query.class), eq(10))).thenReturn(List.of(inSync, stale));
        when(writer.shadowIdsAfter(null, 10)).thenReturn(List.of("w1", "w3", "w8"));
        when(primary.find(eq(Doc.class), any(Query.class), eq(3))).thenReturn(List.of(inSync, stale));

        Outcome outcome = job(new ReconciliationSettings(10, 1_000, Duration.ofMinutes(5)),
                ReplicationSettings.defaults()).runOnce().get(0);

        verify(writer).delete("w8");
        verify(writer, never()).delete("w1");
        verify(writer, never()).delete("w3");
        assertEquals(1, outcome.getRemoved());
        assertEquals(ReplicationSyncStateEntity.STATUS_OK, outcome.getStatus());
        assertEquals(1.0, registry.counter("replication.reconciliation.documents",
                "entity", "Wallet", "status", "removed").count());

        ArgumentCaptor<Query> lookup = ArgumentCaptor.forClass(Query.class);
        verify(primary).find(eq(Doc.class), lookup.capture(), eq(3));
        assertEquals(new Document("$in", List.of("w1", "w3", "w8")),
                lookup.getValue().getQueryObject().get("_id"));
    }

    @Test
    @DisplayName("The shadow table is paged by id until a short page")
    void testOrphanSweepPaging() {
        when(primary.find(eq(Doc.class), any(Query.class), eq(2))).thenReturn(List.of());
        when(writer.shadowIdsAfter(null, 2)).thenReturn(List.of("w1", "w2"));
        when(writer.shadowIdsAfter("w2", 2)).thenReturn(List.of("w5"));
        when(primary.find(eq(Doc.class), any(Query.class), eq(1))).thenReturn(List.of());

        Outcome outcome = job(new ReconciliationSettings(2, 1_000, Duration.ofMinutes(5)),
                ReplicationSettings.defaults()).runOnce().get(0);

        verify(writer).delete("w1");
        verify(writer).delete("w2");
        verify(writer).delete("w5");
        verify(writer, never()).shadowIdsAfter("w5", 2);
        assertEquals(3, outcome.getRemoved());
    }

    @Test
    @DisplayName("A failed orphan delete keeps the watermark")
    void testOrphanDeleteFailure() {
        when(primary.find(eq(Doc.class), any(Query.class), eq(10))).thenReturn(List.of());
        when(writer.shadowIdsAfter(null, 10)).thenReturn(List.of("w8"));
        when(primary.find(eq(Doc.class), any(Query.class), eq(1))).thenReturn(List.of());
        doThrow(new IllegalStateException("postgres down")).when(writer).delete("w8");

        Outcome outcome = job(new ReconciliationSettings(10, 1_000, Duration.ofMinutes(5)),
                ReplicationSettings.defaults()).runOnce().get(0);

        assertEquals(0, outcome.getRemoved());
        assertEquals(1, outcome.getFailed());
        assertEquals(ReplicationSyncStateEntity.STATUS_FAILED, outcome.getStatus());
        assertNull(savedState().getLastSyncedAt());
    }

    @Test
    @DisplayName("Disabled replication skips reconciliation")
    void testDisabled() {
        List<Outcome> outcomes = job(ReconciliationSettings.defaults(),
                new ReplicationSettings(false, 8, Duration.ofSeconds(30))).runOnce();

        assertTrue(outcomes.isEmpty());
        verifyNoInteractions(primary, syncStateRepository);
    }

    static class Doc {
        final String id;
        final long version;

        Doc(String id, long version) {
            this.id = id;
            this.version = version;
        }
    }
}
