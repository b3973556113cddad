package com.flagship.cashback_ledger.replication.shadow;

import com.flagship.cashback_ledger.common.EntityId;
import com.flagship.cashback_ledger.replication.ReplicatedEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ShadowIdResolverTest {

    private static final UUID ORDER_UUID = UUID.fromString("3f2504e0-4f89-11d3-9a0c-0305e82c3301");

    private JdbcTemplate jdbcTemplate;
    private ShadowIdResolver resolver;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        resolver = new ShadowIdResolver(jdbcTemplate);
    }

    @Test
    @DisplayName("Legacy ids resolve to themselves without a lookup")
    void testResolve_Legacy() {
        assertEquals(Optional.of("64b7f0c2e13a4a0012345678"),
                resolver.resolve(ReplicatedEntity.ORDER, EntityId.parse("64b7f0c2e13a4a0012345678")));
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("Native ids are looked up once and then served from the cache")
    void testResolve_NativeCached() {
        when(jdbcTemplate.queryForList(anyString(), eq(String.class), eq(ORDER_UUID)))
                .thenReturn(List.of("64b7f0c2e13a4a0012345678"));

        EntityId id = EntityId.parse(ORDER_UUID.toString());
        assertEquals(Optional.of("64b7f0c2e13a4a0012345678"), resolver.resolve(ReplicatedEntity.ORDER, id));
        assertEquals(Optional.of("64b7f0c2e13a4a0012345678"), resolver.resolve(ReplicatedEntity.ORDER, id));

        verify(jdbcTemplate, times(1)).queryForList(anyString(), eq(String.class), eq(ORDER_UUID));
    }

    @Test
    @DisplayName("Misses are not cached so a row replicated later is found")
    void testMissNotCached() {
        when(jdbcTemplate.queryForList(anyString(), eq(UUID.class), eq("w1")))
                .thenReturn(List.of(), List.of(ORDER_UUID));

        assertTrue(resolver.shadowIdOf(ReplicatedEntity.WALLET, "w1").isEmpty());
        assertEquals(Optional.of(ORDER_UUID), resolver.shadowIdOf(ReplicatedEntity.WALLET, "w1"));
    }

    @Test
    @DisplayName("Evicting a deleted row forgets both directions")
    void testEvict() {
        when(jdbcTemplate.queryForList(anyString(), eq(UUID.class), eq("w1"))).thenReturn(List.of(ORDER_UUID));
        resolver.shadowIdOf(ReplicatedEntity.WALLET, "w1");

        resolver.evict(ReplicatedEntity.WALLET, "w1");
        resolver.shadowIdOf(ReplicatedEntity.WALLET, "w1");

        verify(jdbcTemplate, times(2)).queryForList(anyString(), eq(UUID.class), eq("w1"));
    }
}
