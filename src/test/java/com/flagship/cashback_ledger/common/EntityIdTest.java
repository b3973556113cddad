package com.flagship.cashback_ledger.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EntityIdTest {

    @Test
    @DisplayName("UUIDs are native ids, normalized to lower case")
    void testParse_Uuid() {
        EntityId id = EntityId.parse("  3F2504E0-4F89-11D3-9A0C-0305E82C3301 ");

        assertTrue(id.isNative());
        assertEquals("3f2504e0-4f89-11d3-9a0c-0305e82c3301", id.getValue());
        assertEquals(UUID.fromString("3f2504e0-4f89-11d3-9a0c-0305e82c3301"), id.asUuid());
        assertEquals("native:3f2504e0-4f89-11d3-9a0c-0305e82c3301", id.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"64b7f0c2e13a4a0012345678", "order-12", "3f2504e0-4f89-11d3-9a0c"})
    @DisplayName("Anything that is not a UUID is a legacy id")
    void testParse_Legacy(String raw) {
        EntityId id = EntityId.parse(raw);

        assertFalse(id.isNative());
        assertEquals(EntityId.Kind.LEGACY, id.getKind());
        assertEquals(raw, id.getValue());
        assertThrows(IllegalStateException.class, id::asUuid);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    @DisplayName("Blank ids are rejected")
    void testParse_Blank(String raw) {
        assertThrows(IllegalArgumentException.class, () -> EntityId.parse(raw));
    }

    @Test
    @DisplayName("Ids compare by kind and value")
    void testEquality() {
        assertEquals(EntityId.legacy("abc"), EntityId.parse("abc"));
        assertNotEquals(EntityId.legacy("3f2504e0-4f89-11d3-9a0c-0305e82c3301"),
                EntityId.parse("3f2504e0-4f89-11d3-9a0c-0305e82c3301"));
    }
}
