package com.flagship.cashback_ledger.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
        CorrelationContext.clear();
    }

    @Test
    @DisplayName("Scopes restore the MDC and drop an id they generated")
    void testScopeRestoresMdc() {
        try (CorrelationContext.Scope ignored = CorrelationContext.forOrder("order-1")) {
            assertEquals("order-1", MDC.get(CorrelationContext.ORDER_ID_MDC_KEY));
            assertNotNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));

            try (CorrelationContext.Scope nested = CorrelationContext.forOrder("order-2")) {
                assertEquals("order-2", MDC.get(CorrelationContext.ORDER_ID_MDC_KEY));
            }
            assertEquals("order-1", MDC.get(CorrelationContext.ORDER_ID_MDC_KEY));
        }

        assertNull(MDC.get(CorrelationContext.ORDER_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        assertFalse(CorrelationContext.hasCorrelationId());
    }

    @Test
    @DisplayName("An existing correlation id outlives the scope")
    void testExistingIdKept() {
        CorrelationContext.setCorrelationId("req-7");

        try (CorrelationContext.Scope ignored = CorrelationContext.forOwner("shopper-1")) {
            assertEquals("req-7", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
            assertEquals("shopper-1", MDC.get(CorrelationContext.OWNER_ID_MDC_KEY));
        }

        assertEquals("req-7", CorrelationContext.getCorrelationId());
        assertNull(MDC.get(CorrelationContext.OWNER_ID_MDC_KEY));
    }

    @Test
    @DisplayName("Blank ids are replaced by a generated one")
    void testBlankIdReplaced() {
        CorrelationContext.setCorrelationId(" ");

        assertEquals(8, CorrelationContext.getCorrelationId().length());
    }
}
