package com.flagship.cashback_ledger.config;

import com.flagship.cashback_ledger.observability.CorrelationContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AsyncConfigTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
        CorrelationContext.clear();
    }

    @Test
    @DisplayName("Worker threads see the submitter's correlation id and are cleaned up afterwards")
    void testCorrelationPropagated() throws Exception {
        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, "corr-42");
            Runnable decorated = AsyncConfig.correlationPropagatingDecorator().decorate(() -> {
                assertEquals("corr-42", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
                assertEquals("corr-42", CorrelationContext.getCorrelationId());
            });

            worker.submit(decorated).get(5, TimeUnit.SECONDS);

            CompletableFuture<Boolean> leftover = CompletableFuture.supplyAsync(
                    () -> MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY) == null && !CorrelationContext.hasCorrelationId(),
                    worker);
            assertTrue(leftover.get(5, TimeUnit.SECONDS));
        } finally {
            worker.shutdownNow();
        }
    }
}
