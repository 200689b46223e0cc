package com.entity.graph.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forOperation should set correlationId and operation in MDC")
    void forOperationSetsMDC() {
        try (LogContext ctx = LogContext.forOperation("corr-123", "link")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("link", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forCascade should set correlationId, cascadePath, and operation in MDC")
    void forCascadeSetsMDC() {
        try (LogContext ctx = LogContext.forCascade("corr-789", "units[B1] > tenants[Bob]")) {
            assertEquals("corr-789", MDC.get("correlationId"));
            assertEquals("units[B1] > tenants[Bob]", MDC.get("cascadePath"));
            assertEquals("cascade", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forBatch should set batchId and operation in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("batch-456")) {
            assertEquals("batch-456", MDC.get("batchId"));
            assertEquals("batch", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forCascade("corr-123", "units[A1]");
        assertNotNull(MDC.get("correlationId"));
        assertNotNull(MDC.get("cascadePath"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("cascadePath"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forOperation("corr-123", "merge")
                .with("keyField", "id")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("id", MDC.get("keyField"));
        }
        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("keyField"));
    }

    @Test
    @DisplayName("Close should restore values set before the context was opened")
    void restoresPreviousValues() {
        MDC.put("operation", "external");

        try (LogContext ctx = LogContext.forOperation("corr-1", "compress")) {
            assertEquals("compress", MDC.get("operation"));
        }

        assertEquals("external", MDC.get("operation"));
        assertNull(MDC.get("correlationId"));
    }

    @Test
    @DisplayName("generateCorrelationId should return unique UUIDs")
    void generateCorrelationIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size(), "All generated IDs should be unique");
    }

    @Test
    @DisplayName("Nested contexts should hand their keys back to the outer context")
    void nestedContexts() {
        try (LogContext outer = LogContext.forBatch("batch-1")) {
            try (LogContext inner = LogContext.forCascade("corr-1", "units[B1]")) {
                assertEquals("cascade", MDC.get("operation"));
                assertEquals("batch-1", MDC.get("batchId"));
            }
            assertEquals("batch", MDC.get("operation"));
            assertNull(MDC.get("cascadePath"));
            assertNull(MDC.get("correlationId"));
        }
        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("operation"));
    }
}
