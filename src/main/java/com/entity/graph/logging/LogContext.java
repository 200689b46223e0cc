package com.entity.graph.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and restores the previous values on close, so a cascade
 * context opened inside a batch context hands the batch's keys back when it ends.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCascade(correlationId, "units[B1] &gt; tenants[Bob]")) {
 *     log.info("cascade.completed created={}", created);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a single engine operation (link, merge, compress, ...).
     */
    public static LogContext forOperation(String correlationId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Creates a log context for a cascade along one path.
     */
    public static LogContext forCascade(String correlationId, String path) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("cascadePath", path);
        ctx.put("operation", "cascade");
        return ctx;
    }

    /**
     * Creates a log context for instruction batches.
     */
    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "batch");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
