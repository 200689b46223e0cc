package com.entity.graph.metrics;

import com.entity.graph.core.model.WarningKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code graph.operation.duration}: Timer (tags: operation, outcome)</li>
 *   <li>{@code graph.entity.created}: Counter (tag: collection)</li>
 *   <li>{@code graph.ids.assigned}: Counter</li>
 *   <li>{@code graph.references.repaired}: Counter</li>
 *   <li>{@code graph.elements.removed}: Counter</li>
 *   <li>{@code graph.warnings}: Counter (tag: kind)</li>
 *   <li>{@code graph.batch.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter idsAssignedCounter;
    private final Counter referencesRepairedCounter;
    private final Counter elementsRemovedCounter;
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.idsAssignedCounter = Counter.builder("graph.ids.assigned")
                .description("Number of identifiers generated by the linker")
                .register(registry);
        this.referencesRepairedCounter = Counter.builder("graph.references.repaired")
                .description("Number of stale back-references overwritten by the linker")
                .register(registry);
        this.elementsRemovedCounter = Counter.builder("graph.elements.removed")
                .description("Number of empty fields and elements removed by compression")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("graph.batch.size")
                .description("Distribution of instruction batch sizes")
                .register(registry);
    }

    @Override
    public void recordOperationDuration(String operation, boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        String key = operation + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("graph.operation.duration")
                        .description("Duration of graph engine operations")
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementEntityCreated(String collectionKey) {
        String key = "created:" + collectionKey;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("graph.entity.created")
                        .description("Number of entities created by cascades")
                        .tag("collection", collectionKey)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordIdsAssigned(int count) {
        idsAssignedCounter.increment(count);
    }

    @Override
    public void recordReferencesRepaired(int count) {
        referencesRepairedCounter.increment(count);
    }

    @Override
    public void recordElementsRemoved(int count) {
        elementsRemovedCounter.increment(count);
    }

    @Override
    public void incrementWarning(WarningKind kind) {
        String key = "warning:" + kind.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("graph.warnings")
                        .description("Number of warnings raised during normalization")
                        .tag("kind", kind.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }
}
