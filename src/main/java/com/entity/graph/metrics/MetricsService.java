package com.entity.graph.metrics;

import com.entity.graph.core.model.WarningKind;

import java.time.Duration;

/**
 * Interface for recording graph normalization metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordOperationDuration(String operation, boolean success, Duration duration);

    void incrementEntityCreated(String collectionKey);

    void recordIdsAssigned(int count);

    void recordReferencesRepaired(int count);

    void recordElementsRemoved(int count);

    void incrementWarning(WarningKind kind);

    void recordBatchSize(int size);
}
