package com.entity.graph.metrics;

import com.entity.graph.core.model.WarningKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordOperationDuration(String operation, boolean success, Duration duration) {
    }

    @Override
    public void incrementEntityCreated(String collectionKey) {
    }

    @Override
    public void recordIdsAssigned(int count) {
    }

    @Override
    public void recordReferencesRepaired(int count) {
    }

    @Override
    public void recordElementsRemoved(int count) {
    }

    @Override
    public void incrementWarning(WarningKind kind) {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
