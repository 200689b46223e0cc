package com.entity.graph.cascade;

import com.entity.graph.core.model.GraphWarning;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Result of an {@link EntityCascade} operation.
 *
 * @param success             whether the operation completed
 * @param entity              the leaf entity after the update (live node inside the graph)
 * @param createdSegments     levels that had to be created, outermost first
 * @param warnings            data-level problems encountered along the way
 * @param failedSegmentIndex  index in the path of the level that failed, or -1
 * @param failedSegment       the level that failed, or null
 * @param errorMessage        why the operation failed, or null
 */
public record CascadeResult(
        boolean success,
        ObjectNode entity,
        List<PathSegment> createdSegments,
        List<GraphWarning> warnings,
        int failedSegmentIndex,
        PathSegment failedSegment,
        String errorMessage
) {
    public CascadeResult {
        createdSegments = createdSegments != null ? List.copyOf(createdSegments) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static CascadeResult success(ObjectNode entity, List<PathSegment> createdSegments,
                                        List<GraphWarning> warnings) {
        return new CascadeResult(true, entity, createdSegments, warnings, -1, null, null);
    }

    /**
     * Creates a result for a cascade that stopped at {@code segmentIndex} without changing the graph.
     */
    public static CascadeResult aborted(int segmentIndex, PathSegment segment, String errorMessage) {
        return new CascadeResult(false, null, List.of(), List.of(), segmentIndex, segment, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * True when at least one level, possibly the leaf, was created.
     */
    public boolean createdEntities() {
        return !createdSegments.isEmpty();
    }
}
