package com.entity.graph.merge;

import com.entity.graph.core.model.GraphWarning;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Result of a merge operation: the merged node and any warnings raised on the way.
 */
public record MergeResult(
        ObjectNode node,
        List<GraphWarning> warnings
) {
    public MergeResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
