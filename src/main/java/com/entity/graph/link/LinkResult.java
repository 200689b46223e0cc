package com.entity.graph.link;

import com.entity.graph.core.model.GraphWarning;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Result of linking a graph: the new graph plus what the linker had to change.
 */
public record LinkResult(
        ObjectNode graph,
        int idsAssigned,
        int referencesCreated,
        int referencesRepaired,
        List<GraphWarning> warnings
) {
    public LinkResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /**
     * Returns true if the input graph was already fully linked.
     */
    public boolean isUnchanged() {
        return idsAssigned == 0 && referencesCreated == 0 && referencesRepaired == 0;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return "LinkResult{" +
                "idsAssigned=" + idsAssigned +
                ", referencesCreated=" + referencesCreated +
                ", referencesRepaired=" + referencesRepaired +
                ", warnings=" + warnings.size() +
                '}';
    }
}
