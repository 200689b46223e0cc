package com.entity.graph.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Per-field hook for {@link RecursiveMerger}. A registered handler fully owns the mutation of
 * its field; the merger does not touch the field afterwards.
 */
@FunctionalInterface
public interface FieldHandler {

    /**
     * @param target the node being updated
     * @param field  the field name the handler is registered for
     * @param value  the value supplied by the patch
     * @param context merge context for warnings and numeric coercion
     */
    void apply(ObjectNode target, String field, JsonNode value, MergeContext context);
}
