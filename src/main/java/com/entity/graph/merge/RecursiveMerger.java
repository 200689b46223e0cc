package com.entity.graph.merge;

import com.entity.graph.core.model.FieldNames;
import com.entity.graph.core.model.GraphStructureException;
import com.entity.graph.core.model.JsonValues;
import com.entity.graph.core.model.WarningKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Applies a partial-update document onto an existing node, in place.
 *
 * <p>For every field of the patch:</p>
 * <ol>
 *   <li>a registered {@link FieldHandler} owns the mutation;</li>
 *   <li>an object value merges recursively into the existing object, or into a freshly
 *       materialized node of the inferred type when the field is absent or null;</li>
 *   <li>anything else overwrites the field (last write wins), with numeric coercion for
 *       fields in the numeric set.</li>
 * </ol>
 *
 * <p>The merge is not transactional. If it fails part-way the target stays partially updated,
 * so callers that need atomicity should merge into a copy.</p>
 */
public class RecursiveMerger {
    private static final Logger log = LoggerFactory.getLogger(RecursiveMerger.class);

    public static final int DEFAULT_MAX_DEPTH = 64;

    private final NodeFactory nodeFactory;
    private final int maxDepth;

    public RecursiveMerger() {
        this(NodeFactory.empty(), DEFAULT_MAX_DEPTH);
    }

    public RecursiveMerger(NodeFactory nodeFactory, int maxDepth) {
        this.nodeFactory = Objects.requireNonNull(nodeFactory, "nodeFactory is required");
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
        this.maxDepth = maxDepth;
    }

    public MergeResult merge(ObjectNode target, ObjectNode patch) {
        return merge(target, patch, Map.of(), Set.of());
    }

    public MergeResult merge(ObjectNode target, ObjectNode patch, Map<String, FieldHandler> handlers) {
        return merge(target, patch, handlers, Set.of());
    }

    /**
     * Merges {@code patch} into {@code target}.
     *
     * @param handlers      field hooks for the top level of the patch only
     * @param numericFields fields coerced to floating point at any level
     * @return the (mutated) target together with any warnings
     * @throws GraphStructureException if the patch nests deeper than the configured limit
     */
    public MergeResult merge(ObjectNode target, ObjectNode patch,
                             Map<String, FieldHandler> handlers, Set<String> numericFields) {
        return merge(target, patch, handlers, numericFields, "");
    }

    /**
     * Same as {@link #merge(ObjectNode, ObjectNode, Map, Set)} for a target that sits at
     * {@code basePath} inside a larger graph. Warning paths are prefixed with it.
     */
    public MergeResult merge(ObjectNode target, ObjectNode patch, Map<String, FieldHandler> handlers,
                             Set<String> numericFields, String basePath) {
        Objects.requireNonNull(target, "target is required");
        MergeContext context = new MergeContext(numericFields, basePath);
        if (patch != null) {
            mergeInto(target, patch, handlers != null ? handlers : Map.of(), context, context.getBasePath(), 0);
        }
        return new MergeResult(target, context.warnings());
    }

    private void mergeInto(ObjectNode target, ObjectNode patch, Map<String, FieldHandler> handlers,
                           MergeContext context, String path, int depth) {
        if (depth > maxDepth) {
            throw GraphStructureException.depthExceeded(path, maxDepth);
        }

        // Snapshot so that merging a node into itself cannot trip over its own iterator
        List<Map.Entry<String, JsonNode>> entries = new ArrayList<>();
        patch.fields().forEachRemaining(entries::add);

        for (Map.Entry<String, JsonNode> entry : entries) {
            String field = entry.getKey();
            JsonNode value = entry.getValue();
            String fieldPath = JsonValues.childPath(path, field);

            FieldHandler handler = handlers.get(field);
            if (handler != null) {
                handler.apply(target, field, value, context);
                continue;
            }

            if (value.isObject()) {
                JsonNode existing = target.get(field);
                if (existing instanceof ObjectNode existingNode) {
                    mergeInto(existingNode, (ObjectNode) value, Map.of(), context, fieldPath, depth + 1);
                } else {
                    if (existing != null && !existing.isNull()) {
                        context.warn(WarningKind.TYPE_MISMATCH, fieldPath,
                                "Replaced " + existing.getNodeType() + " with an object");
                    }
                    String typeName = FieldNames.typeNameOf(field);
                    ObjectNode created = nodeFactory.create(typeName);
                    log.debug("merge.materialize path={} type={}", fieldPath, typeName);
                    target.set(field, created);
                    mergeInto(created, (ObjectNode) value, Map.of(), context, fieldPath, depth + 1);
                }
            } else if (context.isNumericField(field)) {
                target.set(field, context.coerceNumeric(fieldPath, value));
            } else {
                target.set(field, value.deepCopy());
            }
        }
    }
}
