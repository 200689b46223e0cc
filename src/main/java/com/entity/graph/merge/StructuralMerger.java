package com.entity.graph.merge;

import com.entity.graph.core.model.GraphStructureException;
import com.entity.graph.core.model.GraphWarning;
import com.entity.graph.core.model.JsonValues;
import com.entity.graph.core.model.WarningKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Combines two independently produced graphs with fill-empty-only semantics: a non-empty value
 * of the base graph is never overwritten, only absent or empty fields are filled from the
 * incoming graph. Lists of objects are merged by deduplicating on a key field.
 *
 * <p>Neither input is modified; the result is built on a deep copy of the base.</p>
 */
public class StructuralMerger {
    private static final Logger log = LoggerFactory.getLogger(StructuralMerger.class);

    public static final String DEFAULT_KEY_FIELD = "id";

    private final String defaultKeyField;
    private final int maxDepth;

    public StructuralMerger() {
        this(DEFAULT_KEY_FIELD, RecursiveMerger.DEFAULT_MAX_DEPTH);
    }

    public StructuralMerger(String defaultKeyField, int maxDepth) {
        this.defaultKeyField = Objects.requireNonNull(defaultKeyField, "defaultKeyField is required");
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
        this.maxDepth = maxDepth;
    }

    public MergeResult merge(ObjectNode base, ObjectNode incoming) {
        return merge(base, incoming, defaultKeyField);
    }

    /**
     * Merges {@code incoming} into a copy of {@code base}.
     *
     * @param keyField field identifying list elements for deduplication
     * @throws GraphStructureException if either graph nests deeper than the configured limit
     */
    public MergeResult merge(ObjectNode base, ObjectNode incoming, String keyField) {
        Objects.requireNonNull(base, "base is required");
        Objects.requireNonNull(keyField, "keyField is required");
        ObjectNode merged = base.deepCopy();
        List<GraphWarning> warnings = new ArrayList<>();
        if (incoming != null) {
            mergeObjects(merged, incoming, keyField, "", 0, warnings);
        }
        log.debug("structuralMerge.completed fields={} warnings={}", merged.size(), warnings.size());
        return new MergeResult(merged, warnings);
    }

    /**
     * Merges two lists on their own. Objects sharing a key are merged field-wise; objects without
     * a key are always appended; scalar elements are appended unless already present.
     */
    public ArrayNode mergeLists(ArrayNode base, ArrayNode incoming, String keyField) {
        Objects.requireNonNull(base, "base is required");
        ArrayNode merged = base.deepCopy();
        if (incoming != null) {
            mergeListsInto(merged, incoming, keyField, "", 0, new ArrayList<>());
        }
        return merged;
    }

    private void mergeObjects(ObjectNode into, ObjectNode incoming, String keyField,
                              String path, int depth, List<GraphWarning> warnings) {
        if (depth > maxDepth) {
            throw GraphStructureException.depthExceeded(path, maxDepth);
        }

        List<Map.Entry<String, JsonNode>> entries = new ArrayList<>();
        incoming.fields().forEachRemaining(entries::add);

        for (Map.Entry<String, JsonNode> entry : entries) {
            String field = entry.getKey();
            JsonNode value = entry.getValue();
            String fieldPath = JsonValues.childPath(path, field);
            JsonNode current = into.get(field);

            if (value instanceof ArrayNode incomingList && replacesWithList(current, incomingList)) {
                mergeListsInto(into.putArray(field), incomingList, keyField, fieldPath, depth + 1, warnings);
            } else if (current == null) {
                into.set(field, value.deepCopy());
            } else if (current instanceof ObjectNode currentNode && value.isObject()) {
                mergeObjects(currentNode, (ObjectNode) value, keyField, fieldPath, depth + 1, warnings);
            } else if (current instanceof ArrayNode currentList && value.isArray()) {
                mergeListsInto(currentList, (ArrayNode) value, keyField, fieldPath, depth + 1, warnings);
            } else if (JsonValues.isEmpty(current)) {
                if (!JsonValues.isEmpty(value)) {
                    into.set(field, value.deepCopy());
                }
            } else if (!JsonValues.isEmpty(value) && shapeOf(current) != shapeOf(value)) {
                GraphWarning warning = GraphWarning.of(WarningKind.TYPE_MISMATCH, fieldPath,
                        "Kept base " + current.getNodeType() + " over incoming " + value.getNodeType());
                log.warn("structuralMerge.conflict {}", warning);
                warnings.add(warning);
            }
        }
    }

    private void mergeListsInto(ArrayNode into, ArrayNode incoming, String keyField,
                                String path, int depth, List<GraphWarning> warnings) {
        if (depth > maxDepth) {
            throw GraphStructureException.depthExceeded(path, maxDepth);
        }

        Map<String, ObjectNode> byKey = new HashMap<>();
        Set<JsonNode> scalars = new HashSet<>();
        for (JsonNode element : into) {
            if (element instanceof ObjectNode node) {
                String key = keyOf(node, keyField);
                if (key != null) {
                    byKey.putIfAbsent(key, node);
                }
            } else if (element.isValueNode()) {
                scalars.add(element);
            }
        }

        int appended = 0;
        int merged = 0;
        for (int i = 0; i < incoming.size(); i++) {
            JsonNode element = incoming.get(i);
            if (element instanceof ObjectNode node) {
                String key = keyOf(node, keyField);
                ObjectNode existing = key != null ? byKey.get(key) : null;
                if (existing != null) {
                    mergeObjects(existing, node, keyField, JsonValues.elementPath(path, i), depth + 1, warnings);
                    merged++;
                } else {
                    ObjectNode copy = node.deepCopy();
                    into.add(copy);
                    if (key != null) {
                        byKey.put(key, copy);
                    }
                    appended++;
                }
            } else if (element.isValueNode()) {
                if (scalars.add(element)) {
                    into.add(element);
                    appended++;
                }
            } else {
                into.add(element.deepCopy());
                appended++;
            }
        }
        log.debug("structuralMerge.list path={} appended={} merged={}", path, appended, merged);
    }

    /**
     * True when an incoming list takes the place of the base value: the base has no value,
     * or an empty one that is not itself a list.
     */
    private static boolean replacesWithList(JsonNode current, ArrayNode incoming) {
        if (current == null) {
            return true;
        }
        return !current.isArray() && JsonValues.isEmpty(current) && !JsonValues.isEmpty(incoming);
    }

    private static String keyOf(ObjectNode node, String keyField) {
        JsonNode key = node.get(keyField);
        return JsonValues.isIdentifier(key) ? JsonValues.scalarText(key) : null;
    }

    private static Shape shapeOf(JsonNode value) {
        if (value.isObject()) {
            return Shape.OBJECT;
        }
        if (value.isArray()) {
            return Shape.ARRAY;
        }
        return Shape.SCALAR;
    }

    private enum Shape {
        OBJECT, ARRAY, SCALAR
    }
}
