package com.entity.graph.link;

import com.entity.graph.core.model.FieldNames;
import com.entity.graph.core.model.GraphStructureException;
import com.entity.graph.core.model.GraphWarning;
import com.entity.graph.core.model.JsonValues;
import com.entity.graph.core.model.WarningKind;
import com.entity.graph.merge.RecursiveMerger;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Makes structural nesting and flat id references agree.
 *
 * <p>Every object node gets an {@code id}. Next to every nested object field {@code owner} the
 * linker maintains {@code ownerId}, and next to every list of objects {@code units} it maintains
 * {@code unitIds} in list order. The nested objects are authoritative: stale reference fields are
 * overwritten. The input graph is never modified.</p>
 *
 * <p>Linking is idempotent: linking an already linked graph assigns nothing and repairs nothing.</p>
 */
public class IdReferenceLinker {
    private static final Logger log = LoggerFactory.getLogger(IdReferenceLinker.class);

    private final IdGenerator idGenerator;
    private final String idField;
    private final int maxDepth;

    public IdReferenceLinker() {
        this(new UuidIdGenerator(), "id", RecursiveMerger.DEFAULT_MAX_DEPTH);
    }

    public IdReferenceLinker(IdGenerator idGenerator, String idField, int maxDepth) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator is required");
        this.idField = Objects.requireNonNull(idField, "idField is required");
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Returns a linked copy of {@code graph}.
     */
    public ObjectNode linkIds(ObjectNode graph) {
        return link(graph).graph();
    }

    /**
     * Links a copy of {@code graph} and reports what was assigned, created and repaired.
     *
     * @throws GraphStructureException if the graph nests deeper than the configured limit
     */
    public LinkResult link(ObjectNode graph) {
        Objects.requireNonNull(graph, "graph is required");
        Stats stats = new Stats();
        ObjectNode linked = linkNode(graph, "", 0, stats);
        log.debug("link.completed idsAssigned={} referencesCreated={} referencesRepaired={} conflicts={}",
                stats.idsAssigned, stats.referencesCreated, stats.referencesRepaired, stats.warnings.size());
        return new LinkResult(linked, stats.idsAssigned, stats.referencesCreated,
                stats.referencesRepaired, stats.warnings);
    }

    private ObjectNode linkNode(ObjectNode source, String path, int depth, Stats stats) {
        if (depth > maxDepth) {
            throw GraphStructureException.depthExceeded(path, maxDepth);
        }

        ObjectNode linked = JsonNodeFactory.instance.objectNode();
        if (!source.has(idField)) {
            linked.put(idField, nextId(path, stats));
        }

        List<String> fieldNames = new ArrayList<>();
        source.fieldNames().forEachRemaining(fieldNames::add);
        Set<String> referenceFields = referenceFieldsOf(source, fieldNames);

        for (String field : fieldNames) {
            JsonNode value = source.get(field);
            String fieldPath = JsonValues.childPath(path, field);
            if (referenceFields.contains(field)) {
                // reconciled below, never linked as a child
                linked.set(field, value.deepCopy());
            } else if (field.equals(idField)) {
                if (JsonValues.isIdentifier(value)) {
                    linked.set(field, value.deepCopy());
                } else {
                    linked.put(field, nextId(path, stats));
                }
            } else if (value instanceof ObjectNode child) {
                linked.set(field, linkNode(child, fieldPath, depth + 1, stats));
            } else if (value instanceof ArrayNode list) {
                linked.set(field, linkElements(list, fieldPath, depth + 1, stats));
            } else {
                linked.set(field, value.deepCopy());
            }
        }

        // back-references are derived from the linked children, in source field order
        for (String field : fieldNames) {
            if (field.equals(idField) || referenceFields.contains(field)) {
                continue;
            }
            JsonNode value = linked.get(field);
            if (value.isObject()) {
                reconcileReference(linked, FieldNames.scalarReference(field),
                        value.get(idField).deepCopy(), path, stats);
            } else if (JsonValues.isNodeSequence(value)) {
                ArrayNode ids = JsonNodeFactory.instance.arrayNode();
                for (JsonNode element : value) {
                    ids.add(element.get(idField).deepCopy());
                }
                reconcileReference(linked, FieldNames.listReference(field), ids, path, stats);
            } else if (value.isArray() && value.isEmpty() && linked.has(FieldNames.listReference(field))) {
                // an emptied list must not keep pointing at its former elements
                reconcileReference(linked, FieldNames.listReference(field),
                        JsonNodeFactory.instance.arrayNode(), path, stats);
            }
        }
        return linked;
    }

    /**
     * Back-reference fields of the container fields of {@code source} that are present in it.
     * An empty list counts as a container so that its stale reference list can be cleared.
     */
    private Set<String> referenceFieldsOf(ObjectNode source, List<String> fieldNames) {
        Set<String> references = new HashSet<>();
        for (String field : fieldNames) {
            if (field.equals(idField)) {
                continue;
            }
            JsonNode value = source.get(field);
            String reference = null;
            if (value.isObject()) {
                reference = FieldNames.scalarReference(field);
            } else if (JsonValues.isNodeSequence(value) || (value.isArray() && value.isEmpty())) {
                reference = FieldNames.listReference(field);
            }
            if (reference != null && !reference.equals(field) && source.has(reference)) {
                references.add(reference);
            }
        }
        return references;
    }

    private ArrayNode linkElements(ArrayNode source, String path, int depth, Stats stats) {
        if (depth > maxDepth) {
            throw GraphStructureException.depthExceeded(path, maxDepth);
        }
        ArrayNode linked = JsonNodeFactory.instance.arrayNode();
        for (int i = 0; i < source.size(); i++) {
            JsonNode element = source.get(i);
            String elementPath = JsonValues.elementPath(path, i);
            if (element instanceof ObjectNode node) {
                linked.add(linkNode(node, elementPath, depth + 1, stats));
            } else if (element instanceof ArrayNode nested) {
                linked.add(linkElements(nested, elementPath, depth + 1, stats));
            } else {
                linked.add(element.deepCopy());
            }
        }
        return linked;
    }

    private void reconcileReference(ObjectNode node, String referenceField, JsonNode expected,
                                    String path, Stats stats) {
        JsonNode existing = node.get(referenceField);
        if (existing != null && existing.equals(expected)) {
            return;
        }
        String referencePath = JsonValues.childPath(path, referenceField);
        if (existing == null || JsonValues.isEmpty(existing)) {
            node.set(referenceField, expected);
            stats.referencesCreated++;
        } else if (holdsObjects(existing)) {
            GraphWarning warning = GraphWarning.of(WarningKind.REFERENCE_CONFLICT, referencePath,
                    "Field holds structured data, expected " + expected);
            log.warn("link.conflict {}", warning);
            stats.warnings.add(warning);
        } else {
            log.debug("link.repaired field={} was={} now={}", referencePath, existing, expected);
            node.set(referenceField, expected);
            stats.referencesRepaired++;
        }
    }

    private String nextId(String path, Stats stats) {
        String id = idGenerator.nextId();
        if (id == null || id.isBlank()) {
            throw new IllegalStateException("IdGenerator returned a blank identifier at '" + path + "'");
        }
        stats.idsAssigned++;
        return id;
    }

    private static boolean holdsObjects(JsonNode value) {
        if (value.isObject()) {
            return true;
        }
        if (value.isArray()) {
            for (JsonNode element : value) {
                if (element.isContainerNode()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static final class Stats {
        private int idsAssigned;
        private int referencesCreated;
        private int referencesRepaired;
        private final List<GraphWarning> warnings = new ArrayList<>();
    }
}
