package com.entity.graph.analyze;

import com.entity.graph.core.model.FieldNames;
import com.entity.graph.core.model.GraphStructureException;
import com.entity.graph.core.model.JsonValues;
import com.entity.graph.merge.RecursiveMerger;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a flat edge list of the id references in a graph. Read-only: the graph is not changed.
 *
 * <p>Pass one collects every object carrying an {@code id}, typed by the singular of its enclosing
 * field ({@code tenants} gives {@code tenant}). Pass two emits one {@link Relationship} per
 * non-empty {@code *Id} field of each collected entity.</p>
 */
public class RelationshipAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(RelationshipAnalyzer.class);

    public static final String DEFAULT_ROOT_TYPE = "root";

    private static final String SCALAR_SUFFIX = "Id";
    private static final String LIST_SUFFIX = "Ids";

    private final String idField;
    private final String rootTypeName;
    private final boolean includeListReferences;
    private final int maxDepth;

    public RelationshipAnalyzer() {
        this("id", DEFAULT_ROOT_TYPE, false, RecursiveMerger.DEFAULT_MAX_DEPTH);
    }

    public RelationshipAnalyzer(String idField, String rootTypeName, boolean includeListReferences, int maxDepth) {
        this.idField = Objects.requireNonNull(idField, "idField is required");
        this.rootTypeName = Objects.requireNonNull(rootTypeName, "rootTypeName is required");
        this.includeListReferences = includeListReferences;
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
        this.maxDepth = maxDepth;
    }

    /**
     * @throws GraphStructureException if the graph nests deeper than the configured limit
     */
    public RelationshipReport analyze(ObjectNode graph) {
        Objects.requireNonNull(graph, "graph is required");

        Map<String, Map<String, ObjectNode>> entities = new LinkedHashMap<>();
        collect(graph, rootTypeName, "", 0, entities);

        Map<String, List<Relationship>> relationships = new LinkedHashMap<>();
        entities.forEach((type, byId) -> {
            List<Relationship> found = new ArrayList<>();
            byId.forEach((id, entity) -> relate(type, id, entity, found));
            if (!found.isEmpty()) {
                relationships.put(type, found);
            }
        });

        RelationshipReport report = new RelationshipReport(relationships);
        log.debug("analyze.completed entityTypes={} relationships={}", entities.size(), report.size());
        return report;
    }

    private void collect(JsonNode value, String type, String path, int depth,
                         Map<String, Map<String, ObjectNode>> entities) {
        if (depth > maxDepth) {
            throw GraphStructureException.depthExceeded(path, maxDepth);
        }
        if (value instanceof ObjectNode node) {
            if (JsonValues.isIdentifier(node.get(idField))) {
                // a repeated id replaces the earlier entity but keeps its position
                entities.computeIfAbsent(type, t -> new LinkedHashMap<>())
                        .put(JsonValues.scalarText(node.get(idField)), node);
            }
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (entry.getValue().isContainerNode()) {
                    collect(entry.getValue(), typeOf(entry.getKey()), JsonValues.childPath(path, entry.getKey()),
                            depth + 1, entities);
                }
            }
        } else if (value.isArray()) {
            for (int i = 0; i < value.size(); i++) {
                JsonNode element = value.get(i);
                if (element.isContainerNode()) {
                    collect(element, type, JsonValues.elementPath(path, i), depth + 1, entities);
                }
            }
        }
    }

    private void relate(String type, String id, ObjectNode entity, List<Relationship> found) {
        Iterator<Map.Entry<String, JsonNode>> fields = entity.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String field = entry.getKey();
            JsonNode value = entry.getValue();
            if (isReferenceField(field, SCALAR_SUFFIX) && JsonValues.isIdentifier(value)) {
                found.add(new Relationship(type, id, strip(field, SCALAR_SUFFIX), JsonValues.scalarText(value)));
            } else if (includeListReferences && isReferenceField(field, LIST_SUFFIX) && value.isArray()) {
                for (JsonNode element : value) {
                    if (JsonValues.isIdentifier(element)) {
                        found.add(new Relationship(type, id, strip(field, LIST_SUFFIX), JsonValues.scalarText(element)));
                    }
                }
            }
        }
    }

    private boolean isReferenceField(String field, String suffix) {
        return field.endsWith(suffix) && field.length() > suffix.length() && !field.equals(idField);
    }

    private static String strip(String field, String suffix) {
        return field.substring(0, field.length() - suffix.length());
    }

    private static String typeOf(String field) {
        return FieldNames.singularize(field);
    }
}
