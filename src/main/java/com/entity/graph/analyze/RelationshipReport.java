package com.entity.graph.analyze;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relationships found in a graph, grouped by the type of the referencing entity in the order
 * the types were first encountered. Types without any outgoing reference are not listed.
 */
public final class RelationshipReport {

    static final String NO_RELATIONSHIPS_NOTE =
            "No explicit ID relationships were found. "
                    + "Infer relationships from the data structure and field names.";

    private final Map<String, List<Relationship>> byType;

    RelationshipReport(Map<String, List<Relationship>> byType) {
        Map<String, List<Relationship>> copy = new LinkedHashMap<>();
        byType.forEach((type, relationships) -> copy.put(type, List.copyOf(relationships)));
        this.byType = Collections.unmodifiableMap(copy);
    }

    public static RelationshipReport empty() {
        return new RelationshipReport(Map.of());
    }

    public Map<String, List<Relationship>> byType() {
        return byType;
    }

    /**
     * Same grouping as {@link #byType()}, with each relationship rendered as a sentence.
     */
    public Map<String, List<String>> descriptions() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        byType.forEach((type, relationships) ->
                result.put(type, relationships.stream().map(Relationship::describe).toList()));
        return result;
    }

    public List<Relationship> forType(String entityType) {
        return byType.getOrDefault(entityType, List.of());
    }

    public List<Relationship> all() {
        List<Relationship> all = new ArrayList<>();
        byType.values().forEach(all::addAll);
        return all;
    }

    public boolean isEmpty() {
        return byType.isEmpty();
    }

    public int size() {
        return byType.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Markdown edge list used to brief a restructuring pass:
     * <pre>
     * ### tenant Relationships:
     * - tenant with ID 't1' references unit with ID 'u1'
     * </pre>
     */
    public String formatSummary() {
        if (byType.isEmpty()) {
            return NO_RELATIONSHIPS_NOTE;
        }
        StringBuilder sb = new StringBuilder();
        byType.forEach((type, relationships) -> {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("### ").append(type).append(" Relationships:\n");
            for (Relationship relationship : relationships) {
                sb.append("- ").append(relationship.describe()).append('\n');
            }
        });
        return sb.toString();
    }

    @Override
    public String toString() {
        return "RelationshipReport{types=" + byType.keySet() + ", relationships=" + size() + '}';
    }
}
