package com.entity.graph.merge;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dispatch table from inferred type names ({@code ContactInfo}, {@code Address}) to the
 * template a new node of that type starts from. Unknown types start empty.
 */
public final class NodeFactory {

    private final Map<String, ObjectNode> templates;

    private NodeFactory(Map<String, ObjectNode> templates) {
        this.templates = Map.copyOf(templates);
    }

    public static NodeFactory empty() {
        return new NodeFactory(Map.of());
    }

    public ObjectNode create(String typeName) {
        ObjectNode template = typeName != null ? templates.get(typeName) : null;
        return template != null ? template.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    public boolean knows(String typeName) {
        return typeName != null && templates.containsKey(typeName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, ObjectNode> templates = new HashMap<>();

        public Builder register(String typeName, ObjectNode template) {
            Objects.requireNonNull(typeName, "typeName is required");
            Objects.requireNonNull(template, "template is required");
            templates.put(typeName, template.deepCopy());
            return this;
        }

        public NodeFactory build() {
            return new NodeFactory(templates);
        }
    }
}
