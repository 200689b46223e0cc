package com.entity.graph.instruction;

import com.entity.graph.cascade.PathSegment;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;

/**
 * A structured update already reduced from its source (natural language, a form, another system)
 * to an action, an entity path and the fields to write.
 *
 * <pre>
 * {"action": "update",
 *  "path": [{"collection": "units", "identifier": "B1"}, {"collection": "lease"}],
 *  "fields": {"rentAmount": 1450}}
 * </pre>
 */
public record GraphInstruction(
        @JsonProperty("action") InstructionAction action,
        @JsonProperty("path") List<PathSegment> path,
        @JsonProperty("fields") ObjectNode fields
) {
    @JsonCreator
    public GraphInstruction {
        Objects.requireNonNull(action, "action is required");
        path = path != null ? List.copyOf(path) : List.of();
        fields = fields != null ? fields : JsonNodeFactory.instance.objectNode();
    }

    public static GraphInstruction upsert(List<PathSegment> path, ObjectNode fields) {
        return new GraphInstruction(InstructionAction.UPSERT, path, fields);
    }

    public static GraphInstruction update(List<PathSegment> path, ObjectNode fields) {
        return new GraphInstruction(InstructionAction.UPDATE, path, fields);
    }

    public static GraphInstruction create(List<PathSegment> path, ObjectNode fields) {
        return new GraphInstruction(InstructionAction.CREATE, path, fields);
    }
}
