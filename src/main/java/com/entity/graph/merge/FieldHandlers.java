package com.entity.graph.merge;

import com.entity.graph.core.model.WarningKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * Built-in {@link FieldHandler}s.
 */
public final class FieldHandlers {

    private FieldHandlers() {
        // utility class
    }

    /**
     * Appends the patch value to the existing list instead of replacing it. A list value is
     * appended element by element, any other non-null value as a single element. A null
     * value leaves the target untouched.
     */
    public static FieldHandler appendToList() {
        return (target, field, value, context) -> {
            if (value == null || value.isNull()) {
                return;
            }
            JsonNode existing = target.get(field);
            ArrayNode list;
            if (existing instanceof ArrayNode array) {
                list = array;
            } else {
                if (existing != null && !existing.isNull()) {
                    context.warn(WarningKind.TYPE_MISMATCH, context.pathOf(field),
                            "Replaced non-list value of '" + field + "' with a list");
                }
                list = target.putArray(field);
            }
            if (value.isArray()) {
                for (JsonNode element : value) {
                    list.add(element.deepCopy());
                }
            } else {
                list.add(value.deepCopy());
            }
        };
    }

    /**
     * Overwrites the field with the patch value without recursing into it.
     */
    public static FieldHandler replace() {
        return (target, field, value, context) -> target.set(field, value == null ? null : value.deepCopy());
    }
}
