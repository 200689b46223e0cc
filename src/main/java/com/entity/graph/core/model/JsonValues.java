package com.entity.graph.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Shared value predicates for graph nodes.
 *
 * <p>"Empty" means: absent, JSON null, blank string, empty array, empty object or numeric zero.
 * Booleans are never empty.</p>
 */
public final class JsonValues {

    private JsonValues() {
        // utility class
    }

    public static boolean isEmpty(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return true;
        }
        if (value.isTextual()) {
            return value.textValue().isBlank();
        }
        if (value.isContainerNode()) {
            return value.size() == 0;
        }
        if (value.isNumber()) {
            return isZero(value);
        }
        return false;
    }

    /**
     * Returns the identifier text of a scalar (string or number), or null for anything else.
     */
    public static String scalarText(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isNumber()) {
            return value.asText();
        }
        return null;
    }

    /**
     * Returns true when the value can serve as an identifier: a non-blank string or a number.
     */
    public static boolean isIdentifier(JsonNode value) {
        String text = scalarText(value);
        return text != null && !text.isBlank();
    }

    /**
     * Returns true for a non-empty array whose elements are all objects.
     */
    public static boolean isNodeSequence(JsonNode value) {
        if (value == null || !value.isArray() || value.isEmpty()) {
            return false;
        }
        for (JsonNode element : value) {
            if (!element.isObject()) {
                return false;
            }
        }
        return true;
    }

    public static String childPath(String parent, String field) {
        return parent == null || parent.isEmpty() ? field : parent + "." + field;
    }

    public static String elementPath(String parent, int index) {
        return (parent == null ? "" : parent) + "[" + index + "]";
    }

    private static boolean isZero(JsonNode number) {
        if (number.isIntegralNumber()) {
            return number.bigIntegerValue().signum() == 0;
        }
        if (number.isBigDecimal()) {
            return number.decimalValue().signum() == 0;
        }
        return number.doubleValue() == 0.0d;
    }
}
