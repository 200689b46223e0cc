package com.entity.graph.core.model;

/**
 * Runtime exception thrown when a graph is malformed: an unexpected value where an object or
 * array was required, or nesting deeper than the configured limit (which is how cycles surface).
 */
public class GraphStructureException extends RuntimeException {

    private final String path;

    public GraphStructureException(String message) {
        this(message, "");
    }

    public GraphStructureException(String message, String path) {
        super(message);
        this.path = path != null ? path : "";
    }

    public GraphStructureException(String message, Throwable cause) {
        super(message, cause);
        this.path = "";
    }

    public String getPath() {
        return path;
    }

    public static GraphStructureException depthExceeded(String path, int maxDepth) {
        return new GraphStructureException(
                "Graph nesting exceeds maximum depth of " + maxDepth + " at '" + path
                        + "' (cyclic reference?)", path);
    }

    public static GraphStructureException unexpectedType(String path, String expected, String actual) {
        return new GraphStructureException(
                "Expected " + expected + " at '" + path + "' but found " + actual, path);
    }
}
