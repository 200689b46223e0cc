package com.entity.graph.core.model;

import java.util.Objects;

/**
 * A non-fatal problem found while transforming a graph.
 *
 * @param kind    category of the problem
 * @param path    dotted path of the affected field ({@code units[0].lease.rentAmount}), empty for the root
 * @param message human-readable description
 */
public record GraphWarning(WarningKind kind, String path, String message) {

    public GraphWarning {
        Objects.requireNonNull(kind, "kind is required");
        path = path != null ? path : "";
        message = message != null ? message : "";
    }

    public static GraphWarning of(WarningKind kind, String path, String message) {
        return new GraphWarning(kind, path, message);
    }

    @Override
    public String toString() {
        return kind + "(" + (path.isEmpty() ? "<root>" : path) + "): " + message;
    }
}
