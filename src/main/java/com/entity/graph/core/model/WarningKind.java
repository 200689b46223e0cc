package com.entity.graph.core.model;

/**
 * Categories of data-level problems reported alongside a successful operation.
 */
public enum WarningKind {
    /**
     * A field expected to be numeric could not be parsed and was kept as-is.
     */
    COERCION,

    /**
     * Two values under the same key had incompatible shapes (object, array, scalar).
     */
    TYPE_MISMATCH,

    /**
     * More than one candidate matched an approximate identifier.
     */
    AMBIGUOUS_MATCH,

    /**
     * A back-reference field could not be written because it holds structured data.
     */
    REFERENCE_CONFLICT,

    /**
     * An inherited foreign key had no ancestor to inherit from.
     */
    UNRESOLVED_REFERENCE,

    /**
     * A parent entity was synthesized with a placeholder name.
     */
    PLACEHOLDER_CREATED
}
