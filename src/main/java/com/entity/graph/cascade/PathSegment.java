package com.entity.graph.cascade;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One level of a cascade path: the collection to look in and the (approximate) identifier
 * of the entity within it. Single-object slots without an identifying field (e.g. {@code lease})
 * use a null identifier.
 */
public record PathSegment(
        @JsonProperty("collection") String collectionKey,
        @JsonProperty("identifier") String identifier
) {
    @JsonCreator
    public PathSegment {
        Objects.requireNonNull(collectionKey, "collectionKey is required");
    }

    public static PathSegment of(String collectionKey, String identifier) {
        return new PathSegment(collectionKey, identifier);
    }

    public static PathSegment of(String collectionKey) {
        return new PathSegment(collectionKey, null);
    }

    @Override
    public String toString() {
        return identifier != null ? collectionKey + "[" + identifier + "]" : collectionKey;
    }
}
