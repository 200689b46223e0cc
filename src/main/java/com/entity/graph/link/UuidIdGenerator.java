package com.entity.graph.link;

import java.util.Objects;
import java.util.UUID;

/**
 * Random UUID identifiers with an optional prefix ({@code unit-3f2c...}).
 */
public class UuidIdGenerator implements IdGenerator {

    private final String prefix;

    public UuidIdGenerator() {
        this("");
    }

    public UuidIdGenerator(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix is required");
    }

    @Override
    public String nextId() {
        return prefix + UUID.randomUUID();
    }

    public String getPrefix() {
        return prefix;
    }
}
