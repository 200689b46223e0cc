package com.entity.graph.link;

/**
 * Source of fresh entity identifiers. Identifiers must be unique within the process;
 * they need not be cryptographically strong.
 */
@FunctionalInterface
public interface IdGenerator {

    String nextId();
}
