package com.entity.graph.resolve;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * An entity located by {@link IdentifierResolver}.
 *
 * @param node  the matched node (live, not a copy)
 * @param index position in the collection, or -1 for a single-object slot
 * @param rule  the rule that produced the match
 */
public record ResolvedEntity(ObjectNode node, int index, MatchRule rule) {

    public ResolvedEntity {
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(rule, "rule is required");
    }

    public boolean isExact() {
        return rule == MatchRule.EXACT;
    }
}
