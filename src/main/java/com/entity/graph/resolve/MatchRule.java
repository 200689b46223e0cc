package com.entity.graph.resolve;

/**
 * Matching rules tried by {@link IdentifierResolver}, in precedence order.
 */
public enum MatchRule {
    /**
     * Exact string equality.
     */
    EXACT,

    /**
     * Equality ignoring case.
     */
    CASE_INSENSITIVE,

    /**
     * The last whitespace-delimited token of the key is a suffix of the candidate
     * ("Unit A" finds "Woodbridge Unit A").
     */
    SUFFIX
}
