package com.entity.graph.resolve;

/**
 * How {@link IdentifierResolver} picks among several candidates that only match by suffix.
 */
public enum SuffixMatchPolicy {
    /**
     * Take the first candidate in collection order.
     */
    FIRST,

    /**
     * Take the candidate with the shortest key value, i.e. the one closest to the searched key.
     * Ties keep collection order.
     */
    MOST_SPECIFIC,

    /**
     * Report not-found when more than one candidate matches.
     */
    REJECT_AMBIGUOUS
}
