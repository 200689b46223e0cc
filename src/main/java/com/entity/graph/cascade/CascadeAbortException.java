package com.entity.graph.cascade;

/**
 * Raised inside a cascade walk when a level cannot be resolved or created. Caught by
 * {@link EntityCascade} and turned into {@link CascadeResult#aborted}.
 */
class CascadeAbortException extends RuntimeException {

    private final int segmentIndex;
    private final PathSegment segment;

    CascadeAbortException(int segmentIndex, PathSegment segment, String message) {
        super(message);
        this.segmentIndex = segmentIndex;
        this.segment = segment;
    }

    int getSegmentIndex() {
        return segmentIndex;
    }

    PathSegment getSegment() {
        return segment;
    }
}
