package com.algebra.simplifier;

/**
 * Thrown by {@link ExpressionSimplifier#simplify} when a sweep reaches the configured recursion depth.
 * Aborts the whole simplification; signals a pathologically deep input tree rather than a condition
 * callers recover from.
 */
public final class RecursionDepthExceededException extends IllegalStateException {

    private final int depth;
    private final int limit;

    public RecursionDepthExceededException(int depth, int limit) {
        super(String.format("Recursion depth exceeded (depth=%d, limit=%d)", depth, limit));
        this.depth = depth;
        this.limit = limit;
    }

    public int getDepth() {
        return depth;
    }

    public int getLimit() {
        return limit;
    }
}
