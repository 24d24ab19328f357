package com.labsweep.sequence;

/**
 * Thrown by {@link SequenceStore#add} when the new node would sit at or beyond the store's maximum depth.
 */
public final class DepthLimitExceededException extends IllegalStateException {

    private final int depth;
    private final int maxDepth;

    public DepthLimitExceededException(int depth, int maxDepth) {
        super(String.format("Depth limit exceeded: node level %d, maximum depth %d (levels 0..%d)",
                depth, maxDepth, maxDepth - 1));
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    public int getDepth() {
        return depth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
