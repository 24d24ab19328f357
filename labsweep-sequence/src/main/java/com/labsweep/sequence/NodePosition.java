package com.labsweep.sequence;

/**
 * A node and its 0-based index among its parent's children (or among the roots).
 * {@code node} is null with {@code childIndex} -1 when there is no such node, e.g. the parent of a root.
 */
public record NodePosition(SequenceNode node, int childIndex) {

    static final NodePosition NONE = new NodePosition(null, -1);

    public boolean isPresent() {
        return node != null;
    }
}
