package com.labsweep.sequence;

import java.util.Objects;

/** Immutable content of one node: what a sequence file line holds. */
public record SequenceEntry(int level, String parameter, String expression) {

    public SequenceEntry {
        if (level < 0) {
            throw new IllegalArgumentException("level must be non-negative, got: " + level);
        }
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(expression, "expression");
    }
}
