package com.labsweep.sequence;

/** Editable fields of a {@link SequenceNode}. Level and position are fixed at creation. */
public enum NodeField {
    PARAMETER,
    EXPRESSION
}
