package com.labsweep.expansion;

import com.labsweep.sequence.SequenceStore;

import java.util.List;

/**
 * Turns a sequence forest into the ordered list of runs it describes. A child subtree is crossed
 * with its parent's values; sibling subtrees and root blocks are concatenated.
 */
public interface SweepExpander {

    /**
     * Expands the current contents of {@code store}. Pure: repeated calls give equal results.
     *
     * @throws com.labsweep.expression.EvaluationException when any node's expression fails; no partial result is returned
     */
    List<RunSpec> expand(SequenceStore store);
}
