package com.labsweep.expansion;

import com.labsweep.sequence.SequenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Expands a store and submits every run to a {@link RunQueue}. The whole sweep is expanded before
 * the first submission, so an evaluation failure submits nothing.
 */
public final class SweepDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SweepDispatcher.class);

    private final SweepExpander expander;
    private final RunQueue queue;

    public SweepDispatcher(SweepExpander expander, RunQueue queue) {
        this.expander = Objects.requireNonNull(expander, "expander");
        this.queue = Objects.requireNonNull(queue, "queue");
    }

    /**
     * @return the runs submitted, in order
     * @throws com.labsweep.expression.EvaluationException when any node fails to evaluate
     */
    public List<RunSpec> dispatch(SequenceStore store) {
        List<RunSpec> runs = expander.expand(store);
        log.info("Queuing {} runs", runs.size());
        for (RunSpec run : runs) {
            queue.submit(run.toParameters());
        }
        return runs;
    }
}
