package com.labsweep.expansion;

import com.labsweep.expression.ExpressionEvaluator;
import com.labsweep.sequence.SequenceNode;
import com.labsweep.sequence.SequenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Single pass over the store in pre-order with two buffers per depth:
 * {@code accum[d]} holds the groups produced by nodes at depth {@code d} not yet combined with their
 * parent, {@code pending[d]} holds finished sibling subtrees at depth {@code d}. When the next node
 * is shallower, each finished depth is crossed with its parent's values and moved up one level;
 * when it is a same-depth sibling, the current values move to {@code pending} unchanged.
 */
public final class DepthFoldExpander implements SweepExpander {

    private static final Logger log = LoggerFactory.getLogger(DepthFoldExpander.class);

    private final NodeValues values;

    public DepthFoldExpander(ExpressionEvaluator evaluator) {
        this(evaluator, Map.of());
    }

    /** @param parameterNames display name to procedure key; names not in the map are kept */
    public DepthFoldExpander(ExpressionEvaluator evaluator, Map<String, String> parameterNames) {
        this.values = new NodeValues(evaluator, parameterNames);
    }

    @Override
    public List<RunSpec> expand(SequenceStore store) {
        List<SequenceNode> nodes = store.nodes();
        int depth = store.getMaxDepth();
        List<List<List<ParameterAssignment>>> accum = buffers(depth);
        List<List<List<ParameterAssignment>>> pending = buffers(depth);

        for (int i = 0; i < nodes.size(); i++) {
            SequenceNode node = nodes.get(i);
            int level = node.getLevel();
            for (ParameterAssignment a : values.assignments(node)) {
                accum.get(level).add(List.of(a));
            }
            int nextLevel = i + 1 < nodes.size() ? nodes.get(i + 1).getLevel() : -1;
            if (nextLevel < level) {
                for (int d = level; d > nextLevel; d--) {
                    pending.get(d).addAll(accum.get(d));
                    if (d > 0) {
                        List<List<ParameterAssignment>> up = pending.get(d - 1);
                        for (List<ParameterAssignment> parent : accum.get(d - 1)) {
                            for (List<ParameterAssignment> child : pending.get(d)) {
                                up.add(NodeValues.concat(parent, child));
                            }
                        }
                        pending.get(d).clear();
                        accum.get(d - 1).clear();
                    }
                    accum.get(d).clear();
                }
            } else if (nextLevel == level) {
                pending.get(level).addAll(accum.get(level));
                accum.get(level).clear();
            }
        }

        List<RunSpec> runs = new ArrayList<>(pending.get(0).size());
        for (List<ParameterAssignment> group : pending.get(0)) {
            runs.add(new RunSpec(group));
        }
        log.info("Sweep expanded | expander=fold | nodes={} | runs={}", nodes.size(), runs.size());
        return runs;
    }

    private static List<List<List<ParameterAssignment>>> buffers(int depth) {
        List<List<List<ParameterAssignment>>> buffers = new ArrayList<>(depth);
        for (int d = 0; d < depth; d++) {
            buffers.add(new ArrayList<>());
        }
        return buffers;
    }
}
