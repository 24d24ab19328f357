package com.labsweep.expansion;

import com.labsweep.expression.ExpressionEvaluator;
import com.labsweep.sequence.SequenceNode;
import com.labsweep.sequence.SequenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Builds a real tree from the flat store, then expands recursively:
 * a leaf gives one run per value; an inner node gives the product of its values with the
 * concatenated expansions of its children. Produces the same runs as {@link DepthFoldExpander}.
 */
public final class TreeSweepExpander implements SweepExpander {

    private static final Logger log = LoggerFactory.getLogger(TreeSweepExpander.class);

    private final NodeValues values;

    public TreeSweepExpander(ExpressionEvaluator evaluator) {
        this(evaluator, Map.of());
    }

    public TreeSweepExpander(ExpressionEvaluator evaluator, Map<String, String> parameterNames) {
        this.values = new NodeValues(evaluator, parameterNames);
    }

    @Override
    public List<RunSpec> expand(SequenceStore store) {
        List<Branch> roots = buildTree(store.nodes());
        List<RunSpec> runs = new ArrayList<>();
        for (Branch root : roots) {
            for (List<ParameterAssignment> group : expand(root)) {
                runs.add(new RunSpec(group));
            }
        }
        log.info("Sweep expanded | expander=tree | nodes={} | runs={}", store.size(), runs.size());
        return runs;
    }

    private List<List<ParameterAssignment>> expand(Branch branch) {
        List<ParameterAssignment> own = values.assignments(branch.node);
        if (branch.children.isEmpty()) {
            List<List<ParameterAssignment>> leaf = new ArrayList<>(own.size());
            for (ParameterAssignment a : own) {
                leaf.add(List.of(a));
            }
            return leaf;
        }
        List<List<ParameterAssignment>> below = new ArrayList<>();
        for (Branch child : branch.children) {
            below.addAll(expand(child));
        }
        List<List<ParameterAssignment>> out = new ArrayList<>(own.size() * below.size());
        for (ParameterAssignment a : own) {
            for (List<ParameterAssignment> group : below) {
                out.add(NodeValues.concat(List.of(a), group));
            }
        }
        return out;
    }

    /** Rebuilds parent/child links from levels; the list is in pre-order. */
    private static List<Branch> buildTree(List<SequenceNode> nodes) {
        List<Branch> roots = new ArrayList<>();
        Deque<Branch> path = new ArrayDeque<>();
        for (SequenceNode node : nodes) {
            Branch branch = new Branch(node);
            while (!path.isEmpty() && path.peek().node.getLevel() >= node.getLevel()) {
                path.pop();
            }
            if (path.isEmpty()) {
                roots.add(branch);
            } else {
                path.peek().children.add(branch);
            }
            path.push(branch);
        }
        return roots;
    }

    private static final class Branch {
        private final SequenceNode node;
        private final List<Branch> children = new ArrayList<>();

        private Branch(SequenceNode node) {
            this.node = node;
        }
    }
}
