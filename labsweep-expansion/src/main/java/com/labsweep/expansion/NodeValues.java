package com.labsweep.expansion;

import com.labsweep.expression.ExpressionEvaluator;
import com.labsweep.sequence.SequenceNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Evaluates a node's expression into assignments, renaming the parameter through the names map. */
final class NodeValues {

    private final ExpressionEvaluator evaluator;
    private final Map<String, String> parameterNames;

    NodeValues(ExpressionEvaluator evaluator, Map<String, String> parameterNames) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.parameterNames = Map.copyOf(Objects.requireNonNull(parameterNames, "parameterNames"));
    }

    List<ParameterAssignment> assignments(SequenceNode node) {
        List<Object> values = evaluator.evaluate(node.getExpression(), node.getParameter(), node.getLevel());
        String key = parameterNames.getOrDefault(node.getParameter(), node.getParameter());
        List<ParameterAssignment> out = new ArrayList<>(values.size());
        for (Object v : values) {
            out.add(new ParameterAssignment(key, v));
        }
        return out;
    }

    static List<ParameterAssignment> concat(List<ParameterAssignment> head, List<ParameterAssignment> tail) {
        List<ParameterAssignment> group = new ArrayList<>(head.size() + tail.size());
        group.addAll(head);
        group.addAll(tail);
        return group;
    }
}
