package com.labsweep.expression;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Arguments of one call, plus the evaluation's value budget. Parameters are bound by position
 * or by keyword.
 */
public final class FunctionCall {

    private final String name;
    private final List<Value> positional;
    private final Map<String, Value> keywords;
    private final int maxValues;

    FunctionCall(String name, List<Value> positional, Map<String, Value> keywords, int maxValues) {
        this.name = name;
        this.positional = List.copyOf(positional);
        this.keywords = Map.copyOf(keywords);
        this.maxValues = maxValues;
    }

    public String getName() {
        return name;
    }

    /** Number of positional arguments. */
    public int size() {
        return positional.size();
    }

    /** Positional argument {@code index}; caller must have checked the arity. */
    public Value get(int index) {
        return positional.get(index);
    }

    /**
     * Checks the call against a parameter list: at most {@code parameterNames.length} arguments in total,
     * at least {@code required}, no unknown or duplicated keyword.
     */
    public FunctionCall bind(int required, String... parameterNames) {
        List<String> names = Arrays.asList(parameterNames);
        for (String keyword : keywords.keySet()) {
            int idx = names.indexOf(keyword);
            if (idx < 0) {
                throw EvaluationException.type(name + "() got an unexpected keyword argument '" + keyword + "'");
            }
            if (idx < positional.size()) {
                throw EvaluationException.type(name + "() got multiple values for argument '" + keyword + "'");
            }
        }
        int total = positional.size() + keywords.size();
        if (positional.size() > names.size()) {
            throw EvaluationException.type(name + "() takes at most " + names.size() + " arguments (" + total + " given)");
        }
        for (int i = 0; i < required; i++) {
            if (i >= positional.size() && !keywords.containsKey(names.get(i))) {
                throw EvaluationException.type(name + "() missing required argument '" + names.get(i) + "'");
            }
        }
        return this;
    }

    /** Rejects keyword arguments. */
    public FunctionCall positionalOnly() {
        if (!keywords.isEmpty()) {
            throw EvaluationException.type(name + "() takes no keyword arguments");
        }
        return this;
    }

    /** Argument bound to {@code parameterName} at {@code position}, if supplied. */
    public Optional<Value> argument(int position, String parameterName) {
        if (position < positional.size()) {
            return Optional.of(positional.get(position));
        }
        return Optional.ofNullable(keywords.get(parameterName));
    }

    /** Maximum number of values any generator in this evaluation may produce. */
    public int maxValues() {
        return maxValues;
    }

    /** Fails with a value error when a generator would exceed the budget. */
    public void checkBudget(long count) {
        if (count > maxValues) {
            throw EvaluationException.value(name + "() would produce " + count
                    + " values, more than the limit of " + maxValues);
        }
    }
}
