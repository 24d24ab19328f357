package com.labsweep.expression;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Turns a user-written value-list expression (e.g. {@code linspace(0, 1, 5)} or {@code [1, 2, 3]})
 * into an ordered list of scalar values.
 * <p>
 * Text is parsed into a syntax tree that can only hold literals, arithmetic and calls to names in the
 * caller-supplied {@link FunctionRegistry}; there is no attribute access, import or reflection path.
 * The result must be a flat sequence; its elements are {@link Long}, {@link Double}, {@link String}
 * or {@link Boolean}. Stateless and safe to share once constructed.
 */
public final class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    /** Default cap on values produced by one expression. */
    public static final int DEFAULT_MAX_VALUES = 1_000_000;

    private final FunctionRegistry registry;
    private final int maxValues;

    /** Evaluator over {@link FunctionRegistry#standard()} with {@value #DEFAULT_MAX_VALUES} values per expression. */
    public ExpressionEvaluator() {
        this(FunctionRegistry.standard(), DEFAULT_MAX_VALUES);
    }

    /**
     * @param registry  allowed functions and constants; copied, later changes are not seen
     * @param maxValues maximum number of values any generator or the final result may hold; must be positive
     */
    public ExpressionEvaluator(FunctionRegistry registry, int maxValues) {
        this.registry = Objects.requireNonNull(registry, "registry").copy();
        if (maxValues <= 0) {
            throw new IllegalArgumentException("maxValues must be positive, got: " + maxValues);
        }
        this.maxValues = maxValues;
    }

    /** Evaluates text outside any sequence tree (parameter unknown, depth -1). */
    public List<Object> evaluate(String text) {
        return evaluate(text, null, -1);
    }

    /**
     * Evaluates text on behalf of a tree node.
     *
     * @param text      expression source
     * @param parameter parameter name of the node, reported in errors
     * @param depth     level of the node, reported in errors
     * @return unmodifiable list of values, possibly empty
     * @throws EvaluationException when the text is empty, malformed, or fails to evaluate to a flat sequence;
     *                             any other exception from a registered function is wrapped as {@code OTHER}
     */
    public List<Object> evaluate(String text, String parameter, int depth) {
        try {
            if (text == null || text.isEmpty()) {
                throw new EvaluationException(EvaluationException.Kind.EMPTY, "no sequence entered");
            }
            Value result = ExpressionParser.parse(text).eval(new EvalContext(registry, maxValues));
            return flatten(result);
        } catch (EvaluationException e) {
            EvaluationException located = e.locate(text, parameter, depth);
            log.warn("Expression evaluation failed | parameter={} | depth={} | kind={} | {}",
                    parameter, depth, e.getKind(), e.getDetail());
            throw located;
        } catch (RuntimeException e) {
            log.warn("Expression evaluation failed | parameter={} | depth={} | function error | {}",
                    parameter, depth, e.toString());
            throw new EvaluationException(EvaluationException.Kind.OTHER, e.toString(), e)
                    .locate(text, parameter, depth);
        } catch (StackOverflowError e) {
            log.warn("Expression evaluation failed | parameter={} | depth={} | nesting too deep", parameter, depth);
            throw new EvaluationException(EvaluationException.Kind.OTHER, "expression nested too deeply")
                    .locate(text, parameter, depth);
        }
    }

    /** Names an expression may refer to. */
    public FunctionRegistry getRegistry() {
        return registry.copy();
    }

    public int getMaxValues() {
        return maxValues;
    }

    private List<Object> flatten(Value result) {
        if (!result.isSequence()) {
            throw EvaluationException.type("expression must produce a sequence of values, got '"
                    + result.typeName() + "' " + result);
        }
        List<Value> items = result.items();
        if (items.size() > maxValues) {
            throw EvaluationException.value("expression produces " + items.size()
                    + " values, more than the limit of " + maxValues);
        }
        List<Object> values = new ArrayList<>(items.size());
        for (Value item : items) {
            if (item.isSequence()) {
                throw EvaluationException.type("expression must produce a flat sequence, found nested " + item);
            }
            values.add(item.toJava());
        }
        return Collections.unmodifiableList(values);
    }
}
