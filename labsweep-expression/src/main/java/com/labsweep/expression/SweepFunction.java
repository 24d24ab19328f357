package com.labsweep.expression;

/**
 * A function callable from a value-list expression. Implementations report bad input by throwing
 * {@link EvaluationException} through the {@link FunctionCall} helpers.
 */
@FunctionalInterface
public interface SweepFunction {

    Value apply(FunctionCall call);
}
