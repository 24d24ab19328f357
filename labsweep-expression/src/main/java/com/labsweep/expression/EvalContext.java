package com.labsweep.expression;

/** Capabilities visible to one evaluation: the allowed names and the value budget. */
record EvalContext(FunctionRegistry registry, int maxValues) {
}
