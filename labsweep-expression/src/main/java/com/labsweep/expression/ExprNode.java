package com.labsweep.expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Abstract syntax tree of a value-list expression. Evaluation only reads literals,
 * names from the {@link FunctionRegistry} and calls to its functions.
 */
interface ExprNode {

    Value eval(EvalContext ctx);

    /** Number, string or boolean literal. */
    record Literal(Value value) implements ExprNode {
        @Override
        public Value eval(EvalContext ctx) {
            return value;
        }
    }

    /** {@code [a, b]} or {@code (a, b)}. */
    record SequenceLiteral(List<ExprNode> elements) implements ExprNode {
        @Override
        public Value eval(EvalContext ctx) {
            List<Value> items = new ArrayList<>(elements.size());
            for (ExprNode e : elements) {
                items.add(e.eval(ctx));
            }
            return Value.sequence(items);
        }
    }

    /** Bare identifier; resolves to a registry constant. */
    record Name(String name) implements ExprNode {
        @Override
        public Value eval(EvalContext ctx) {
            return ctx.registry().constant(name).orElseThrow(() -> ctx.registry().function(name).isPresent()
                    ? EvaluationException.type("function '" + name + "' used without calling it")
                    : EvaluationException.other("name '" + name + "' is not defined"));
        }
    }

    record Call(String name, List<ExprNode> positional, Map<String, ExprNode> keywords) implements ExprNode {
        @Override
        public Value eval(EvalContext ctx) {
            SweepFunction fn = ctx.registry().function(name).orElseThrow(() -> ctx.registry().constant(name).isPresent()
                    ? EvaluationException.type("'" + ctx.registry().constant(name).get().typeName() + "' object is not callable")
                    : EvaluationException.other("name '" + name + "' is not defined"));
            List<Value> args = new ArrayList<>(positional.size());
            for (ExprNode p : positional) {
                args.add(p.eval(ctx));
            }
            Map<String, Value> kwargs = new LinkedHashMap<>();
            for (Map.Entry<String, ExprNode> k : keywords.entrySet()) {
                kwargs.put(k.getKey(), k.getValue().eval(ctx));
            }
            return fn.apply(new FunctionCall(name, args, kwargs, ctx.maxValues()));
        }
    }

    record Unary(Token.Type op, ExprNode operand) implements ExprNode {
        @Override
        public Value eval(EvalContext ctx) {
            Value v = operand.eval(ctx);
            return op == Token.Type.MINUS ? Arithmetic.negate(v) : Arithmetic.plus(v);
        }
    }

    record Binary(Token.Type op, ExprNode left, ExprNode right) implements ExprNode {
        @Override
        public Value eval(EvalContext ctx) {
            return Arithmetic.binary(op, left.eval(ctx), right.eval(ctx), ctx.maxValues());
        }
    }
}
