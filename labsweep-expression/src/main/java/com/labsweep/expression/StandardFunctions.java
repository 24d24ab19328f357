package com.labsweep.expression;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * The default function set: sequence generators ({@code range}, {@code arange}, {@code linspace}),
 * {@code sorted}, {@code list}, {@code bool}, element-wise math and the constants {@code pi} and {@code e}.
 */
final class StandardFunctions {

    private StandardFunctions() {
    }

    static void registerAll(FunctionRegistry r) {
        r.register("range", StandardFunctions::range);
        r.register("arange", StandardFunctions::arange);
        r.register("linspace", StandardFunctions::linspace);
        r.register("sorted", StandardFunctions::sorted);
        r.register("list", StandardFunctions::list);
        r.register("bool", StandardFunctions::bool);

        unary(r, "sin", Math::sin);
        unary(r, "cos", Math::cos);
        unary(r, "tan", Math::tan);
        unary(r, "arcsin", domain(Math::asin, -1, 1));
        unary(r, "arccos", domain(Math::acos, -1, 1));
        unary(r, "arctan", Math::atan);
        unary(r, "sinh", Math::sinh);
        unary(r, "cosh", Math::cosh);
        unary(r, "tanh", Math::tanh);
        unary(r, "exp", Math::exp);
        unary(r, "log", Math::log);
        unary(r, "log10", Math::log10);
        unary(r, "sqrt", Math::sqrt);
        unary(r, "fabs", Math::abs);
        unary(r, "ceil", Math::ceil);
        unary(r, "floor", Math::floor);
        unary(r, "degrees", Math::toDegrees);
        unary(r, "radians", Math::toRadians);

        binary(r, "arctan2", Math::atan2);
        binary(r, "hypot", Math::hypot);
        binary(r, "fmod", (a, b) -> a % b);
        r.register("power", StandardFunctions::power);
        r.register("ldexp", StandardFunctions::ldexp);

        r.constant("pi", Value.of(Math.PI));
        r.constant("e", Value.of(Math.E));
    }

    /** range(stop), range(start, stop[, step]); integers only. */
    static Value range(FunctionCall call) {
        call.positionalOnly();
        if (call.size() == 0 || call.size() > 3) {
            throw EvaluationException.type("range expected 1 to 3 arguments, got " + call.size());
        }
        long start = 0;
        long stop;
        long step = 1;
        if (call.size() == 1) {
            stop = call.get(0).asLong();
        } else {
            start = call.get(0).asLong();
            stop = call.get(1).asLong();
            if (call.size() == 3) step = call.get(2).asLong();
        }
        if (step == 0) {
            throw EvaluationException.value("range() arg 3 must not be zero");
        }
        long count = countSteps(start, stop, step);
        call.checkBudget(count);
        List<Value> out = new ArrayList<>((int) count);
        for (long k = 0; k < count; k++) {
            out.add(Value.of(start + k * step));
        }
        return Value.sequence(out);
    }

    /** arange([start,] stop[, step]); integral when every argument is integral, real otherwise. */
    static Value arange(FunctionCall call) {
        call.bind(1, "start", "stop", "step");
        if (call.size() == 0 || call.size() < 2 && call.argument(1, "stop").isPresent()) {
            throw EvaluationException.type("arange() takes start and stop as positional arguments");
        }
        Value startArg = call.size() >= 2 ? call.get(0) : Value.of(0L);
        Value stopArg = call.size() >= 2 ? call.get(1) : call.get(0);
        Value stepArg = call.argument(2, "step").orElse(Value.of(1L));
        requireScalar(startArg, "arange");
        requireScalar(stopArg, "arange");
        requireScalar(stepArg, "arange");
        if (stepArg.asDouble() == 0.0) {
            throw EvaluationException.value("arange() step must not be zero");
        }
        if (startArg.isIntegral() && stopArg.isIntegral() && stepArg.isIntegral()) {
            long start = startArg.asLong();
            long step = stepArg.asLong();
            long count = countSteps(start, stopArg.asLong(), step);
            call.checkBudget(count);
            List<Value> out = new ArrayList<>((int) count);
            for (long k = 0; k < count; k++) {
                out.add(Value.of(start + k * step));
            }
            return Value.array(out);
        }
        double start = startArg.asDouble();
        double step = stepArg.asDouble();
        double span = Math.ceil((stopArg.asDouble() - start) / step);
        long count = span > 0 ? (long) span : 0L;
        call.checkBudget(count);
        List<Value> out = new ArrayList<>((int) count);
        for (long k = 0; k < count; k++) {
            out.add(Value.of(start + k * step));
        }
        return Value.array(out);
    }

    /** linspace(start, stop, num=50, endpoint=True); always real. */
    static Value linspace(FunctionCall call) {
        call.bind(2, "start", "stop", "num", "endpoint");
        Value startArg = call.argument(0, "start").orElseThrow();
        Value stopArg = call.argument(1, "stop").orElseThrow();
        Value numArg = call.argument(2, "num").orElse(Value.of(50L));
        boolean endpoint = call.argument(3, "endpoint").map(Value::truthy).orElse(true);
        requireScalar(startArg, "linspace");
        requireScalar(stopArg, "linspace");
        if (numArg.isSequence() || !numArg.isIntegral()) {
            throw EvaluationException.type("linspace() num must be an integer, not '" + numArg.typeName() + "'");
        }
        long num = numArg.asLong();
        if (num < 0) {
            throw EvaluationException.value("Number of samples, " + num + ", must be non-negative.");
        }
        call.checkBudget(num);
        double start = startArg.asDouble();
        double stop = stopArg.asDouble();
        long divisions = endpoint ? num - 1 : num;
        double step = divisions > 0 ? (stop - start) / divisions : 0.0;
        List<Value> out = new ArrayList<>((int) num);
        for (long k = 0; k < num; k++) {
            out.add(Arithmetic.real(start + k * step));
        }
        if (endpoint && num > 1) {
            out.set((int) num - 1, Arithmetic.real(stop));
        }
        return Value.array(out);
    }

    /** sorted(iterable, reverse=False); numbers and strings cannot be mixed. */
    static Value sorted(FunctionCall call) {
        call.bind(1, "iterable", "reverse");
        List<Value> items = new ArrayList<>(iterable(call.argument(0, "iterable").orElseThrow()));
        boolean reverse = call.argument(1, "reverse").map(Value::truthy).orElse(false);
        boolean anyString = items.stream().anyMatch(Value::isString);
        boolean anyOther = items.stream().anyMatch(v -> !v.isString());
        if (anyString && anyOther) {
            throw EvaluationException.type("'<' not supported between instances of 'str' and a number");
        }
        Comparator<Value> order;
        if (anyString) {
            order = Comparator.comparing(Value::asString);
        } else {
            for (Value v : items) {
                if (v.isSequence() || !v.isNumeric()) {
                    throw EvaluationException.type("'<' not supported for '" + v.typeName() + "'");
                }
            }
            order = Comparator.comparingDouble(Value::asDouble);
        }
        items.sort(reverse ? order.reversed() : order);
        return Value.sequence(items);
    }

    /** list(iterable); a string becomes its characters. */
    static Value list(FunctionCall call) {
        call.bind(0, "iterable");
        return call.argument(0, "iterable")
                .map(v -> Value.sequence(iterable(v)))
                .orElse(Value.sequence(List.of()));
    }

    static Value bool(FunctionCall call) {
        call.bind(0, "x");
        return Value.of(call.argument(0, "x").map(Value::truthy).orElse(false));
    }

    /** power(x1, x2); element-wise, integral for integral inputs, negative integer exponents rejected. */
    static Value power(FunctionCall call) {
        call.bind(2, "x1", "x2");
        return Arithmetic.zip(call.argument(0, "x1").orElseThrow(), call.argument(1, "x2").orElseThrow(), (x, y) -> {
            requireNumber(x, "power");
            requireNumber(y, "power");
            if (x.isIntegral() && y.isIntegral() && y.asLong() < 0) {
                throw EvaluationException.value("Integers to negative integer powers are not allowed.");
            }
            return Arithmetic.power(x, y);
        });
    }

    /** ldexp(x1, x2) = x1 * 2**x2 with an integral exponent. */
    static Value ldexp(FunctionCall call) {
        call.bind(2, "x1", "x2");
        return Arithmetic.zip(call.argument(0, "x1").orElseThrow(), call.argument(1, "x2").orElseThrow(), (x, y) -> {
            requireNumber(x, "ldexp");
            if (!y.isIntegral()) {
                throw EvaluationException.type("ldexp() exponent must be an integer, not '" + y.typeName() + "'");
            }
            long exp = y.asLong();
            int scale = (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, exp));
            return Arithmetic.real(Math.scalb(x.asDouble(), scale));
        });
    }

    private static void unary(FunctionRegistry r, String name, DoubleUnaryOperator op) {
        r.register(name, call -> {
            call.bind(1, "x");
            return Arithmetic.map(call.argument(0, "x").orElseThrow(), v -> {
                requireNumber(v, name);
                return Arithmetic.real(op.applyAsDouble(v.asDouble()));
            });
        });
    }

    private static void binary(FunctionRegistry r, String name, DoubleBinaryOperator op) {
        r.register(name, call -> {
            call.bind(2, "x1", "x2");
            return Arithmetic.zip(call.argument(0, "x1").orElseThrow(), call.argument(1, "x2").orElseThrow(), (x, y) -> {
                requireNumber(x, name);
                requireNumber(y, name);
                return Arithmetic.real(op.applyAsDouble(x.asDouble(), y.asDouble()));
            });
        });
    }

    /** Rejects arguments outside [lo, hi] instead of producing NaN. */
    private static DoubleUnaryOperator domain(DoubleUnaryOperator op, double lo, double hi) {
        return x -> {
            if (x < lo || x > hi) {
                throw EvaluationException.value("math domain error: " + x + " is outside [" + lo + ", " + hi + "]");
            }
            return op.applyAsDouble(x);
        };
    }

    private static List<Value> iterable(Value v) {
        if (v.isString()) {
            List<Value> chars = new ArrayList<>();
            v.asString().codePoints().forEach(cp -> chars.add(Value.of(new String(Character.toChars(cp)))));
            return chars;
        }
        return v.items();
    }

    /** Number of values in {@code start, start+step, ...} strictly before {@code stop}; saturates on overflow. */
    private static long countSteps(long start, long stop, long step) {
        try {
            long span = Math.subtractExact(stop, start);
            if (step > 0) {
                return span <= 0 ? 0L : (span - 1) / step + 1;
            }
            return span >= 0 ? 0L : Math.negateExact(span + 1) / Math.negateExact(step) + 1;
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static void requireScalar(Value v, String fn) {
        if (v.isSequence() || !v.isNumeric()) {
            throw EvaluationException.type(fn + "() argument must be a number, not '" + v.typeName() + "'");
        }
    }

    private static void requireNumber(Value v, String fn) {
        if (!v.isNumeric()) {
            throw EvaluationException.type("ufunc '" + fn + "' not supported for the input type '" + v.typeName() + "'");
        }
    }
}
