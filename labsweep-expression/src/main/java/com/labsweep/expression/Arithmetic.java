package com.labsweep.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

/**
 * Operators on values. Integer operands give integer results except for '/'; '//' and '%' round
 * toward negative infinity. Arrays combine element-wise with scalars or with sequences of the same
 * length. Lists only support {@code list + list} (concatenation) and {@code list * int} (repetition).
 */
final class Arithmetic {

    private Arithmetic() {
    }

    static Value negate(Value v) {
        requireNotList(v, "unary -");
        return map(v, x -> {
            requireNumeric(x, "-");
            if (x.isIntegral()) {
                try {
                    return Value.of(Math.negateExact(x.asLong()));
                } catch (ArithmeticException e) {
                    throw EvaluationException.value("integer overflow");
                }
            }
            return Value.of(-x.asDouble());
        });
    }

    static Value plus(Value v) {
        requireNotList(v, "unary +");
        return map(v, x -> {
            requireNumeric(x, "+");
            return x.isBoolean() ? Value.of(x.asLong()) : x;
        });
    }

    /**
     * @param maxValues cap on the length of a repeated list
     */
    static Value binary(Token.Type op, Value a, Value b, int maxValues) {
        if (a.isArray() || b.isArray() || (!a.isSequence() && !b.isSequence())) {
            return zip(a, b, (x, y) -> scalar(op, x, y));
        }
        if (op == Token.Type.PLUS) {
            if (a.isList() && b.isList()) {
                List<Value> out = new ArrayList<>(a.items().size() + b.items().size());
                out.addAll(a.items());
                out.addAll(b.items());
                return Value.sequence(out);
            }
            Value other = a.isList() ? b : a;
            throw EvaluationException.type("can only concatenate list (not '" + other.typeName() + "') to list");
        }
        if (op == Token.Type.STAR) {
            Value list = a.isList() ? a : b;
            Value count = a.isList() ? b : a;
            if (!count.isSequence() && count.isIntegral()) {
                return repeat(list, count.asLong(), maxValues);
            }
            throw EvaluationException.type("can't multiply sequence by non-int of type '" + count.typeName() + "'");
        }
        throw EvaluationException.type("unsupported operand type(s) for " + symbol(op) + ": '"
                + a.typeName() + "' and '" + b.typeName() + "'");
    }

    private static Value repeat(Value list, long times, int maxValues) {
        int size = list.items().size();
        if (times <= 0 || size == 0) {
            return Value.sequence(List.of());
        }
        if (times > maxValues / size) {
            throw EvaluationException.value("list repetition would produce more than " + maxValues + " values");
        }
        List<Value> out = new ArrayList<>((int) (size * times));
        for (long i = 0; i < times; i++) {
            out.addAll(list.items());
        }
        return Value.sequence(out);
    }

    /** Applies {@code fn} to every scalar of {@code v}; sequences come back as arrays. */
    static Value map(Value v, UnaryOperator<Value> fn) {
        if (!v.isSequence()) {
            return fn.apply(v);
        }
        List<Value> out = new ArrayList<>(v.items().size());
        for (Value item : v.items()) {
            out.add(map(item, fn));
        }
        return Value.array(out);
    }

    /** Broadcasts {@code fn} over two values: scalar with scalar, scalar with sequence, or equal-length sequences. */
    static Value zip(Value a, Value b, BinaryOperator<Value> fn) {
        if (!a.isSequence() && !b.isSequence()) {
            return fn.apply(a, b);
        }
        if (a.isSequence() && b.isSequence()) {
            List<Value> left = a.items();
            List<Value> right = b.items();
            if (left.size() != right.size()) {
                throw EvaluationException.value("operands could not be broadcast together with shapes ("
                        + left.size() + ",) (" + right.size() + ",)");
            }
            List<Value> out = new ArrayList<>(left.size());
            for (int i = 0; i < left.size(); i++) {
                out.add(zip(left.get(i), right.get(i), fn));
            }
            return Value.array(out);
        }
        List<Value> out = new ArrayList<>();
        if (a.isSequence()) {
            for (Value item : a.items()) out.add(zip(item, b, fn));
        } else {
            for (Value item : b.items()) out.add(zip(a, item, fn));
        }
        return Value.array(out);
    }

    private static Value scalar(Token.Type op, Value x, Value y) {
        if (op == Token.Type.PLUS && x.isString() && y.isString()) {
            return Value.of(x.asString() + y.asString());
        }
        String symbol = symbol(op);
        requireNumeric(x, symbol);
        requireNumeric(y, symbol);
        boolean integral = x.isIntegral() && y.isIntegral();
        try {
            switch (op) {
                case PLUS:
                    return integral ? Value.of(Math.addExact(x.asLong(), y.asLong())) : real(x.asDouble() + y.asDouble());
                case MINUS:
                    return integral ? Value.of(Math.subtractExact(x.asLong(), y.asLong())) : real(x.asDouble() - y.asDouble());
                case STAR:
                    return integral ? Value.of(Math.multiplyExact(x.asLong(), y.asLong())) : real(x.asDouble() * y.asDouble());
                case SLASH:
                    requireNonZero(y);
                    return real(x.asDouble() / y.asDouble());
                case DOUBLE_SLASH:
                    requireNonZero(y);
                    return integral ? Value.of(Math.floorDiv(x.asLong(), y.asLong())) : real(Math.floor(x.asDouble() / y.asDouble()));
                case PERCENT:
                    requireNonZero(y);
                    if (integral) return Value.of(Math.floorMod(x.asLong(), y.asLong()));
                    double a = x.asDouble();
                    double b = y.asDouble();
                    return real(a - b * Math.floor(a / b));
                case POWER:
                    return power(x, y);
                default:
                    throw EvaluationException.syntax("unsupported operator " + symbol);
            }
        } catch (ArithmeticException e) {
            throw EvaluationException.value("integer overflow in '" + symbol + "'");
        }
    }

    /** Integer base and non-negative integer exponent stay integral; everything else is real. */
    static Value power(Value x, Value y) {
        if (x.isIntegral() && y.isIntegral() && y.asLong() >= 0) {
            long base = x.asLong();
            long exp = y.asLong();
            long result = 1L;
            try {
                while (exp > 0) {
                    if ((exp & 1L) == 1L) result = Math.multiplyExact(result, base);
                    exp >>= 1;
                    if (exp > 0) base = Math.multiplyExact(base, base);
                }
            } catch (ArithmeticException e) {
                throw EvaluationException.value("integer overflow in '**'");
            }
            return Value.of(result);
        }
        if (x.asDouble() == 0.0 && y.asDouble() < 0) {
            throw EvaluationException.value("0.0 cannot be raised to a negative power");
        }
        return real(Math.pow(x.asDouble(), y.asDouble()));
    }

    /** Wraps a real result, rejecting NaN and infinities. */
    static Value real(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw EvaluationException.value("result is not a finite number");
        }
        return Value.of(d);
    }

    private static void requireNumeric(Value v, String symbol) {
        if (v.isSequence() || !v.isNumeric()) {
            throw EvaluationException.type("unsupported operand type for " + symbol + ": '" + v.typeName() + "'");
        }
    }

    private static void requireNotList(Value v, String operator) {
        if (v.isList()) {
            throw EvaluationException.type("bad operand type for " + operator + ": 'list'");
        }
    }

    private static void requireNonZero(Value divisor) {
        if (divisor.asDouble() == 0.0) {
            throw EvaluationException.value("division by zero");
        }
    }

    private static String symbol(Token.Type op) {
        return switch (op) {
            case PLUS -> "+";
            case MINUS -> "-";
            case STAR -> "*";
            case SLASH -> "/";
            case DOUBLE_SLASH -> "//";
            case PERCENT -> "%";
            case POWER -> "**";
            default -> op.name();
        };
    }
}
