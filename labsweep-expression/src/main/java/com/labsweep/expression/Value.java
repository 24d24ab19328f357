package com.labsweep.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runtime value inside an expression: an integer, a real number, a string, a boolean,
 * or an ordered sequence of values. A sequence is either a list (literals, {@code range},
 * {@code list}, {@code sorted}), where {@code +} concatenates and {@code *} repeats, or an array
 * (generators and math results), where operators apply element-wise. Immutable.
 */
public final class Value {

    private final Object scalar;
    private final List<Value> items;
    private final boolean array;

    private Value(Object scalar, List<Value> items, boolean array) {
        this.scalar = scalar;
        this.items = items;
        this.array = array;
    }

    public static Value of(long v) {
        return new Value(v, null, false);
    }

    public static Value of(double v) {
        return new Value(v, null, false);
    }

    public static Value of(String v) {
        return new Value(Objects.requireNonNull(v, "v"), null, false);
    }

    public static Value of(boolean v) {
        return new Value(v, null, false);
    }

    /** List sequence. */
    public static Value sequence(List<Value> items) {
        return new Value(null, Collections.unmodifiableList(new ArrayList<>(items)), false);
    }

    /** Array sequence; arithmetic on it is element-wise. */
    public static Value array(List<Value> items) {
        return new Value(null, Collections.unmodifiableList(new ArrayList<>(items)), true);
    }

    public boolean isSequence() {
        return items != null;
    }

    public boolean isArray() {
        return array;
    }

    /** A sequence with list operators. */
    public boolean isList() {
        return items != null && !array;
    }

    /** True for integers, reals and booleans (booleans count as 0/1 in arithmetic). */
    public boolean isNumeric() {
        return scalar instanceof Long || scalar instanceof Double || scalar instanceof Boolean;
    }

    /** True for integers and booleans. */
    public boolean isIntegral() {
        return scalar instanceof Long || scalar instanceof Boolean;
    }

    public boolean isString() {
        return scalar instanceof String;
    }

    public boolean isBoolean() {
        return scalar instanceof Boolean;
    }

    /** Items of a sequence; fails with a type error for scalars. */
    public List<Value> items() {
        if (items == null) {
            throw EvaluationException.type("'" + typeName() + "' object is not iterable");
        }
        return items;
    }

    public long asLong() {
        if (scalar instanceof Long l) return l;
        if (scalar instanceof Boolean b) return b ? 1L : 0L;
        throw EvaluationException.type("'" + typeName() + "' object cannot be interpreted as an integer");
    }

    public double asDouble() {
        if (scalar instanceof Double d) return d;
        if (isIntegral()) return asLong();
        throw EvaluationException.type("must be a real number, not '" + typeName() + "'");
    }

    public String asString() {
        if (scalar instanceof String s) return s;
        throw EvaluationException.type("expected a string, not '" + typeName() + "'");
    }

    /** Zero, the empty string and the empty sequence are false. */
    public boolean truthy() {
        if (items != null) return !items.isEmpty();
        if (scalar instanceof Boolean b) return b;
        if (scalar instanceof Long l) return l != 0L;
        if (scalar instanceof Double d) return d != 0.0;
        return !((String) scalar).isEmpty();
    }

    /** The scalar as a plain Java object ({@link Long}, {@link Double}, {@link String} or {@link Boolean}). */
    public Object toJava() {
        if (items != null) {
            throw EvaluationException.type("expected a scalar, not a sequence");
        }
        return scalar;
    }

    /** Type name used in error messages. */
    public String typeName() {
        if (items != null) return array ? "ndarray" : "list";
        if (scalar instanceof Long) return "int";
        if (scalar instanceof Double) return "float";
        if (scalar instanceof Boolean) return "bool";
        return "str";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Value that = (Value) o;
        return array == that.array && Objects.equals(scalar, that.scalar) && Objects.equals(items, that.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scalar, items, array);
    }

    @Override
    public String toString() {
        if (items != null) return items.toString();
        if (scalar instanceof String s) return "'" + s + "'";
        return String.valueOf(scalar);
    }
}
