package com.labsweep.expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The complete set of names an expression may use: functions and constants. Nothing outside the
 * registry is reachable from expression text. Names are case-sensitive.
 */
public final class FunctionRegistry {

    private final Map<String, SweepFunction> functions = new LinkedHashMap<>();
    private final Map<String, Value> constants = new LinkedHashMap<>();

    /** Empty registry; literals and arithmetic still work. */
    public FunctionRegistry() {
    }

    /** Registry with the standard sequence helpers, math functions and the constants {@code pi} and {@code e}. */
    public static FunctionRegistry standard() {
        FunctionRegistry registry = new FunctionRegistry();
        StandardFunctions.registerAll(registry);
        return registry;
    }

    public FunctionRegistry register(String name, SweepFunction function) {
        requireName(name);
        Objects.requireNonNull(function, "function");
        constants.remove(name);
        functions.put(name, function);
        return this;
    }

    public FunctionRegistry constant(String name, Value value) {
        requireName(name);
        Objects.requireNonNull(value, "value");
        functions.remove(name);
        constants.put(name, value);
        return this;
    }

    /** Removes a function or constant; returns whether it was present. */
    public boolean remove(String name) {
        return functions.remove(name) != null | constants.remove(name) != null;
    }

    public Optional<SweepFunction> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Optional<Value> constant(String name) {
        return Optional.ofNullable(constants.get(name));
    }

    /** All registered names, functions first, in registration order. */
    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>(functions.keySet());
        names.addAll(constants.keySet());
        return Collections.unmodifiableSet(names);
    }

    /** Independent copy; later changes to either registry do not affect the other. */
    public FunctionRegistry copy() {
        FunctionRegistry copy = new FunctionRegistry();
        copy.functions.putAll(functions);
        copy.constants.putAll(constants);
        return copy;
    }

    private static void requireName(String name) {
        if (name == null || name.isEmpty() || !Character.isLetter(name.charAt(0)) && name.charAt(0) != '_'
                || !name.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_')) {
            throw new IllegalArgumentException("Not a valid identifier: " + name);
        }
        if ("True".equals(name) || "False".equals(name)) {
            throw new IllegalArgumentException("Reserved name: " + name);
        }
    }
}
