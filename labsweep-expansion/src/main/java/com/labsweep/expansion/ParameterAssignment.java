package com.labsweep.expansion;

import java.util.Objects;

/** One single-key mapping {@code parameter -> value} contributed by one tree level. */
public record ParameterAssignment(String parameter, Object value) {

    public ParameterAssignment {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return parameter + "=" + value;
    }
}
