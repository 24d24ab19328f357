package com.labsweep.expansion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One planned run: the assignments along one root-to-leaf path, shallowest first. Never empty.
 */
public final class RunSpec {

    private final List<ParameterAssignment> assignments;

    public RunSpec(List<ParameterAssignment> assignments) {
        this.assignments = List.copyOf(Objects.requireNonNull(assignments, "assignments"));
        if (this.assignments.isEmpty()) {
            throw new IllegalArgumentException("A run spec needs at least one assignment");
        }
    }

    public List<ParameterAssignment> getAssignments() {
        return assignments;
    }

    public int size() {
        return assignments.size();
    }

    /**
     * Flat parameter set for this run. When the same name appears at several levels the deepest
     * level's value wins; names keep the order of their first appearance.
     */
    public Map<String, Object> toParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        for (ParameterAssignment a : assignments) {
            params.put(a.parameter(), a.value());
        }
        return Collections.unmodifiableMap(params);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return assignments.equals(((RunSpec) o).assignments);
    }

    @Override
    public int hashCode() {
        return assignments.hashCode();
    }

    @Override
    public String toString() {
        return assignments.toString();
    }
}
