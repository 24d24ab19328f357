package com.labsweep.expansion;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RunSpecTest {

    @Test
    void toParameters_deepestLevelWins() {
        RunSpec run = new RunSpec(List.of(
                new ParameterAssignment("Voltage", 1L),
                new ParameterAssignment("Delay", 0.1),
                new ParameterAssignment("Voltage", 5L)));

        Map<String, Object> params = run.toParameters();

        assertEquals(5L, params.get("Voltage"));
        assertEquals(List.of("Voltage", "Delay"), List.copyOf(params.keySet()));
    }

    @Test
    void constructor_rejectsEmptyGroup() {
        assertThrows(IllegalArgumentException.class, () -> new RunSpec(List.of()));
        assertThrows(NullPointerException.class, () -> new ParameterAssignment("P", null));
    }
}
