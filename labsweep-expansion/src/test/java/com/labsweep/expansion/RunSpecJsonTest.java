package com.labsweep.expansion;

import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RunSpecJsonTest {

    @Test
    void toJson_writesArraysOfSingleKeyObjects() {
        List<RunSpec> runs = List.of(
                new RunSpec(List.of(new ParameterAssignment("P1", 1L), new ParameterAssignment("P2", 0.5))),
                new RunSpec(List.of(new ParameterAssignment("Mode", "fast"), new ParameterAssignment("On", true))));

        assertEquals("[[{\"P1\":1},{\"P2\":0.5}],[{\"Mode\":\"fast\"},{\"On\":true}]]", RunSpecJson.toJson(runs));
    }

    @Test
    void fromJson_restoresValueTypes() {
        List<RunSpec> runs = RunSpecJson.fromJson("[[{\"P1\":1},{\"P2\":2.0}],[{\"S\":\"x\"}]]");

        assertEquals(List.of(
                new RunSpec(List.of(new ParameterAssignment("P1", 1L), new ParameterAssignment("P2", 2.0))),
                new RunSpec(List.of(new ParameterAssignment("S", "x")))), runs);
    }

    @Test
    void fromJson_rejectsOtherShapes() {
        assertThrows(IllegalArgumentException.class, () -> RunSpecJson.fromJson("{\"P\":1}"));
        assertThrows(IllegalArgumentException.class, () -> RunSpecJson.fromJson("[[{\"A\":1,\"B\":2}]]"));
        assertThrows(IllegalArgumentException.class, () -> RunSpecJson.fromJson("[[{\"A\":null}]]"));
        assertThrows(UncheckedIOException.class, () -> RunSpecJson.fromJson("[[{"));
    }
}
