package com.labsweep.bootstrap;

import com.labsweep.config.SweepConfig;
import com.labsweep.expansion.RunSpec;
import com.labsweep.expansion.TreeSweepExpander;
import com.labsweep.expression.EvaluationException;
import com.labsweep.expression.FunctionRegistry;
import com.labsweep.expression.Value;
import com.labsweep.sequence.DepthLimitExceededException;
import com.labsweep.sequence.ParameterValidationException;
import com.labsweep.sequence.SequenceNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequencerTest {

    private static final String SWEEP = """
            - "Voltage", "[1, 2]"
            -- "Frequency", "[10, 20, 30]"
            - "Voltage", "[4, 5]"
            """;

    @TempDir
    Path tempDir;

    @Test
    void loadAndExpand_withDefaults() {
        Sequencer sequencer = Sequencer.create(SweepConfig.builder().build());

        sequencer.load(SWEEP, false);
        List<RunSpec> runs = sequencer.expand();

        assertEquals(8, runs.size());
        assertEquals(Map.of("Voltage", 2L, "Frequency", 30L), runs.get(5).toParameters());
        assertEquals(Map.of("Voltage", 5L), runs.get(7).toParameters());
    }

    @Test
    void configSelectsTreeExpanderAndNames() {
        SweepConfig config = SweepConfig.builder()
                .expander(SweepConfig.ExpanderKind.TREE)
                .parameterNames(Map.of("Voltage", "source_voltage"))
                .build();
        Sequencer sequencer = Sequencer.create(config);

        sequencer.load(SWEEP, false);

        assertInstanceOf(TreeSweepExpander.class, sequencer.getExpander());
        assertEquals(Map.of("source_voltage", 1L, "Frequency", 10L), sequencer.expand().get(0).toParameters());
    }

    @Test
    void configLimitsDepthAndParameters() {
        SweepConfig config = SweepConfig.builder()
                .maxDepth(1)
                .allowedParameters(List.of("Voltage"))
                .build();
        Sequencer sequencer = Sequencer.create(config);
        SequenceNode root = sequencer.getStore().add("Voltage", "[1]", null).node();

        assertThrows(DepthLimitExceededException.class, () -> sequencer.getStore().add("Frequency", root));
        assertThrows(ParameterValidationException.class, () -> sequencer.load("- \"Current\", \"[1]\"\n", false));
        assertEquals(1, sequencer.getStore().size());
    }

    @Test
    void configLimitsValuesPerExpression() {
        Sequencer sequencer = Sequencer.create(SweepConfig.builder().maxValuesPerExpression(10).build());
        sequencer.load("- \"N\", \"range(11)\"\n", false);

        EvaluationException e = assertThrows(EvaluationException.class, sequencer::expand);

        assertEquals(EvaluationException.Kind.VALUE, e.getKind());
        assertEquals("N", e.getParameter());
    }

    @Test
    void saveFileThenLoadFile_usesSequenceDir() throws Exception {
        SweepConfig config = SweepConfig.builder().sequenceDir(tempDir.toString()).build();
        Sequencer sequencer = Sequencer.create(config);
        sequencer.load(SWEEP, false);

        Path file = sequencer.saveFile("sweep.txt");
        Sequencer other = Sequencer.create(config);
        other.loadFile("sweep.txt", false);

        assertEquals(tempDir.resolve("sweep.txt"), file);
        assertEquals(SWEEP, Files.readString(file));
        assertEquals(sequencer.getStore().entries(), other.getStore().entries());
    }

    @Test
    void dispatch_submitsEveryRun() {
        Sequencer sequencer = Sequencer.create(SweepConfig.builder().build());
        sequencer.load(SWEEP, false);
        List<Map<String, Object>> queued = new ArrayList<>();

        sequencer.dispatch(queued::add);

        assertEquals(8, queued.size());
        assertEquals(Map.of("Voltage", 1L, "Frequency", 10L), queued.get(0));
    }

    @Test
    void expandToJson_writesRuns() {
        Sequencer sequencer = Sequencer.create(SweepConfig.builder().build());
        sequencer.load("- \"A\", \"[1, 2]\"\n", false);

        assertEquals("[[{\"A\":1}],[{\"A\":2}]]", sequencer.expandToJson());
    }

    @Test
    void customRegistryRestrictsExpressions() {
        FunctionRegistry registry = new FunctionRegistry().constant("half", Value.of(0.5));
        Sequencer sequencer = Sequencer.create(SweepConfig.builder().build(), registry);
        sequencer.load("- \"A\", \"[half]\"\n- \"B\", \"range(2)\"\n", false);

        EvaluationException e = assertThrows(EvaluationException.class, sequencer::expand);

        assertEquals(EvaluationException.Kind.OTHER, e.getKind());
        assertTrue(e.getMessage().contains("range"));
    }
}
