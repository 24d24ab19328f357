package com.labsweep.expansion;

import com.labsweep.expression.EvaluationException;
import com.labsweep.expression.ExpressionEvaluator;
import com.labsweep.sequence.SequenceNode;
import com.labsweep.sequence.SequenceSerializer;
import com.labsweep.sequence.SequenceStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DepthFoldExpanderTest {

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
    private final SweepExpander fold = new DepthFoldExpander(evaluator);
    private final SweepExpander tree = new TreeSweepExpander(evaluator);

    @Test
    void expand_nestedSweepIsRowMajor() {
        SequenceStore store = new SequenceStore();
        SequenceNode p1 = store.add("P1", "[1,2]", null).node();
        store.add("P2", "[3,4,5]", p1);

        List<RunSpec> runs = fold.expand(store);

        assertEquals(List.of(
                run(1L, 3L), run(1L, 4L), run(1L, 5L),
                run(2L, 3L), run(2L, 4L), run(2L, 5L)), runs);
    }

    @Test
    void expand_secondRootIsAppended() {
        SequenceStore store = new SequenceStore();
        SequenceNode p1 = store.add("P1", "[1,2]", null).node();
        store.add("P2", "[3,4,5]", p1);
        store.add("P1", "[4,5]", null);

        List<RunSpec> runs = fold.expand(store);

        assertEquals(8, runs.size());
        assertEquals(run(2L, 5L), runs.get(5));
        assertEquals(new RunSpec(List.of(new ParameterAssignment("P1", 4L))), runs.get(6));
        assertEquals(new RunSpec(List.of(new ParameterAssignment("P1", 5L))), runs.get(7));
    }

    @Test
    void expand_rootsAreConcatenatedNotMultiplied() {
        SequenceStore store = new SequenceStore();
        store.add("A", "range(3)", null);
        store.add("B", "range(4)", null);

        assertEquals(7, fold.expand(store).size());
    }

    @Test
    void expand_siblingSubtreesAreUnionedBeforeCrossing() {
        SequenceStore store = new SequenceStore();
        SequenceNode p = store.add("P", "range(3)", null).node();
        store.add("C1", "range(2)", p);
        store.add("C2", "range(5)", p);

        List<RunSpec> runs = fold.expand(store);

        assertEquals((2 + 5) * 3, runs.size());
        assertEquals(List.of(new ParameterAssignment("P", 0L), new ParameterAssignment("C1", 0L)),
                runs.get(0).getAssignments());
        assertEquals(List.of(new ParameterAssignment("P", 0L), new ParameterAssignment("C2", 4L)),
                runs.get(6).getAssignments());
        assertEquals(List.of(new ParameterAssignment("P", 1L), new ParameterAssignment("C1", 0L)),
                runs.get(7).getAssignments());
    }

    @Test
    void expand_deepAndShallowSubtreesMix() {
        SequenceStore store = new SequenceStore();
        new SequenceSerializer().load(store, """
                - "A", "[1, 2]"
                -- "B", "[10]"
                --- "C", "[100, 200]"
                -- "D", "[7]"
                - "E", "['x']"
                """, false);

        List<RunSpec> runs = fold.expand(store);

        assertEquals(List.of(
                List.of(new ParameterAssignment("A", 1L), new ParameterAssignment("B", 10L), new ParameterAssignment("C", 100L)),
                List.of(new ParameterAssignment("A", 1L), new ParameterAssignment("B", 10L), new ParameterAssignment("C", 200L)),
                List.of(new ParameterAssignment("A", 1L), new ParameterAssignment("D", 7L)),
                List.of(new ParameterAssignment("A", 2L), new ParameterAssignment("B", 10L), new ParameterAssignment("C", 100L)),
                List.of(new ParameterAssignment("A", 2L), new ParameterAssignment("B", 10L), new ParameterAssignment("C", 200L)),
                List.of(new ParameterAssignment("A", 2L), new ParameterAssignment("D", 7L)),
                List.of(new ParameterAssignment("E", "x"))),
                runs.stream().map(RunSpec::getAssignments).toList());
    }

    @Test
    void expand_emptyValueListEmptiesItsSubtree() {
        SequenceStore store = new SequenceStore();
        SequenceNode p = store.add("P", "[]", null).node();
        store.add("C", "[1, 2]", p);
        store.add("Q", "[9]", null);

        assertEquals(List.of(new RunSpec(List.of(new ParameterAssignment("Q", 9L)))), fold.expand(store));
    }

    @Test
    void expand_emptyStoreGivesNoRuns() {
        assertTrue(fold.expand(new SequenceStore()).isEmpty());
    }

    @Test
    void expand_failsOnEmptyExpressionWithNodeLocation() {
        SequenceStore store = new SequenceStore();
        SequenceNode p = store.add("P", "[1]", null).node();
        store.add("Frequency", p);

        EvaluationException e = assertThrows(EvaluationException.class, () -> fold.expand(store));

        assertEquals(EvaluationException.Kind.EMPTY, e.getKind());
        assertEquals("Frequency", e.getParameter());
        assertEquals(1, e.getDepth());
    }

    @Test
    void expand_renamesParametersThroughNamesMap() {
        SequenceStore store = new SequenceStore();
        SequenceNode v = store.add("Source Voltage", "[1]", null).node();
        store.add("Delay", "[0.5]", v);
        DepthFoldExpander renaming = new DepthFoldExpander(evaluator, Map.of("Source Voltage", "voltage"));

        RunSpec run = renaming.expand(store).get(0);

        assertEquals(Map.of("voltage", 1L, "Delay", 0.5), run.toParameters());
    }

    @Test
    void expand_isRepeatable() {
        SequenceStore store = new SequenceStore();
        SequenceNode p = store.add("P", "linspace(0, 1, 3)", null).node();
        store.add("C", "range(2)", p);

        assertEquals(fold.expand(store), fold.expand(store));
    }

    @Test
    void foldAndTreeExpanders_agreeOnRandomForests() {
        for (long seed = 0; seed < 200; seed++) {
            SequenceStore store = randomForest(new Random(seed));

            assertEquals(tree.expand(store), fold.expand(store), "seed " + seed);
        }
    }

    private static SequenceStore randomForest(Random random) {
        SequenceStore store = new SequenceStore(5);
        List<SequenceNode> added = new ArrayList<>();
        int count = 1 + random.nextInt(9);
        for (int i = 0; i < count; i++) {
            SequenceNode parent = null;
            if (!added.isEmpty() && random.nextInt(4) != 0) {
                parent = added.get(random.nextInt(added.size()));
                if (parent.getLevel() >= store.getMaxDepth() - 1) {
                    parent = null;
                }
            }
            String expression = "range(" + (10 * i) + ", " + (10 * i + random.nextInt(3)) + ")";
            added.add(store.add("N" + i, expression, parent).node());
        }
        return store;
    }

    private static RunSpec run(long p1, long p2) {
        return new RunSpec(List.of(new ParameterAssignment("P1", p1), new ParameterAssignment("P2", p2)));
    }
}
