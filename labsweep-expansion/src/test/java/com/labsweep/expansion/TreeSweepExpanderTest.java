package com.labsweep.expansion;

import com.labsweep.expression.EvaluationException;
import com.labsweep.expression.ExpressionEvaluator;
import com.labsweep.sequence.SequenceNode;
import com.labsweep.sequence.SequenceStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TreeSweepExpanderTest {

    private final TreeSweepExpander expander = new TreeSweepExpander(new ExpressionEvaluator());

    @Test
    void expand_crossesParentWithEachChildValue() {
        SequenceStore store = new SequenceStore();
        SequenceNode p = store.add("P", "[1, 2]", null).node();
        store.add("C", "['a', 'b', 'c']", p);

        List<RunSpec> runs = expander.expand(store);

        assertEquals(6, runs.size());
        assertEquals(List.of(new ParameterAssignment("P", 2L), new ParameterAssignment("C", "a")),
                runs.get(3).getAssignments());
    }

    @Test
    void expand_unionsSiblings() {
        SequenceStore store = new SequenceStore();
        SequenceNode p = store.add("P", "range(2)", null).node();
        store.add("C1", "range(3)", p);
        store.add("C2", "range(4)", p);

        assertEquals((3 + 4) * 2, expander.expand(store).size());
    }

    @Test
    void expand_evaluatesChildrenOfEmptyParents() {
        SequenceStore store = new SequenceStore();
        SequenceNode p = store.add("P", "[]", null).node();
        store.add("C", "range(", p);

        EvaluationException e = assertThrows(EvaluationException.class, () -> expander.expand(store));

        assertEquals(EvaluationException.Kind.SYNTAX, e.getKind());
        assertEquals("C", e.getParameter());
    }
}
