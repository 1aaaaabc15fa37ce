package org.refactor.depcheck;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ControlDependenceAnalysisTest {

    @Test
    void diamond() {
        ControlDependenceGraph<String> cdg = ControlDependenceAnalysis.compute(TestCfg.diamond());
        assertEquals(Set.of("A", "B"), cdg.dependents("Entry"));
        assertEquals(Set.of(), cdg.dependents("A"));
        assertEquals(Set.of(), cdg.dependents("B"));
        assertFalse(cdg.contains("Entry", "Merge"));
        assertTrue(cdg.diagnostics().isEmpty());
    }

    @Test
    void ifWithoutElse() {
        ControlDependenceGraph<String> cdg = ControlDependenceAnalysis.compute(TestCfg.ifWithoutElse());
        assertEquals(Set.of("Then"), cdg.dependents("Entry"));
        assertEquals(Set.of("Entry"), cdg.controlNodes());
    }

    @Test
    void loopHeaderControlsItself() {
        ControlDependenceGraph<String> cdg = ControlDependenceAnalysis.compute(TestCfg.whileLoop());
        assertEquals(Set.of("Header", "Body"), cdg.dependents("Header"));
        assertEquals(Set.of(), cdg.dependents("Entry"));
        assertEquals(Set.of(), cdg.dependents("Body"));
    }

    @Test
    void selfLoopEdge() {
        ControlDependenceGraph<String> cdg = ControlDependenceAnalysis.compute(TestCfg.of("Entry->L", "L->L", "L->Exit"));
        assertEquals(Set.of("L"), cdg.dependents("L"));
        assertEquals(1, cdg.edgeCount());
    }

    @Test
    void nestedBranches() {
        // if (p) { if (q) { X } Y } Z
        TestCfg cfg = TestCfg.of("P->Q", "P->Z", "Q->X", "Q->Y", "X->Y", "Y->Z");
        ControlDependenceGraph<String> cdg = ControlDependenceAnalysis.compute(cfg);
        assertEquals(Set.of("Q", "Y"), cdg.dependents("P"));
        assertEquals(Set.of("X"), cdg.dependents("Q"));
    }

    @Test
    void unreachableBlockIsSkippedWithDiagnostics() {
        // B <-> C 永远到不了出口，其余部分是一个普通的分支
        TestCfg cfg = TestCfg.of("Entry->A", "Entry->D", "A->Exit", "D->Exit", "Entry->B", "B->C", "C->B");
        ControlDependenceGraph<String> cdg = ControlDependenceAnalysis.compute(cfg);

        assertEquals(Set.of("A", "D"), cdg.dependents("Entry"));
        assertEquals(Set.of(), cdg.dependents("B"));
        assertEquals(Set.of(), cdg.dependents("C"));
        assertEquals(Set.of("Entry"), cdg.controlNodes());

        List<Diagnostic> diagnostics = cdg.diagnostics();
        assertEquals(3, diagnostics.size());
        for (Diagnostic d : diagnostics) {
            assertEquals(Diagnostic.Kind.MISSING_ANCESTOR, d.kind());
        }
        assertTrue(diagnostics.get(0).message().contains("Entry -> B"));
    }

    @Test
    void onlyBranchesAndSelfLoopsControlAnything() {
        List<TestCfg> graphs = List.of(
                TestCfg.diamond(),
                TestCfg.ifWithoutElse(),
                TestCfg.whileLoop(),
                TestCfg.of("Entry->L", "L->L", "L->Exit"),
                TestCfg.of("A->B", "B->C", "B->D", "C->E", "D->E", "E->B", "E->F"),
                TestCfg.of("Entry->A", "Entry->D", "A->Exit", "D->Exit", "Entry->B", "B->C", "C->B"));
        for (TestCfg cfg : graphs) {
            ControlDependenceGraph<String> cdg = ControlDependenceAnalysis.compute(cfg);
            for (String tail : cdg.controlNodes()) {
                List<String> succs = cfg.successors(tail);
                boolean branches = succs.stream().distinct().count() >= 2;
                assertTrue(branches || succs.contains(tail), tail + " controls nodes without branching");
            }
        }
    }

    @Test
    void repeatedConstructionIsIdentical() {
        TestCfg cfg = TestCfg.of("A->B", "B->C", "B->D", "C->E", "D->E", "E->B", "E->F");
        ControlDependenceGraph<String> first = ControlDependenceAnalysis.compute(cfg);
        ControlDependenceGraph<String> second = ControlDependenceAnalysis.compute(cfg);
        assertEquals(first, second);
        assertEquals(List.copyOf(first.entries()), List.copyOf(second.entries()));
    }
}
