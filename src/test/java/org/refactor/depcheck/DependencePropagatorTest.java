package org.refactor.depcheck;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class DependencePropagatorTest {

    /**
     * 后支配树：Exit <- H <- B2 <- B1，Entry <- H
     * 对应 Entry -> H, H -> B1, B1 -> B2, B2 -> H, H -> Exit
     */
    private static PostDominatorTree<String> loopTree() {
        return PostDominatorTree.<String>builder()
                .root("Exit")
                .parent("H", "Exit")
                .parent("Entry", "H")
                .parent("B2", "H")
                .parent("B1", "B2")
                .build();
    }

    @Test
    void parentCaseStopsBelowTheCommonAncestor() {
        PostDominatorTree<String> t = PostDominatorTree.<String>builder()
                .root("Exit")
                .parent("Merge", "Exit")
                .parent("Entry", "Merge")
                .parent("A", "Merge")
                .build();
        ControlDependenceGraph<String> cdg = DependencePropagator.propagate(
                List.of(new CfgEdge<>("Entry", "A")), t);
        assertEquals(Set.of("A"), cdg.dependents("Entry"));
    }

    @Test
    void loopCaseIncludesTheTailItself() {
        ControlDependenceGraph<String> cdg = DependencePropagator.propagate(
                List.of(new CfgEdge<>("H", "B1")), loopTree());
        assertEquals(Set.of("B1", "B2", "H"), cdg.dependents("H"));
    }

    @Test
    void rootTailWalksPastTheRoot() {
        // A 是树根，B 在它下面：一直走到越过树根为止
        PostDominatorTree<String> t = PostDominatorTree.<String>builder()
                .root("A")
                .parent("B", "C")
                .parent("C", "A")
                .build();
        ControlDependenceGraph<String> cdg = DependencePropagator.propagate(
                List.of(new CfgEdge<>("A", "B")), t);
        assertEquals(Set.of("A", "B", "C"), cdg.dependents("A"));
    }

    @Test
    void missingAncestorSkipsOnlyThatEdge() {
        PostDominatorTree<String> t = PostDominatorTree.<String>builder()
                .root("Exit")
                .parent("P", "Exit")
                .parent("X", "Exit")
                .root("Lost")
                .build();
        ControlDependenceGraph<String> cdg = DependencePropagator.propagate(
                List.of(new CfgEdge<>("P", "Lost"), new CfgEdge<>("P", "X")), t);

        assertEquals(Set.of("X"), cdg.dependents("P"));
        assertEquals(1, cdg.diagnostics().size());
        assertEquals(Diagnostic.Kind.MISSING_ANCESTOR, cdg.diagnostics().get(0).kind());
    }

    @Test
    void repeatedEdgesAreIdempotent() {
        CfgEdge<String> e = new CfgEdge<>("H", "B1");
        ControlDependenceGraph<String> once = DependencePropagator.propagate(List.of(e), loopTree());
        ControlDependenceGraph<String> twice = DependencePropagator.propagate(List.of(e, e), loopTree());
        assertEquals(once, twice);
        assertEquals(3, twice.edgeCount());
    }

    @Test
    void edgeOrderDoesNotChangeTheResult() {
        TestCfg cfg = TestCfg.of("A->B", "B->C", "B->D", "C->E", "D->E", "E->B", "E->F", "C->C");
        PostDominatorTree<String> t = PostDominatorAnalysis.compute(cfg);
        List<CfgEdge<String>> s = EdgeClassifier.nonPostDominatedEdges(cfg, t);
        ControlDependenceGraph<String> expected = DependencePropagator.propagate(s, t);

        Random random = new Random(42);
        for (int i = 0; i < 20; i++) {
            List<CfgEdge<String>> shuffled = new ArrayList<>(s);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, DependencePropagator.propagate(shuffled, t));
        }
    }
}
