package org.refactor.depcheck;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EdgeClassifierTest {

    @Test
    void diamondBranchEdgesQualify() {
        TestCfg cfg = TestCfg.diamond();
        List<CfgEdge<String>> s = EdgeClassifier.nonPostDominatedEdges(cfg, PostDominatorAnalysis.compute(cfg));
        assertEquals(List.of(new CfgEdge<>("Entry", "A"), new CfgEdge<>("Entry", "B")), s);
    }

    @Test
    void selfLoopAlwaysQualifies() {
        TestCfg cfg = TestCfg.of("Entry->L", "L->L", "L->Exit");
        List<CfgEdge<String>> s = EdgeClassifier.nonPostDominatedEdges(cfg, PostDominatorAnalysis.compute(cfg));
        assertEquals(List.of(new CfgEdge<>("L", "L")), s);
        assertTrue(s.get(0).isSelfLoop());
    }

    @Test
    void sequentialFlowContributesNothing() {
        TestCfg cfg = TestCfg.of("A->B", "B->C", "C->D");
        assertTrue(EdgeClassifier.nonPostDominatedEdges(cfg, PostDominatorAnalysis.compute(cfg)).isEmpty());
    }

    @Test
    void loopBackEdgeDoesNotQualifyButLoopEntryDoes() {
        TestCfg cfg = TestCfg.whileLoop();
        List<CfgEdge<String>> s = EdgeClassifier.nonPostDominatedEdges(cfg, PostDominatorAnalysis.compute(cfg));
        assertEquals(List.of(new CfgEdge<>("Header", "Body")), s);
    }
}
