package org.refactor.depcheck;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 控制依赖分析入口：先分类边，再沿后支配树传播。
 * <p>
 * 每次调用只分析一个过程，不保留任何状态；后支配树只被借用，不会被修改。
 */
public class ControlDependenceAnalysis {

    private static final Logger LOG = Logger.getLogger(ControlDependenceAnalysis.class.getName());

    public static <N> ControlDependenceGraph<N> compute(CfgProvider<N> cfg, PostDominanceOracle<N> pdt) {
        List<CfgEdge<N>> s = EdgeClassifier.nonPostDominatedEdges(cfg, pdt);
        LOG.log(Level.FINE, "{0} candidate control-dependence edge(s)", s.size());
        return DependencePropagator.propagate(s, pdt);
    }

    /**
     * 后支配树由 {@link PostDominatorAnalysis} 现场计算
     */
    public static <N> ControlDependenceGraph<N> compute(CfgProvider<N> cfg) {
        return compute(cfg, PostDominatorAnalysis.compute(cfg));
    }
}
