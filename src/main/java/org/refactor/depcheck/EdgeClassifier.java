package org.refactor.depcheck;

import java.util.ArrayList;
import java.util.List;

/**
 * 找出控制依赖的候选边。
 */
public class EdgeClassifier {

    /**
     * 收集所有满足 "B 不严格后支配 A" 的控制流边 (A, B)，即 Ferrante 等人算法中的集合 S。
     * <p>
     * 没有后继的出口节点不产生边；自环 (A, A) 总会入选，因为没有节点严格后支配自己，
     * 这正是循环头对自身控制依赖的来源。
     *
     * @param cfg 控制流图
     * @param pdt 同一组节点上的后支配关系
     * @return 候选边，按控制流图的节点和后继顺序排列
     */
    public static <N> List<CfgEdge<N>> nonPostDominatedEdges(CfgProvider<N> cfg, PostDominanceOracle<N> pdt) {
        List<CfgEdge<N>> edges = new ArrayList<>();
        for (N a : cfg.nodes()) {
            for (N b : cfg.successors(a)) {
                if (!pdt.properlyPostDominates(b, a)) {
                    edges.add(new CfgEdge<>(a, b));
                }
            }
        }
        return edges;
    }
}
