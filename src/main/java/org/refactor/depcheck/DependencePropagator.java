package org.refactor.depcheck;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 把候选边沿后支配树向上传播，得到控制依赖图。
 * <p>
 * 对候选边 (A, B)，令 L 为 A、B 在后支配树上的最近公共祖先，只有两种情况：
 * <ol>
 *   <li>L 是 A 的父节点：从 B 到 L 路径上的节点（含 B，不含 L）都控制依赖于 A；</li>
 *   <li>L 就是 A：从 B 到 A 路径上的节点（含 A 和 B）都控制依赖于 A，这对应循环依赖。</li>
 * </ol>
 * 两种情况都可以用同一个循环完成：从 B 沿树往上走，直到碰到 A 的父节点为止，途经节点全部记为依赖于 A。
 */
public class DependencePropagator {

    private static final Logger LOG = Logger.getLogger(DependencePropagator.class.getName());

    public static <N> ControlDependenceGraph<N> propagate(Collection<CfgEdge<N>> edges, PostDominanceOracle<N> pdt) {
        ControlDependenceGraph.Builder<N> cdg = ControlDependenceGraph.builder();
        for (CfgEdge<N> edge : edges) {
            propagate(edge, pdt, cdg);
        }
        return cdg.build();
    }

    /**
     * 处理单条候选边，结果并入 cdg。各条边之间互不影响，处理顺序不改变最终结果。
     */
    static <N> void propagate(CfgEdge<N> edge, PostDominanceOracle<N> pdt, ControlDependenceGraph.Builder<N> cdg) {
        N a = edge.tail();
        N b = edge.head();

        Optional<N> lca = pdt.leastCommonAncestor(a, b);
        if (lca.isEmpty()) {
            LOG.log(Level.WARNING, "Skipping edge {0}: no common post-dominator", edge);
            cdg.diagnose(Diagnostic.missingAncestor(edge));
            return;
        }

        // A 是树根时 parent 为 null，此时一直走到越过 B 所在树的根
        N parent = pdt.immediateDominator(a).orElse(null);
        if (parent == null) {
            LOG.log(Level.FINE, "{0} has no immediate post-dominator", a);
        }

        N cur = b;
        while (cur != null && !Objects.equals(cur, parent)) {
            cdg.insert(a, cur);
            cur = pdt.immediateDominator(cur).orElse(null);
        }
        LOG.log(Level.FINE, "edge {0}: lca {1}, {2} now controls {3} node(s)",
                new Object[]{edge, lca.get(), a, cdg.dependentCount(a)});
    }
}
