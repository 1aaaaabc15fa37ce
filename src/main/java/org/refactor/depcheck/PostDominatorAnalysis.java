package org.refactor.depcheck;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * 由控制流图计算后支配树。
 * <p>
 * 节点 I 被 J 后支配：从 I 到出口的每条路径都经过 J。
 * 后支配集合按下式迭代到不动点：
 * <pre>
 *   PD(exit) = {exit}
 *   PD(n)    = {n} ∪ ⋂ PD(s)，s 取遍 n 的后继
 * </pre>
 * 非出口节点初始为全集。没有后继的节点都是出口，因此多出口的过程得到的是森林。
 * 无法到达任何出口的节点（死循环）单独成为树根。
 */
public class PostDominatorAnalysis {

    private static final Logger LOG = Logger.getLogger(PostDominatorAnalysis.class.getName());

    public static <N> PostDominatorTree<N> compute(CfgProvider<N> cfg) {
        List<N> nodes = ImmutableList.copyOf(cfg.nodes());
        Set<N> allNodes = ImmutableSet.copyOf(nodes);
        checkArgument(allNodes.size() == nodes.size(), "CFG lists a node twice");

        Set<N> reachesExit = nodesReachingExit(cfg, nodes, allNodes);

        // 1. 初始化：出口只有自己，其他节点为全集
        Map<N, Set<N>> postDoms = new HashMap<>();
        for (N n : nodes) {
            postDoms.put(n, cfg.successors(n).isEmpty() ? Collections.singleton(n) : allNodes);
        }

        // 2. 迭代直到不动点，逆序遍历让信息更快从出口往回传
        boolean changed = true;
        int rounds = 0;
        while (changed) {
            changed = false;
            rounds++;
            for (int i = nodes.size() - 1; i >= 0; i--) {
                N n = nodes.get(i);
                List<N> succs = cfg.successors(n);
                if (succs.isEmpty()) {
                    continue;
                }
                Set<N> newPostDoms = allNodes;
                for (N s : succs) {
                    newPostDoms = Sets.intersection(newPostDoms, postDoms.get(s));
                }
                newPostDoms = new HashSet<>(newPostDoms);
                newPostDoms.add(n); // 每个节点都后支配自己

                if (!newPostDoms.equals(postDoms.get(n))) {
                    postDoms.put(n, newPostDoms);
                    changed = true;
                }
            }
        }
        LOG.log(Level.FINE, "post-dominator sets stable after {0} rounds", rounds);

        // 3. 直接后支配者：严格后支配者中后支配集合最大的那个（离 n 最近）
        PostDominatorTree.Builder<N> tree = PostDominatorTree.builder();
        for (N n : nodes) {
            if (!reachesExit.contains(n)) {
                LOG.log(Level.FINE, "node {0} has no path to an exit", n);
                tree.root(n);
                continue;
            }
            N idom = null;
            int best = -1;
            for (N d : postDoms.get(n)) {
                if (d.equals(n)) {
                    continue;
                }
                int size = postDoms.get(d).size();
                if (size > best) {
                    best = size;
                    idom = d;
                }
            }
            if (idom == null) {
                tree.root(n);
            } else {
                tree.parent(n, idom);
            }
        }
        return tree.build();
    }

    /**
     * 从所有出口沿前驱方向做一次遍历，得到能到达出口的节点
     */
    private static <N> Set<N> nodesReachingExit(CfgProvider<N> cfg, List<N> nodes, Set<N> allNodes) {
        Map<N, List<N>> preds = new HashMap<>();
        Deque<N> work = new ArrayDeque<>();
        for (N n : nodes) {
            List<N> succs = cfg.successors(n);
            if (succs.isEmpty()) {
                work.add(n);
            }
            for (N s : succs) {
                checkArgument(allNodes.contains(s), "Successor %s of %s is not a CFG node", s, n);
                preds.computeIfAbsent(s, k -> new ArrayList<>()).add(n);
            }
        }

        Set<N> seen = new HashSet<>(work);
        while (!work.isEmpty()) {
            N n = work.poll();
            for (N p : preds.getOrDefault(n, Collections.emptyList())) {
                if (seen.add(p)) {
                    work.add(p);
                }
            }
        }
        return seen;
    }
}
