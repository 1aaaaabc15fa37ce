package org.refactor.depcheck;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.*;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * 不可变的后支配树（允许是森林）。
 * <p>
 * 节点存放在按下标编号的数组里，父节点和深度都用下标记录，构建完成后不再变化，
 * 可以被多个分析任务同时只读访问。
 * <p>
 * 多出口的过程、或者存在无法到达出口的节点时，会得到多棵树；
 * 不同树上的两个节点没有公共祖先。
 */
public final class PostDominatorTree<N> implements PostDominanceOracle<N> {

    private static final int NO_PARENT = -1;

    private final ImmutableList<N> nodes;
    private final ImmutableMap<N, Integer> index;
    private final int[] parent;
    private final int[] depth;

    private PostDominatorTree(ImmutableList<N> nodes, int[] parent, int[] depth) {
        this.nodes = nodes;
        ImmutableMap.Builder<N, Integer> b = ImmutableMap.builder();
        for (int i = 0; i < nodes.size(); i++) {
            b.put(nodes.get(i), i);
        }
        this.index = b.build();
        this.parent = parent;
        this.depth = depth;
    }

    public static <N> Builder<N> builder() {
        return new Builder<>();
    }

    @Override
    public boolean properlyPostDominates(N x, N y) {
        int xi = indexOf(x);
        int yi = indexOf(y);
        if (xi == yi) {
            return false;
        }
        // 从 y 往上爬，x 必须是 y 的真祖先
        int cur = parent[yi];
        while (cur != NO_PARENT && depth[cur] >= depth[xi]) {
            if (cur == xi) {
                return true;
            }
            cur = parent[cur];
        }
        return false;
    }

    @Override
    public Optional<N> leastCommonAncestor(N x, N y) {
        int a = indexOf(x);
        int b = indexOf(y);
        while (depth[a] > depth[b]) {
            a = parent[a];
        }
        while (depth[b] > depth[a]) {
            b = parent[b];
        }
        while (a != b) {
            a = parent[a];
            b = parent[b];
            if (a == NO_PARENT || b == NO_PARENT) {
                // 两个节点在不同的树上
                return Optional.empty();
            }
        }
        return Optional.of(nodes.get(a));
    }

    @Override
    public Optional<N> immediateDominator(N x) {
        int p = parent[indexOf(x)];
        return p == NO_PARENT ? Optional.empty() : Optional.of(nodes.get(p));
    }

    public boolean contains(N node) {
        return index.containsKey(node);
    }

    public List<N> nodes() {
        return nodes;
    }

    /**
     * @return 所有树根（没有直接后支配者的节点），按构建顺序
     */
    public List<N> roots() {
        List<N> roots = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (parent[i] == NO_PARENT) {
                roots.add(nodes.get(i));
            }
        }
        return roots;
    }

    /**
     * 树根深度为 0
     */
    public int depth(N node) {
        return depth[indexOf(node)];
    }

    private int indexOf(N node) {
        checkNotNull(node, "node");
        Integer i = index.get(node);
        checkArgument(i != null, "Node %s not in post-dominator tree", node);
        return i;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PostDominatorTree{");
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(nodes.get(i)).append(" -> ")
                    .append(parent[i] == NO_PARENT ? "root" : nodes.get(parent[i]));
        }
        return sb.append('}').toString();
    }

    /**
     * 逐个声明节点和它的父节点，最后一次性检查并冻结。
     * 声明顺序无关，父节点可以晚于子节点声明。
     */
    public static final class Builder<N> {

        // 节点 -> 父节点（null 表示树根）
        private final Map<N, N> parents = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder<N> root(N node) {
            checkNotNull(node, "node");
            declare(node, null);
            return this;
        }

        public Builder<N> parent(N child, N parent) {
            checkNotNull(child, "child");
            checkNotNull(parent, "parent");
            checkArgument(!child.equals(parent), "Node %s cannot be its own parent", child);
            declare(child, parent);
            return this;
        }

        private void declare(N node, N parent) {
            checkState(!parents.containsKey(node) || Objects.equals(parents.get(node), parent),
                    "Node %s already declared with parent %s", node, parents.get(node));
            parents.put(node, parent);
        }

        public PostDominatorTree<N> build() {
            ImmutableList<N> nodes = ImmutableList.copyOf(parents.keySet());
            Map<N, Integer> idx = new HashMap<>();
            for (int i = 0; i < nodes.size(); i++) {
                idx.put(nodes.get(i), i);
            }

            int[] parent = new int[nodes.size()];
            for (int i = 0; i < nodes.size(); i++) {
                N p = parents.get(nodes.get(i));
                if (p == null) {
                    parent[i] = NO_PARENT;
                } else {
                    Integer pi = idx.get(p);
                    checkState(pi != null, "Parent %s of node %s was never declared", p, nodes.get(i));
                    parent[i] = pi;
                }
            }

            int[] depth = new int[nodes.size()];
            Arrays.fill(depth, -1);
            for (int i = 0; i < nodes.size(); i++) {
                computeDepth(i, parent, depth, nodes);
            }
            return new PostDominatorTree<>(nodes, parent, depth);
        }

        private static <N> void computeDepth(int start, int[] parent, int[] depth, List<N> nodes) {
            // 先沿父链走到一个已知深度的节点（或树根），再回填整条路径
            Deque<Integer> path = new ArrayDeque<>();
            int cur = start;
            while (cur != NO_PARENT && depth[cur] < 0) {
                path.push(cur);
                checkState(path.size() <= nodes.size(), "Cycle in post-dominator tree at node %s", nodes.get(start));
                cur = parent[cur];
            }
            int d = cur == NO_PARENT ? -1 : depth[cur];
            while (!path.isEmpty()) {
                depth[path.pop()] = ++d;
            }
        }
    }
}
