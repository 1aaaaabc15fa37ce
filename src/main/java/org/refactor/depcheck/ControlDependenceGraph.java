package org.refactor.depcheck;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.*;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * 控制依赖图：控制节点 -> 依赖于它的节点集合。
 * <p>
 * 由 {@link Builder} 单调地插入，{@link Builder#build()} 之后不可再修改。
 * 遍历顺序为各控制节点第一次插入的顺序，同一输入多次构建得到相同的顺序。
 */
public final class ControlDependenceGraph<N> {

    private final ImmutableMap<N, ImmutableSet<N>> dependents;
    private final ImmutableList<Diagnostic> diagnostics;

    private ControlDependenceGraph(ImmutableMap<N, ImmutableSet<N>> dependents, ImmutableList<Diagnostic> diagnostics) {
        this.dependents = dependents;
        this.diagnostics = diagnostics;
    }

    public static <N> Builder<N> builder() {
        return new Builder<>();
    }

    /**
     * @return 控制依赖于 tail 的节点；tail 不控制任何节点时返回空集合
     */
    public Set<N> dependents(N tail) {
        return dependents.getOrDefault(tail, ImmutableSet.of());
    }

    public boolean contains(N tail, N node) {
        return dependents(tail).contains(node);
    }

    /**
     * @return 至少控制一个节点的控制节点
     */
    public Set<N> controlNodes() {
        return dependents.keySet();
    }

    public Set<Map.Entry<N, ImmutableSet<N>>> entries() {
        return dependents.entrySet();
    }

    public Map<N, ImmutableSet<N>> asMap() {
        return dependents;
    }

    /**
     * @return (控制节点, 依赖节点) 对的总数
     */
    public int edgeCount() {
        int count = 0;
        for (ImmutableSet<N> set : dependents.values()) {
            count += set.size();
        }
        return count;
    }

    public boolean isEmpty() {
        return dependents.isEmpty();
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * 只比较依赖关系本身，诊断信息不参与比较
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ControlDependenceGraph<?> other)) {
            return false;
        }
        return dependents.equals(other.dependents);
    }

    @Override
    public int hashCode() {
        return dependents.hashCode();
    }

    @Override
    public String toString() {
        return "ControlDependenceGraph" + dependents;
    }

    public static final class Builder<N> {

        private final Map<N, Set<N>> dependents = new LinkedHashMap<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private boolean built = false;

        private Builder() {
        }

        /**
         * 把 node 加入 tail 的依赖集合，重复插入没有效果
         *
         * @return node 是否是新加入的
         */
        public boolean insert(N tail, N node) {
            checkNotNull(tail, "tail");
            checkNotNull(node, "node");
            checkState(!built, "Control dependence graph already built");
            return dependents.computeIfAbsent(tail, k -> new LinkedHashSet<>()).add(node);
        }

        public Builder<N> diagnose(Diagnostic diagnostic) {
            checkState(!built, "Control dependence graph already built");
            diagnostics.add(checkNotNull(diagnostic));
            return this;
        }

        int dependentCount(N tail) {
            Set<N> set = dependents.get(tail);
            return set == null ? 0 : set.size();
        }

        public ControlDependenceGraph<N> build() {
            checkState(!built, "Control dependence graph already built");
            built = true;
            ImmutableMap.Builder<N, ImmutableSet<N>> map = ImmutableMap.builder();
            dependents.forEach((tail, set) -> map.put(tail, ImmutableSet.copyOf(set)));
            return new ControlDependenceGraph<>(map.build(), ImmutableList.copyOf(diagnostics));
        }
    }
}
