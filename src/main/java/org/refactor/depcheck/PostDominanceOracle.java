package org.refactor.depcheck;

import java.util.Optional;

/**
 * 后支配关系查询接口。控制依赖分析只读这个接口，从不修改它。
 * <p>
 * 传入接口不认识的节点属于调用方错误，实现应直接抛出 {@link IllegalArgumentException}。
 */
public interface PostDominanceOracle<N> {

    /**
     * x 严格后支配 y：x != y，且从 y 到出口的每条路径都经过 x
     */
    boolean properlyPostDominates(N x, N y);

    /**
     * 后支配树上 x 与 y 的最近公共祖先。
     * 两个节点不在同一棵树上（多出口、无法到达出口的代码）时返回 empty。
     */
    Optional<N> leastCommonAncestor(N x, N y);

    /**
     * x 的直接后支配者（树上的父节点）。empty 表示 x 是树根，即 x 后支配整个过程。
     */
    Optional<N> immediateDominator(N x);
}
