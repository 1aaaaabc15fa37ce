package org.refactor.depcheck;

import java.util.List;

/**
 * 控制流图的只读视图：节点序列 + 后继关系
 *
 * @param <N> 节点类型（只要求 equals/hashCode 在一次分析期间稳定）
 */
public interface CfgProvider<N> {

    /**
     * @return 图中所有节点，按固定顺序
     */
    List<N> nodes();

    /**
     * @return 节点 n 的所有后继；出口节点返回空列表
     */
    List<N> successors(N n);
}
