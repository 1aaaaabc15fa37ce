package org.refactor.depcheck;

/**
 * 外部的访存依赖查询。依赖与别名分析都由实现方完成，调用方只做分类和记录。
 */
public interface MemoryDependenceOracle<I, A> {

    /**
     * @throws UnsupportedAccessException 指令是原子或 volatile 访问，无法做非局部查询
     */
    MemoryDependence<I, A> query(I instruction) throws UnsupportedAccessException;
}
