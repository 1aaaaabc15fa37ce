package org.refactor.depcheck;

/**
 * 访存依赖的分类，由外部的访存依赖查询给出，这里只负责记录
 */
public enum DependenceKind {
    /** 依赖于一条覆盖了目标内存的指令，例如可能别名的写 */
    CLOBBER("Clobber"),
    /** 依赖于一条定义了目标内存的指令 */
    DEF("Def"),
    /** 在整个函数内都没有依赖 */
    NON_FUNC_LOCAL("NonFuncLocal"),
    /** 依赖来自其它基本块，需要做非局部查询 */
    NON_LOCAL("NonLocal"),
    /** 依赖未知 */
    UNKNOWN("Unknown");

    private final String displayName;

    DependenceKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
