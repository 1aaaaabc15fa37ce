package org.refactor.depcheck;

/**
 * 访存依赖查询无法处理的访问（原子、volatile 等）
 */
public class UnsupportedAccessException extends Exception {

    public UnsupportedAccessException(String message) {
        super(message);
    }
}
