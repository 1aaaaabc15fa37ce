package org.refactor.depcheck;

import com.github.javaparser.ast.stmt.Statement;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 表示方法中的一条语句（或一个控制结构语句），也可以是合成的入口/出口节点
 */
public class StmtNode {
    public static final String ENTRY = "Entry";
    public static final String EXIT = "Exit";

    public int id;              // 语句在方法内的编号，入口为 0
    public String code;         // 语句源码
    public int lineStart;       // 起始行号
    public int lineEnd;         // 结束行号
    public Set<String> defs = new LinkedHashSet<>(); // 定义的变量
    public Set<String> uses = new LinkedHashSet<>(); // 使用的变量
    public String kind;         // 语句类型名称（类名），合成节点为 Entry / Exit

    // AST 节点引用，合成节点为 null（不参与 JSON 序列化）
    public transient Statement astNode;

    static StmtNode synthetic(int id, String kind) {
        StmtNode node = new StmtNode();
        node.id = id;
        node.kind = kind;
        node.code = kind.toLowerCase();
        node.lineStart = -1;
        node.lineEnd = -1;
        return node;
    }

    public boolean isSynthetic() {
        return astNode == null;
    }

    /**
     * 导出 dot 时用的标签：编号 + 源码
     */
    public String label() {
        return id + ": " + code;
    }

    @Override
    public String toString() {
        return id + ":" + kind;
    }
}
