package org.refactor.depcheck;

import com.github.javaparser.ast.stmt.Statement;

import java.util.*;

/**
 * 存放一个方法的所有语句节点 + CFG + CDG + DFG
 * <p>
 * 本身就是以语句编号为节点的控制流图，可以直接交给后支配分析和控制依赖分析。
 */
public class ContextGraph implements CfgProvider<Integer> {
    // 方法名
    public String method;

    // 顺序收集的语句列表，stmts.get(i).id == i
    public List<StmtNode> stmts = new ArrayList<>();

    public int entryId = -1;
    public int exitId = -1;

    // CFG：控制流后继边  id -> 后继 id 列表
    public Map<Integer, List<Integer>> cfgSucc = new LinkedHashMap<>();

    // CDG：控制依赖边  控制语句 id -> 依赖于它的语句 id 列表
    public Map<Integer, List<Integer>> cdgSucc = new LinkedHashMap<>();

    // DFG：数据流后继边  定义语句 id -> 使用该值的语句 id 列表
    public Map<Integer, List<Integer>> dfgSucc = new LinkedHashMap<>();

    // 每条访存语句的依赖类型（Def / NonLocal / NonFuncLocal ...）
    public Map<Integer, String> memoryDeps = new LinkedHashMap<>();

    // 分析过程中的可恢复问题
    public List<Diagnostic> diagnostics = new ArrayList<>();

    // AST 节点到语句 id 的映射（内部使用，不输出 JSON）
    public transient Map<Statement, Integer> stmtIndex = new IdentityHashMap<>();

    public transient PostDominatorTree<Integer> postDominators;
    public transient ControlDependenceGraph<Integer> controlDependences;
    public transient DataDependences<Integer, String> dataDependences;

    public StmtNode node(int id) {
        return stmts.get(id);
    }

    @Override
    public List<Integer> nodes() {
        List<Integer> ids = new ArrayList<>(stmts.size());
        for (StmtNode sn : stmts) {
            ids.add(sn.id);
        }
        return ids;
    }

    @Override
    public List<Integer> successors(Integer n) {
        return cfgSucc.getOrDefault(n, Collections.emptyList());
    }

    void addControlDependences(ControlDependenceGraph<Integer> cdg) {
        controlDependences = cdg;
        cdgSucc.clear();
        cdg.entries().forEach(e -> cdgSucc.put(e.getKey(), new ArrayList<>(e.getValue())));
        diagnostics.addAll(cdg.diagnostics());
    }

    void addDataDependences(DataDependences<Integer, String> deps) {
        dataDependences = deps;
        dfgSucc.clear();
        memoryDeps.clear();
        for (StmtNode sn : stmts) {
            deps.kindOf(sn.id).ifPresent(k -> memoryDeps.put(sn.id, k.displayName()));
            // 非局部依赖即到达定值：定义语句 d -> 使用语句 u
            for (MemoryDependence.NonLocalEntry<Integer, String> e : deps.nonLocal(sn.id)) {
                List<Integer> uses = dfgSucc.computeIfAbsent(e.dependent(), k -> new ArrayList<>());
                if (!uses.contains(sn.id)) {
                    uses.add(sn.id);
                }
            }
        }
        diagnostics.addAll(deps.diagnostics());
    }
}
