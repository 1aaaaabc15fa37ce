package org.refactor.depcheck;

import java.util.*;

/**
 * 基于到达定值 (Reaching Definitions) 的访存依赖查询，以语句为指令、变量名为地址。
 * <p>
 * 每条语句自成一个基本块，所以只要使用的变量有到达定值，结果就是 NonLocal，
 * 每个 (变量, 定义语句) 对对应一条到达定值；使用的变量都没有到达定值（参数、字段）时为 NonFuncLocal。
 * synchronized 语句的监视器访问按原子访问处理，不支持查询。
 */
public class ReachingDefinitionsOracle implements MemoryDependenceOracle<Integer, String> {

    private final ContextGraph g;

    // 到达语句入口的定值语句集合
    private final Map<Integer, Set<Integer>> in = new HashMap<>();

    public ReachingDefinitionsOracle(ContextGraph g) {
        this.g = g;
        solve();
    }

    /**
     * 只有使用了变量的语句才需要查询
     */
    public boolean accessesMemory(Integer id) {
        return !g.node(id).uses.isEmpty();
    }

    @Override
    public MemoryDependence<Integer, String> query(Integer id) throws UnsupportedAccessException {
        StmtNode sn = g.node(id);
        if ("SynchronizedStmt".equals(sn.kind)) {
            throw new UnsupportedAccessException("monitor access in synchronized statement is not handled");
        }

        List<MemoryDependence.NonLocalEntry<Integer, String>> entries = new ArrayList<>();
        Set<Integer> reachingDefs = new TreeSet<>(in.getOrDefault(id, Collections.emptySet()));
        for (String v : sn.uses) {
            for (Integer d : reachingDefs) {
                // 检查 d 是否真的定义了 v
                if (g.node(d).defs.contains(v)) {
                    entries.add(new MemoryDependence.NonLocalEntry<>(v, d));
                }
            }
        }

        if (entries.isEmpty()) {
            return MemoryDependence.local(DependenceKind.NON_FUNC_LOCAL, null);
        }
        return MemoryDependence.nonLocal(entries);
    }

    /**
     * IN[u] = ∪ OUT[p]，p 取遍 u 的前驱
     * OUT[u] = GEN[u] ∪ (IN[u] - KILL[u])
     * 迭代直到不动点
     */
    private void solve() {
        // 1. 预处理：变量 -> 定义它的语句，语句 -> 前驱
        Map<String, List<Integer>> varToDefs = new HashMap<>();
        Map<Integer, List<Integer>> preds = new HashMap<>();
        for (StmtNode sn : g.stmts) {
            for (String v : sn.defs) {
                varToDefs.computeIfAbsent(v, k -> new ArrayList<>()).add(sn.id);
            }
            for (Integer s : g.successors(sn.id)) {
                preds.computeIfAbsent(s, k -> new ArrayList<>()).add(sn.id);
            }
        }

        // 2. 初始化 IN 和 OUT 集合
        Map<Integer, Set<Integer>> out = new HashMap<>();
        for (StmtNode sn : g.stmts) {
            in.put(sn.id, new HashSet<>());
            out.put(sn.id, new HashSet<>());
        }

        // 3. 迭代计算直到不动点
        boolean changed = true;
        while (changed) {
            changed = false;
            for (StmtNode sn : g.stmts) {
                int u = sn.id;

                Set<Integer> newIn = new HashSet<>();
                for (Integer p : preds.getOrDefault(u, Collections.emptyList())) {
                    newIn.addAll(out.get(p));
                }

                // KILL[u]：u 定义的变量的所有定值
                Set<Integer> newOut = new HashSet<>(newIn);
                for (String v : sn.defs) {
                    newOut.removeAll(varToDefs.get(v));
                }
                if (!sn.defs.isEmpty()) {
                    newOut.add(u);
                }

                if (!newIn.equals(in.get(u)) || !newOut.equals(out.get(u))) {
                    in.put(u, newIn);
                    out.put(u, newOut);
                    changed = true;
                }
            }
        }
    }
}
