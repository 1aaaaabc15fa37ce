package org.refactor.depcheck;

import java.util.*;

/**
 * 测试用的控制流图：节点按首次出现的顺序排列
 */
class TestCfg implements CfgProvider<String> {

    private final Map<String, List<String>> succ = new LinkedHashMap<>();

    static TestCfg of(String... edges) {
        TestCfg cfg = new TestCfg();
        for (String e : edges) {
            String[] parts = e.split("->");
            cfg.edge(parts[0].trim(), parts[1].trim());
        }
        return cfg;
    }

    TestCfg node(String n) {
        succ.computeIfAbsent(n, k -> new ArrayList<>());
        return this;
    }

    TestCfg edge(String from, String to) {
        node(from);
        node(to);
        succ.get(from).add(to);
        return this;
    }

    @Override
    public List<String> nodes() {
        return new ArrayList<>(succ.keySet());
    }

    @Override
    public List<String> successors(String n) {
        List<String> s = succ.get(n);
        if (s == null) {
            throw new IllegalArgumentException("unknown node " + n);
        }
        return s;
    }

    static TestCfg diamond() {
        return of("Entry->A", "Entry->B", "A->Merge", "B->Merge", "Merge->Exit");
    }

    static TestCfg ifWithoutElse() {
        return of("Entry->Then", "Entry->Merge", "Then->Merge");
    }

    static TestCfg whileLoop() {
        return of("Entry->Header", "Header->Body", "Body->Header", "Header->Exit");
    }
}
