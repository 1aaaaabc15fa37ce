package org.refactor.depcheck;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.*;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 方法分析器，用于分析Java方法并构建上下文图
 * <p>
 * 该类负责解析方法声明，提取其中的语句节点，构建控制流图(CFG)，
 * 再依次计算后支配树、控制依赖图(CDG)和数据依赖(DFG)。
 * 每次 {@link #analyze} 都返回一个新的上下文图，分析器本身不保留上一次的结果。
 */
public class MethodAnalyzer {

    private static final Logger LOG = Logger.getLogger(MethodAnalyzer.class.getName());

    private final boolean dataDependences;

    private ContextGraph graph;
    private int idCounter = 0;

    /**
     * 构造一个同时计算控制依赖和数据依赖的分析器
     */
    public MethodAnalyzer() {
        this(true);
    }

    /**
     * @param dataDependences 是否计算数据依赖
     */
    public MethodAnalyzer(boolean dataDependences) {
        this.dataDependences = dataDependences;
    }

    /**
     * 分析给定的方法声明并构建上下文图
     *
     * @param md 要分析的方法声明
     * @return 包含方法语句、控制流、控制依赖和数据依赖信息的上下文图
     */
    public ContextGraph analyze(MethodDeclaration md) {
        idCounter = 0;
        graph = new ContextGraph();
        graph.method = md.getNameAsString();

        graph.entryId = addSynthetic(StmtNode.ENTRY);
        BlockStmt body = md.getBody().orElse(null);
        if (body != null) {
            // 从方法体 BlockStmt 开始递归收集语句
            for (Statement s : body.getStatements()) {
                collectStmtRecursive(s);
            }
        }
        graph.exitId = addSynthetic(StmtNode.EXIT);

        // 语句收集完，再构建 CFG
        GraphBuilder.buildCFG(graph, body);

        // 单入口单出口的 CFG 上，只有无法到达出口的语句（死循环）才会落在后支配树的其它分量里
        graph.postDominators = PostDominatorAnalysis.compute(graph);
        graph.addControlDependences(ControlDependenceAnalysis.compute(graph, graph.postDominators));

        if (dataDependences) {
            ReachingDefinitionsOracle oracle = new ReachingDefinitionsOracle(graph);
            graph.addDataDependences(DataDependenceAggregator.aggregate(
                    graph.nodes(), oracle::accessesMemory, oracle));
        }

        LOG.log(Level.FINE, "{0}: {1} statement(s), {2} control dependence(s), {3} diagnostic(s)",
                new Object[]{graph.method, graph.stmts.size(), graph.controlDependences.edgeCount(),
                        graph.diagnostics.size()});
        return graph;
    }

    private int addSynthetic(String kind) {
        StmtNode node = StmtNode.synthetic(idCounter++, kind);
        graph.stmts.add(node);
        return node.id;
    }

    /**
     * 递归收集语句节点
     *
     * @param s 当前要处理的语句
     */
    private void collectStmtRecursive(Statement s) {
        // 如果是 BlockStmt，本身不建节点，只遍历里面的语句
        if (s.isBlockStmt()) {
            for (Statement child : s.asBlockStmt().getStatements()) {
                collectStmtRecursive(child);
            }
            return;
        }

        // 为当前语句建一个节点
        StmtNode node = new StmtNode();
        node.id = idCounter++;
        node.code = s.toString();
        node.kind = s.getClass().getSimpleName();
        node.lineStart = s.getBegin().map(p -> p.line).orElse(-1);
        node.lineEnd = s.getEnd().map(p -> p.line).orElse(-1);
        node.astNode = s;

        VarDefUseCollector.collect(s, node.defs, node.uses);

        graph.stmts.add(node);
        graph.stmtIndex.put(s, node.id);

        // 对控制结构内部再递归收集子语句
        if (s.isIfStmt()) {
            IfStmt is = s.asIfStmt();
            collectStmtRecursive(is.getThenStmt());
            is.getElseStmt().ifPresent(this::collectStmtRecursive);
        } else if (s.isForStmt()) {
            collectStmtRecursive(s.asForStmt().getBody());
        } else if (s.isForEachStmt()) {
            collectStmtRecursive(s.asForEachStmt().getBody());
        } else if (s.isWhileStmt()) {
            collectStmtRecursive(s.asWhileStmt().getBody());
        } else if (s.isDoStmt()) {
            collectStmtRecursive(s.asDoStmt().getBody());
        } else if (s.isTryStmt()) {
            TryStmt ts = s.asTryStmt();
            collectStmtRecursive(ts.getTryBlock());
            ts.getCatchClauses().forEach(c -> collectStmtRecursive(c.getBody()));
            ts.getFinallyBlock().ifPresent(this::collectStmtRecursive);
        } else if (s.isSwitchStmt()) {
            s.asSwitchStmt().getEntries().forEach(e -> {
                e.getStatements().forEach(this::collectStmtRecursive);
            });
        } else if (s.isSynchronizedStmt()) {
            collectStmtRecursive(s.asSynchronizedStmt().getBody());
        } else if (s.isLabeledStmt()) {
            collectStmtRecursive(s.asLabeledStmt().getStatement());
        }
        // 其它类型语句（表达式、return 等）本身节点已经建完，不需要额外处理
    }
}
