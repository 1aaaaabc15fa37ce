package org.refactor.depcheck;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;

import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 收集一条语句定义（def）和使用（use）的局部变量名。
 * <p>
 * 控制结构只看它自己的头部（条件、选择子、初始化等），内部语句各自是独立的节点。
 */
public class VarDefUseCollector {

    private static final Logger LOG = Logger.getLogger(VarDefUseCollector.class.getName());

    public static void collect(Node stmt, Set<String> defs, Set<String> uses) {

        if (stmt instanceof IfStmt ifStmt) {
            analyzeExpression(ifStmt.getCondition(), defs, uses);
            return;
        }

        if (stmt instanceof ForStmt forStmt) {
            forStmt.getInitialization().forEach(init -> analyzeExpression(init, defs, uses));
            forStmt.getCompare().ifPresent(c -> analyzeExpression(c, defs, uses));
            forStmt.getUpdate().forEach(u -> analyzeExpression(u, defs, uses));
            return;
        }

        if (stmt instanceof ForEachStmt forEachStmt) {
            // 每轮迭代都给循环变量赋值
            analyzeExpression(forEachStmt.getVariable(), defs, uses);
            analyzeExpression(forEachStmt.getIterable(), defs, uses);
            return;
        }

        if (stmt instanceof WhileStmt whileStmt) {
            analyzeExpression(whileStmt.getCondition(), defs, uses);
            return;
        }

        if (stmt instanceof DoStmt doStmt) {
            analyzeExpression(doStmt.getCondition(), defs, uses);
            return;
        }

        if (stmt instanceof SwitchStmt switchStmt) {
            analyzeExpression(switchStmt.getSelector(), defs, uses);
            return;
        }

        if (stmt instanceof SynchronizedStmt syncStmt) {
            analyzeExpression(syncStmt.getExpression(), defs, uses);
            return;
        }

        if (stmt instanceof TryStmt tryStmt) {
            tryStmt.getResources().forEach(r -> analyzeExpression(r, defs, uses));
            return;
        }

        if (stmt instanceof LabeledStmt || stmt instanceof LocalClassDeclarationStmt) {
            return;
        }

        // 普通语句：整棵子树分析
        analyzeExpression(stmt, defs, uses);
    }

    private static void analyzeExpression(Node node, Set<String> defs, Set<String> uses) {
        node.walk(n -> {

            // 1) NameExpr：默认视为 use，但要排除简单赋值的左值
            if (n instanceof NameExpr nameExpr) {
                if (nameExpr.getParentNode().isPresent()) {
                    Node parent = nameExpr.getParentNode().get();
                    if (parent instanceof AssignExpr assign &&
                            assign.getTarget() == nameExpr &&
                            assign.getOperator() == AssignExpr.Operator.ASSIGN) {
                        // 这是赋值左侧，稍后由 AssignExpr 处理 defs，不算 use
                        return;
                    }
                }
                uses.add(variableName(nameExpr));
            }

            // 2) 变量声明：def
            if (n instanceof VariableDeclarator vd) {
                defs.add(vd.getNameAsString());
            }

            // 3) 赋值左值：def（复合赋值 x += 1 同时也是 use，上面已经记下）
            if (n instanceof AssignExpr assignExpr) {
                Expression target = assignExpr.getTarget();
                if (target.isNameExpr()) {
                    defs.add(variableName(target.asNameExpr()));
                }
                // 右侧表达式里的 NameExpr 会在 walk 过程中自然被视为 use
            }

            // 4) ++ / --：def + use
            if (n instanceof UnaryExpr unary && isIncrementOrDecrement(unary.getOperator())
                    && unary.getExpression().isNameExpr()) {
                defs.add(variableName(unary.getExpression().asNameExpr()));
            }
        });
    }

    private static boolean isIncrementOrDecrement(UnaryExpr.Operator op) {
        return op == UnaryExpr.Operator.PREFIX_INCREMENT || op == UnaryExpr.Operator.PREFIX_DECREMENT
                || op == UnaryExpr.Operator.POSTFIX_INCREMENT || op == UnaryExpr.Operator.POSTFIX_DECREMENT;
    }

    /**
     * 优先用 SymbolSolver 解析出的名字；没有配置解析器或解析失败时退回源码中的名字
     */
    private static String variableName(NameExpr nameExpr) {
        try {
            return nameExpr.resolve().getName();
        } catch (RuntimeException e) {
            LOG.log(Level.FINEST, "cannot resolve {0}: {1}", new Object[]{nameExpr, e.getMessage()});
            return nameExpr.getNameAsString();
        }
    }
}
