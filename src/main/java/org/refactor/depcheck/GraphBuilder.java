package org.refactor.depcheck;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.*;

import java.util.*;

/**
 * 语句级控制流图构建器
 */
public class GraphBuilder {

    /**
     * 构建控制流图 (CFG)
     * 使用 AST Visitor 模式，而非简单的列表索引，以正确处理嵌套和跳转。
     * <p>
     * 构建完成后图只有一个入口和一个出口：入口连向方法体的第一条语句和出口，
     * 所有没有后继的语句（return、throw、方法体末尾等）都连向出口。
     *
     * @param g    已经收集好语句（含合成的入口、出口节点）的上下文图
     * @param body 方法体，抽象方法为 null
     */
    public static void buildCFG(ContextGraph g, BlockStmt body) {
        CFGContext context = new CFGContext(g);

        Set<Integer> entry = Collections.singleton(g.entryId);
        Set<Integer> bodyExits = body == null ? entry : new CFGVisitor().visit(body, context, entry);

        // 方法体正常结束 -> 出口；入口 -> 出口（方法体不执行的那条虚拟路径）
        for (Integer e : bodyExits) {
            context.addEdge(e, g.exitId);
        }
        context.addEdge(g.entryId, g.exitId);

        // return / throw 等没有后继的语句 -> 出口
        for (StmtNode node : g.stmts) {
            if (node.id != g.exitId && !context.edges.containsKey(node.id)) {
                context.addEdge(node.id, g.exitId);
            }
        }

        // 后继按编号排序，保证输出稳定
        g.cfgSucc.clear();
        for (StmtNode node : g.stmts) {
            Set<Integer> tos = context.edges.getOrDefault(node.id, Collections.emptySet());
            g.cfgSucc.put(node.id, new ArrayList<>(new TreeSet<>(tos)));
        }
    }

    /**
     * CFG 构建的上下文，用于传递 break/continue 的目标和记录边
     */
    private static class CFGContext {
        ContextGraph graph;
        Map<Integer, Set<Integer>> edges = new HashMap<>();

        // 循环栈：保存当前循环的 continue 目标 (loop header) 和 break 出口
        Deque<LoopInfo> loopStack = new ArrayDeque<>();
        // Switch栈：保存 break 目标
        Deque<Set<Integer>> switchBreakStack = new ArrayDeque<>();
        // 标签 -> break 标签后流出的语句
        Map<String, Set<Integer>> labelBreaks = new HashMap<>();

        CFGContext(ContextGraph g) {
            this.graph = g;
        }

        void addEdge(int from, int to) {
            if (from == -1 || to == -1) return;
            edges.computeIfAbsent(from, k -> new HashSet<>()).add(to);
        }

        Integer getId(Statement s) {
            return graph.stmtIndex.get(s);
        }
    }

    private record LoopInfo(int headId, Set<Integer> breakExits, String label) {
    }

    /**
     * 核心 Visitor：接收一组前驱节点 (prevIds)，返回一组出口节点 (exitIds)
     */
    private static class CFGVisitor {

        // 返回值：执行完当前 stmt 后，控制流可能停留在的语句 ID 集合（用于连接下一条语句）
        // 入参：prevIds 是控制流到达当前 stmt 之前的前驱 ID 集合
        Set<Integer> visit(Statement stmt, CFGContext ctx, Set<Integer> prevIds) {
            // do-while 先执行循环体，前驱直接连到循环体
            if (stmt instanceof DoStmt doStmt) {
                return visitDo(doStmt, ctx, prevIds);
            }

            Integer currentId = ctx.getId(stmt);

            // 当前语句在图中有节点（不是 BlockStmt 等容器）时，建立 prev -> current 的边
            Set<Integer> currentPredecessors = prevIds;
            if (currentId != null) {
                for (Integer pid : prevIds) {
                    ctx.addEdge(pid, currentId);
                }
                currentPredecessors = new HashSet<>();
                currentPredecessors.add(currentId);
            }

            if (stmt instanceof BlockStmt block) {
                return visitBlock(block, ctx, currentPredecessors);
            } else if (stmt instanceof IfStmt ifStmt) {
                return visitIf(ifStmt, ctx, currentPredecessors);
            } else if (stmt instanceof ForStmt forStmt) {
                return visitLoop(forStmt, currentId, forStmt.getBody(), ctx);
            } else if (stmt instanceof ForEachStmt forEachStmt) {
                return visitLoop(forEachStmt, currentId, forEachStmt.getBody(), ctx);
            } else if (stmt instanceof WhileStmt whileStmt) {
                return visitLoop(whileStmt, currentId, whileStmt.getBody(), ctx);
            } else if (stmt instanceof SwitchStmt switchStmt) {
                return visitSwitch(switchStmt, ctx, currentPredecessors);
            } else if (stmt instanceof TryStmt tryStmt) {
                return visitTry(tryStmt, ctx, currentPredecessors);
            } else if (stmt instanceof SynchronizedStmt syncStmt) {
                return visit(syncStmt.getBody(), ctx, currentPredecessors);
            } else if (stmt instanceof LabeledStmt labeledStmt) {
                return visitLabeled(labeledStmt, ctx, currentPredecessors);
            } else if (stmt instanceof BreakStmt breakStmt) {
                handleBreak(breakStmt, ctx, currentPredecessors);
                return Collections.emptySet(); // Break 后控制流断开（流向了外部目标）
            } else if (stmt instanceof ContinueStmt continueStmt) {
                handleContinue(continueStmt, ctx, currentPredecessors);
                return Collections.emptySet();
            } else if (stmt instanceof ReturnStmt || stmt instanceof ThrowStmt) {
                // Return/Throw 由 buildCFG 统一连到出口
                return Collections.emptySet();
            } else {
                // 普通语句（ExpressionStmt, AssertStmt 等），直接流出
                return currentPredecessors;
            }
        }

        private Set<Integer> visitBlock(BlockStmt block, CFGContext ctx, Set<Integer> prevIds) {
            Set<Integer> currentPrevs = prevIds;
            for (Statement s : block.getStatements()) {
                // return 之后的死代码没有前驱，但仍然遍历，保证内部的边完整
                currentPrevs = visit(s, ctx, currentPrevs);
            }
            return currentPrevs;
        }

        private Set<Integer> visitIf(IfStmt stmt, CFGContext ctx, Set<Integer> prevIds) {
            Set<Integer> thenExits = visit(stmt.getThenStmt(), ctx, prevIds);

            Set<Integer> elseExits;
            if (stmt.getElseStmt().isPresent()) {
                elseExits = visit(stmt.getElseStmt().get(), ctx, prevIds);
            } else {
                // 没有 Else，控制流直接穿过 If
                elseExits = prevIds;
            }

            // 汇合：Then 的出口 U Else 的出口
            Set<Integer> finalExits = new HashSet<>();
            finalExits.addAll(thenExits);
            finalExits.addAll(elseExits);
            return finalExits;
        }

        /**
         * for / foreach / while：循环头 -> Body -> 循环头（回边）
         * 循环头节点同时承担条件判断，条件为假时从循环头离开
         */
        private Set<Integer> visitLoop(Statement loop, Integer headId, Statement body, CFGContext ctx) {
            Set<Integer> loopEntry = Collections.singleton(headId);

            LoopInfo loopInfo = new LoopInfo(headId, new HashSet<>(), labelOf(loop));
            ctx.loopStack.push(loopInfo);

            Set<Integer> bodyExits = visit(body, ctx, loopEntry);
            for (Integer exit : bodyExits) {
                ctx.addEdge(exit, headId);
            }

            ctx.loopStack.pop();

            Set<Integer> loopExits = new HashSet<>();
            loopExits.add(headId);
            loopExits.addAll(loopInfo.breakExits);
            return loopExits;
        }

        /**
         * do-while：DoStmt 节点代表尾部的条件检查，continue 也跳到这里
         * prev -> Body -> DoStmt(check) -> (true) Body 第一条语句
         *                               -> (false) 出口
         * Body 为空时 prev 直接连到 DoStmt，得到 DoStmt 自环
         */
        private Set<Integer> visitDo(DoStmt stmt, CFGContext ctx, Set<Integer> prevIds) {
            Integer doId = ctx.getId(stmt);

            LoopInfo loopInfo = new LoopInfo(doId, new HashSet<>(), labelOf(stmt));
            ctx.loopStack.push(loopInfo);

            Set<Integer> bodyExits = visit(stmt.getBody(), ctx, prevIds);
            for (Integer exit : bodyExits) {
                ctx.addEdge(exit, doId);
            }

            ctx.loopStack.pop();

            Integer bodyHead = firstNode(stmt.getBody(), ctx);
            ctx.addEdge(doId, bodyHead != null ? bodyHead : doId);

            Set<Integer> loopExits = new HashSet<>();
            loopExits.add(doId); // Do Check False
            loopExits.addAll(loopInfo.breakExits);
            return loopExits;
        }

        private Set<Integer> visitSwitch(SwitchStmt stmt, CFGContext ctx, Set<Integer> prevIds) {
            Integer switchId = ctx.getId(stmt);
            Set<Integer> switchEntry = new HashSet<>();
            if (switchId != null) switchEntry.add(switchId);
            else switchEntry.addAll(prevIds);

            ctx.switchBreakStack.push(new HashSet<>());

            // Switch -> 每个 Case 的第一句；上一个 Case 没有 break 时 fallthrough 到下一个
            Set<Integer> fallthrough = new HashSet<>(switchEntry);
            boolean hasDefault = false;
            for (SwitchEntry entry : stmt.getEntries()) {
                hasDefault |= entry.getLabels().isEmpty();

                Set<Integer> caseExits = new HashSet<>(fallthrough);
                caseExits.addAll(switchEntry);
                for (Statement s : entry.getStatements()) {
                    caseExits = visit(s, ctx, caseExits);
                }
                fallthrough = caseExits;
            }

            Set<Integer> currentExits = new HashSet<>(fallthrough);
            if (!hasDefault) {
                // 没有 default：没有匹配的 case 时直接跳过整个 switch
                currentExits.addAll(switchEntry);
            }
            currentExits.addAll(ctx.switchBreakStack.pop());
            return currentExits;
        }

        /**
         * try 块里任何位置都可能抛出异常，这里近似为从 try 语句本身跳到各个 catch；
         * finally 接在 try 块和所有 catch 的出口之后
         */
        private Set<Integer> visitTry(TryStmt stmt, CFGContext ctx, Set<Integer> prevIds) {
            Set<Integer> exits = new HashSet<>(visit(stmt.getTryBlock(), ctx, prevIds));
            for (CatchClause c : stmt.getCatchClauses()) {
                exits.addAll(visit(c.getBody(), ctx, prevIds));
            }
            if (stmt.getFinallyBlock().isPresent()) {
                return visit(stmt.getFinallyBlock().get(), ctx, exits);
            }
            return exits;
        }

        /**
         * label: stmt —— break label 从整个带标签语句之后流出
         */
        private Set<Integer> visitLabeled(LabeledStmt stmt, CFGContext ctx, Set<Integer> prevIds) {
            String label = stmt.getLabel().asString();
            Set<Integer> breaks = new HashSet<>();
            ctx.labelBreaks.put(label, breaks);

            Set<Integer> exits = new HashSet<>(visit(stmt.getStatement(), ctx, prevIds));

            ctx.labelBreaks.remove(label);
            exits.addAll(breaks);
            return exits;
        }

        private void handleBreak(BreakStmt stmt, CFGContext ctx, Set<Integer> prevIds) {
            if (stmt.getLabel().isPresent()) {
                Set<Integer> breaks = ctx.labelBreaks.get(stmt.getLabel().get().asString());
                if (breaks != null) {
                    breaks.addAll(prevIds);
                }
                return;
            }

            // 从当前 break 语句开始，向上遍历 AST 父节点，找到它所属的 switch 或循环
            Node current = stmt.getParentNode().orElse(null);
            while (current != null) {
                if (current instanceof SwitchStmt) {
                    if (!ctx.switchBreakStack.isEmpty()) {
                        ctx.switchBreakStack.peek().addAll(prevIds);
                    }
                    return;
                }

                if (current instanceof ForStmt ||
                        current instanceof WhileStmt ||
                        current instanceof DoStmt ||
                        current instanceof ForEachStmt) {
                    if (!ctx.loopStack.isEmpty()) {
                        ctx.loopStack.peek().breakExits.addAll(prevIds);
                    }
                    return;
                }

                // 遇到方法定义或类定义，说明 break 写在循环/switch 外，停止查找
                if (current instanceof MethodDeclaration || current instanceof TypeDeclaration) {
                    return;
                }
                current = current.getParentNode().orElse(null);
            }
        }

        private void handleContinue(ContinueStmt stmt, CFGContext ctx, Set<Integer> prevIds) {
            LoopInfo target = ctx.loopStack.peek();
            if (stmt.getLabel().isPresent()) {
                String label = stmt.getLabel().get().asString();
                target = null;
                for (LoopInfo loop : ctx.loopStack) {
                    if (label.equals(loop.label)) {
                        target = loop;
                        break;
                    }
                }
            }
            if (target != null) {
                for (Integer p : prevIds) {
                    ctx.addEdge(p, target.headId);
                }
            }
        }

        // 循环直接挂在 LabeledStmt 下时返回标签名
        private String labelOf(Statement loop) {
            return loop.getParentNode()
                    .filter(p -> p instanceof LabeledStmt)
                    .map(p -> ((LabeledStmt) p).getLabel().asString())
                    .orElse(null);
        }

        /**
         * 语句执行时到达的第一个图节点；空块返回 null
         */
        private Integer firstNode(Statement stmt, CFGContext ctx) {
            // do-while 最先执行的是循环体
            if (stmt instanceof DoStmt doStmt) {
                Integer first = firstNode(doStmt.getBody(), ctx);
                return first != null ? first : ctx.getId(stmt);
            }
            Integer id = ctx.getId(stmt);
            if (id != null) {
                return id;
            }
            if (stmt instanceof BlockStmt block) {
                for (Statement s : block.getStatements()) {
                    Integer first = firstNode(s, ctx);
                    if (first != null) {
                        return first;
                    }
                }
            }
            return null;
        }
    }
}
