package org.refactor.depcheck;

import com.google.common.base.Strings;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 把控制依赖图输出成 Graphviz 的 dot 文本。
 * <p>
 * 控制依赖图中 Y 是 X 的后代当且仅当 Y 控制依赖于 X，所以边从控制节点指向依赖节点。
 * 每个出现过的节点只声明一次，每个 (控制节点, 依赖节点) 对输出一条边。
 */
public class DotExporter {

    private static final Logger LOG = Logger.getLogger(DotExporter.class.getName());

    static final String DEFAULT_NAME = "controldeps";

    public static <N> String toDot(ControlDependenceGraph<N> cdg, String name, Function<? super N, String> labeler) {
        String graphName = Strings.isNullOrEmpty(name) ? DEFAULT_NAME : name;

        // 已经声明过的节点 -> dot 中的节点名
        Map<N, String> declared = new HashMap<>();
        StringBuilder out = new StringBuilder();
        out.append("digraph \"CDG for ").append(escape(graphName)).append("\" {\n");

        for (Map.Entry<N, ? extends Set<N>> e : cdg.entries()) {
            String tail = declare(out, declared, e.getKey(), labeler);
            for (N dep : e.getValue()) {
                String head = declare(out, declared, dep, labeler);
                out.append(tail).append(" -> ").append(head).append(";\n");
            }
        }

        out.append("}\n");
        return out.toString();
    }

    /**
     * 写入 dir/name.dot。写文件失败只影响导出本身，已算好的控制依赖图不受影响。
     *
     * @return 失败时返回对应的诊断，成功时为 empty
     */
    public static <N> Optional<Diagnostic> write(ControlDependenceGraph<N> cdg, String name,
                                                 Function<? super N, String> labeler, Path dir) {
        String graphName = Strings.isNullOrEmpty(name) ? DEFAULT_NAME : name;
        Path file = dir.resolve(graphName + ".dot");
        try {
            Files.createDirectories(dir);
            Files.writeString(file, toDot(cdg, graphName, labeler), StandardCharsets.UTF_8);
            LOG.log(Level.FINE, "wrote {0}", file);
            return Optional.empty();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Error opening output file " + file, e);
            return Optional.of(Diagnostic.exportFailure(file.toString(), e));
        }
    }

    private static <N> String declare(StringBuilder out, Map<N, String> declared, N node,
                                      Function<? super N, String> labeler) {
        String id = declared.get(node);
        if (id == null) {
            id = "Node" + declared.size();
            declared.put(node, id);
            out.append(id).append(" [shape=record, label=\"")
                    .append(recordLabel(labeler.apply(node)))
                    .append("\"];\n");
        }
        return id;
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * record 形状的标签里 {}|<> 有特殊含义，需要转义；换行改成 \l 使文本左对齐
     */
    static String recordLabel(String label) {
        StringBuilder sb = new StringBuilder();
        String text = label == null ? "" : label;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                continue;
            }
            if (c == '\n') {
                sb.append("\\l");
            } else if ("\\\"{}|<>".indexOf(c) >= 0) {
                sb.append('\\').append(c);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
