package org.refactor.depcheck;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.nio.file.Files;

/**
 * 读取一个 Java 文件，对其中的每个方法：
 * - 提取语句
 * - 构建 CFG + 后支配树 + CDG + DFG
 * - 输出 JSON，按需输出 dot
 */
public class Main {

    public static void main(String[] args) throws IOException {
        DependenceCheckOptions options;
        try {
            options = DependenceCheckOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(DependenceCheckOptions.usage());
            System.exit(2);
            return;
        }
        System.exit(run(options));
    }

    static int run(DependenceCheckOptions options) throws IOException {
        // 1. 配置 SymbolSolver（JDK + 源码目录）
        CombinedTypeSolver typeSolver = new CombinedTypeSolver();
        typeSolver.add(new ReflectionTypeSolver());
        if (Files.isDirectory(options.sourceRoot())) {
            typeSolver.add(new JavaParserTypeSolver(options.sourceRoot()));
        }

        ParserConfiguration config = new ParserConfiguration()
                .setSymbolResolver(new JavaSymbolSolver(typeSolver));
        StaticJavaParser.setConfiguration(config);

        // 2. 解析源文件，语法错误逐条列出
        CompilationUnit cu;
        try {
            cu = StaticJavaParser.parse(options.sourceFile());
        } catch (ParseProblemException e) {
            System.err.println("[syntax error] " + options.sourceFile());
            e.getProblems().forEach(p -> {
                int line = p.getLocation()
                        .flatMap(l -> l.getBegin().getRange())
                        .map(r -> r.begin.line)
                        .orElse(-1);
                System.err.println("   -> Line " + line + ": " + p.getMessage());
            });
            return 1;
        }

        Gson gson = new GsonBuilder()
                .setPrettyPrinting()
                .create();

        // 3. 遍历文件中的每个方法，构建上下文图并输出 JSON
        MethodAnalyzer analyzer = new MethodAnalyzer(options.dataDependences());
        for (MethodDeclaration md : cu.findAll(MethodDeclaration.class)) {
            if (!options.selects(md.getNameAsString())) {
                continue;
            }
            System.out.println("===== Method: " + md.getNameAsString() + " =====");

            ContextGraph graph = analyzer.analyze(md);

            if (options.dotDir() != null) {
                DotExporter.write(graph.controlDependences, graph.method,
                                id -> graph.node(id).label(), options.dotDir())
                        .ifPresent(graph.diagnostics::add);
            }

            System.out.println(gson.toJson(graph));
        }
        return 0;
    }
}
