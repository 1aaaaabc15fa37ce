package org.refactor.depcheck;

import com.google.common.base.Strings;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 命令行选项。默认值来自 classpath 上的 depcheck.properties，命令行参数覆盖默认值。
 * <pre>
 *   depcheck [--method NAME] [--dot DIR] [--no-data] [--source-root DIR] FILE.java
 * </pre>
 */
public class DependenceCheckOptions {

    static final String RESOURCE = "depcheck.properties";

    private Path sourceFile;
    private Path sourceRoot = Paths.get("src/main/java");
    private String method;          // null = 所有方法
    private Path dotDir;            // null = 不导出 dot
    private boolean dataDependences = true;

    public static DependenceCheckOptions defaults() {
        DependenceCheckOptions options = new DependenceCheckOptions();
        Properties props = new Properties();
        try (InputStream in = DependenceCheckOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + RESOURCE, e);
        }
        options.apply(props);
        return options;
    }

    void apply(Properties props) {
        String root = props.getProperty("depcheck.sourceRoot");
        if (!Strings.isNullOrEmpty(root)) {
            sourceRoot = Paths.get(root);
        }
        String dot = props.getProperty("depcheck.dotDir");
        if (!Strings.isNullOrEmpty(dot)) {
            dotDir = Paths.get(dot);
        }
        String data = props.getProperty("depcheck.dataDependences");
        if (!Strings.isNullOrEmpty(data)) {
            dataDependences = Boolean.parseBoolean(data.trim());
        }
    }

    /**
     * @throws IllegalArgumentException 未知选项、缺少参数值或没有指定源文件
     */
    public static DependenceCheckOptions parse(String[] args) {
        DependenceCheckOptions options = defaults();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--method":
                    options.method = value(args, ++i, arg);
                    break;
                case "--dot":
                    options.dotDir = Paths.get(value(args, ++i, arg));
                    break;
                case "--no-data":
                    options.dataDependences = false;
                    break;
                case "--source-root":
                    options.sourceRoot = Paths.get(value(args, ++i, arg));
                    break;
                default:
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option " + arg);
                    }
                    if (options.sourceFile != null) {
                        throw new IllegalArgumentException("Only one source file is accepted, got " + arg);
                    }
                    options.sourceFile = Paths.get(arg);
            }
        }
        if (options.sourceFile == null) {
            throw new IllegalArgumentException("No source file given");
        }
        return options;
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Option " + option + " needs a value");
        }
        return args[i];
    }

    public static String usage() {
        return "usage: depcheck [--method NAME] [--dot DIR] [--no-data] [--source-root DIR] FILE.java\n"
                + "  --method NAME       only analyze methods with this name\n"
                + "  --dot DIR           write one <method>.dot control dependence graph per method\n"
                + "  --no-data           skip data dependences\n"
                + "  --source-root DIR   source root for symbol resolution";
    }

    public Path sourceFile() {
        return sourceFile;
    }

    public Path sourceRoot() {
        return sourceRoot;
    }

    public String method() {
        return method;
    }

    public Path dotDir() {
        return dotDir;
    }

    public boolean dataDependences() {
        return dataDependences;
    }

    public boolean selects(String methodName) {
        return method == null || method.equals(methodName);
    }
}
