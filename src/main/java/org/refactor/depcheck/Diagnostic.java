package org.refactor.depcheck;

/**
 * 分析过程中遇到的可恢复问题。出现诊断不代表结果不可用，只代表结果可能不完整。
 */
public record Diagnostic(Kind kind, String message) {

    public enum Kind {
        /** 边的两端在后支配树上没有公共祖先，该边被跳过 */
        MISSING_ANCESTOR,
        /** 原子/volatile 访存无法做非局部查询，该指令不记录依赖 */
        UNSUPPORTED_ACCESS_KIND,
        /** 图导出写文件失败 */
        EXPORT_IO_FAILURE
    }

    public static Diagnostic missingAncestor(CfgEdge<?> edge) {
        return new Diagnostic(Kind.MISSING_ANCESTOR, "no common post-dominator for edge " + edge);
    }

    public static Diagnostic unsupportedAccess(Object instruction, String reason) {
        return new Diagnostic(Kind.UNSUPPORTED_ACCESS_KIND, instruction + ": " + reason);
    }

    public static Diagnostic exportFailure(String target, Exception cause) {
        return new Diagnostic(Kind.EXPORT_IO_FAILURE, "cannot write " + target + ": " + cause.getMessage());
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
