package xyz.firestige.fleet.infrastructure.execution;

/**
 * 运行结果与退出码
 */
public enum RunOutcome {

    SUCCEEDED(0, "全部成功"),

    /**
     * 执行前致命错误，或没有任何工作项成功
     */
    FAILED(1, "失败"),

    /**
     * 部分工作项成功，部分致命失败
     */
    PARTIAL(3, "部分成功"),

    CANCELLED(130, "已取消");

    private final int exitCode;
    private final String description;

    RunOutcome(int exitCode, String description) {
        this.exitCode = exitCode;
        this.description = description;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getDescription() {
        return description;
    }
}
