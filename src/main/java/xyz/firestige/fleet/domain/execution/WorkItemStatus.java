package xyz.firestige.fleet.domain.execution;

/**
 * 工作项状态
 */
public enum WorkItemStatus {

    PENDING("等待执行"),

    APPLYING("执行中"),

    SUCCEEDED("成功"),

    /**
     * 本次尝试失败，仍可能重试
     */
    FAILED("失败"),

    /**
     * 重试预算耗尽或遇到致命错误
     */
    FATALLY_FAILED("致命失败"),

    SKIPPED("已跳过"),

    CANCELLED("已取消");

    private final String description;

    WorkItemStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FATALLY_FAILED || this == SKIPPED || this == CANCELLED;
    }

    /**
     * 是否允许后续阶段继续推进
     */
    public boolean allowsProgression() {
        return this == SUCCEEDED || this == SKIPPED;
    }
}
