package xyz.firestige.fleet.exception;

/**
 * 错误类型枚举
 * 用于区分部署过程中的错误类别，决定是否重试以及退出码
 */
public enum ErrorType {

    /**
     * 清单校验错误（执行前，致命）
     */
    VALIDATION_ERROR("校验错误", false),

    /**
     * 依赖环（执行前，致命）
     */
    CYCLE_ERROR("依赖环错误", false),

    /**
     * 外部协作方的暂时性失败（可重试）
     */
    TRANSIENT_APPLY_ERROR("暂时性应用错误", true),

    /**
     * 外部协作方的永久性失败或凭据缺失（不可重试）
     */
    FATAL_APPLY_ERROR("致命应用错误", false),

    /**
     * 健康检查超时（按暂时性错误处理）
     */
    HEALTH_TIMEOUT_ERROR("健康检查超时", true),

    /**
     * 状态持久化失败
     */
    STATE_STORE_ERROR("状态存储错误", false),

    /**
     * 未知错误
     */
    UNKNOWN_ERROR("未知错误", false);

    private final String description;
    private final boolean retryable;

    ErrorType(String description, boolean retryable) {
        this.description = description;
        this.retryable = retryable;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
