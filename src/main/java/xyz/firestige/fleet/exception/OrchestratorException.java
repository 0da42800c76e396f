package xyz.firestige.fleet.exception;

/**
 * 编排器基础异常类
 * 所有编排相关异常的基类，携带错误类型
 */
public class OrchestratorException extends RuntimeException {

    /**
     * 错误类型
     */
    private final ErrorType errorType;

    public OrchestratorException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public OrchestratorException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }

    /**
     * 转换为 FailureInfo
     */
    public FailureInfo toFailureInfo(String failedAt) {
        FailureInfo info = FailureInfo.of(errorType, getMessage(), failedAt);
        info.setRetryable(isRetryable());
        if (getCause() != null) {
            info.setRootCause(FailureInfo.rootCauseOf(this));
        }
        return info;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
