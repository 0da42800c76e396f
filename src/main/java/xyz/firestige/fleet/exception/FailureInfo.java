package xyz.firestige.fleet.exception;

import java.time.Instant;

/**
 * 失败信息封装类
 * 统一封装工作项执行过程中的失败信息，保证失败时能给出服务、资源类型和根因
 */
public class FailureInfo {

    /**
     * 错误码
     */
    private String errorCode;

    /**
     * 错误消息
     */
    private String errorMessage;

    /**
     * 错误类型
     */
    private ErrorType errorType;

    /**
     * 失败位置（service/kind）
     */
    private String failedAt;

    /**
     * 根因描述
     */
    private String rootCause;

    /**
     * 失败时间
     */
    private Instant timestamp;

    /**
     * 是否可重试
     */
    private boolean retryable;

    public FailureInfo() {
        this.timestamp = Instant.now();
    }

    public FailureInfo(String errorCode, String errorMessage, ErrorType errorType) {
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
        this.errorType = errorType;
        this.timestamp = Instant.now();
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage, String failedAt) {
        FailureInfo info = new FailureInfo(errorType.name(), errorMessage, errorType);
        info.setFailedAt(failedAt);
        info.setRetryable(errorType.isRetryable());
        return info;
    }

    /**
     * 从任意异常构造失败信息
     * <p>
     * 编排器自身异常按其错误类型处理；其它异常按类名判断是否为超时、网络、连接类问题，是则视为暂时性错误
     */
    public static FailureInfo fromException(Throwable e, String failedAt) {
        if (e instanceof OrchestratorException oe) {
            return oe.toFailureInfo(failedAt);
        }
        ErrorType type = isRetryableException(e) ? ErrorType.TRANSIENT_APPLY_ERROR : ErrorType.FATAL_APPLY_ERROR;
        FailureInfo info = of(type, String.valueOf(e.getMessage()), failedAt);
        info.setRootCause(rootCauseOf(e));
        return info;
    }

    public static boolean isRetryableException(Throwable e) {
        if (e instanceof OrchestratorException oe) {
            return oe.isRetryable();
        }
        String className = e.getClass().getName();
        return className.contains("Timeout") ||
               className.contains("Network") ||
               className.contains("Connection");
    }

    static String rootCauseOf(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }

    // Getters and Setters

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public void setErrorType(ErrorType errorType) {
        this.errorType = errorType;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(String failedAt) {
        this.failedAt = failedAt;
    }

    public String getRootCause() {
        return rootCause;
    }

    public void setRootCause(String rootCause) {
        this.rootCause = rootCause;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public void setRetryable(boolean retryable) {
        this.retryable = retryable;
    }

    @Override
    public String toString() {
        return "FailureInfo{" +
                "errorCode='" + errorCode + '\'' +
                ", errorMessage='" + errorMessage + '\'' +
                ", failedAt='" + failedAt + '\'' +
                ", rootCause='" + rootCause + '\'' +
                ", retryable=" + retryable +
                '}';
    }
}
