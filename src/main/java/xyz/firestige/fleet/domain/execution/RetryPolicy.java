package xyz.firestige.fleet.domain.execution;

/**
 * 重试策略值对象（Value Object）
 * <p>
 * 职责：
 * 1. 封装已重试次数和重试上限
 * 2. 提供重试判断和计数增加方法
 * 3. 不可变对象，线程安全
 * <p>
 * maxRetry 为重试次数，不含首次尝试：maxRetry = 3 时一个工作项最多执行 4 次
 */
public final class RetryPolicy {

    private final int retryCount;
    private final int maxRetry;

    private RetryPolicy(int retryCount, int maxRetry) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount 不能为负数");
        }
        if (maxRetry < 0) {
            throw new IllegalArgumentException("maxRetry 不能为负数");
        }
        this.retryCount = retryCount;
        this.maxRetry = maxRetry;
    }

    // ============================================
    // 工厂方法
    // ============================================

    public static RetryPolicy initial(int maxRetry) {
        return new RetryPolicy(0, maxRetry);
    }

    public static RetryPolicy of(int retryCount, int maxRetry) {
        return new RetryPolicy(retryCount, maxRetry);
    }

    // ============================================
    // 业务方法
    // ============================================

    public boolean canRetry() {
        return retryCount < maxRetry;
    }

    /**
     * 增加重试次数（返回新对象）
     */
    public RetryPolicy incrementRetryCount() {
        return new RetryPolicy(retryCount + 1, maxRetry);
    }

    /**
     * 已执行的尝试次数（首次 + 重试）
     */
    public int attempts() {
        return retryCount + 1;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getMaxRetry() {
        return maxRetry;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryPolicy that)) return false;
        return retryCount == that.retryCount && maxRetry == that.maxRetry;
    }

    @Override
    public int hashCode() {
        return 31 * retryCount + maxRetry;
    }

    @Override
    public String toString() {
        return "RetryPolicy{retryCount=" + retryCount + ", maxRetry=" + maxRetry + '}';
    }
}
