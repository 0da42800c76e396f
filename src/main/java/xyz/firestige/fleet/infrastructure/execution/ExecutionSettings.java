package xyz.firestige.fleet.infrastructure.execution;

import xyz.firestige.fleet.domain.execution.RetryStrategy;

/**
 * 一次运行的执行参数（已按 默认值 < 清单 < 显式覆盖 合并）
 *
 * @param parallelism   阶段内最大并行服务数
 * @param retryAttempts 每个工作项的重试次数
 * @param retryStrategy 重试间隔策略
 */
public record ExecutionSettings(int parallelism, int retryAttempts, RetryStrategy retryStrategy) {

    public ExecutionSettings {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism 必须大于 0");
        }
        if (retryAttempts < 0) {
            throw new IllegalArgumentException("retryAttempts 不能为负数");
        }
    }
}
