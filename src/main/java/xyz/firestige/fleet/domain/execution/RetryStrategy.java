package xyz.firestige.fleet.domain.execution;

import java.time.Duration;

/**
 * 重试间隔策略
 */
public interface RetryStrategy {

    /**
     * 第 attempt 次重试前的等待时间
     *
     * @param attempt 重试序号，从 1 开始
     */
    Duration nextDelay(int attempt);
}
