package xyz.firestige.fleet.infrastructure.execution;

import xyz.firestige.fleet.domain.execution.RetryStrategy;

import java.time.Duration;

/**
 * 固定间隔重试策略
 */
public class FixedDelayRetryStrategy implements RetryStrategy {

    private final Duration delay;

    public FixedDelayRetryStrategy(Duration delay) {
        if (delay == null || delay.isNegative()) throw new IllegalArgumentException("invalid delay");
        this.delay = delay;
    }

    @Override
    public Duration nextDelay(int attempt) {
        return delay;
    }
}
