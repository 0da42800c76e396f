package xyz.firestige.fleet.infrastructure.execution;

import xyz.firestige.fleet.domain.execution.RetryStrategy;

import java.time.Duration;

/**
 * 指数退避重试策略：initialDelay * multiplier^(attempt-1)，不超过 maxDelay
 */
public class ExponentialBackoffRetryStrategy implements RetryStrategy {

    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;

    public ExponentialBackoffRetryStrategy(Duration initialDelay, double multiplier, Duration maxDelay) {
        if (initialDelay == null || initialDelay.isNegative()) throw new IllegalArgumentException("invalid initialDelay");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier < 1.0");
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay == null ? Duration.ofMinutes(2) : maxDelay;
    }

    @Override
    public Duration nextDelay(int attempt) {
        if (attempt < 1) throw new IllegalArgumentException("attempt < 1");
        double factor = Math.pow(multiplier, attempt - 1);
        long delayMillis = (long) Math.min(initialDelay.toMillis() * factor, (double) maxDelay.toMillis());
        return Duration.ofMillis(delayMillis);
    }
}
