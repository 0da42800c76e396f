package xyz.firestige.fleet.infrastructure.execution;

import java.time.Duration;

/**
 * 命令行显式覆盖，null 表示不覆盖
 */
public record ExecutionOverrides(Integer parallelism, Integer retryAttempts, Duration retryDelay) {

    public static final ExecutionOverrides NONE = new ExecutionOverrides(null, null, null);
}
